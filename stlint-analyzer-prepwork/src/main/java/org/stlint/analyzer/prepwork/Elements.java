package org.stlint.analyzer.prepwork;

import org.stlint.analyzer.common.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/*
Structural traversal of statements and expressions. Unlike the flow graph, this includes code that
can never be reached.
 */
public class Elements {

    private Elements() {
    }

    public static List<Statement> statements(Routine routine) {
        return routine.implementation() == null ? List.of() : statements(routine.implementation());
    }

    // pre-order: a compound statement comes before the statements nested in it
    public static List<Statement> statements(StatementList statementList) {
        List<Statement> result = new ArrayList<>();
        addStatements(statementList, result);
        return result;
    }

    private static void addStatements(StatementList statementList, List<Statement> result) {
        for (Statement statement : statementList.statements()) {
            addStatement(statement, result);
        }
    }

    private static void addStatement(Statement statement, List<Statement> result) {
        result.add(statement);
        if (statement instanceof LabeledStatement ls && ls.statement() != null) {
            addStatement(ls.statement(), result);
        }
        for (StatementList sub : statement.subBlocks()) {
            addStatements(sub, result);
        }
    }

    /*
    The expressions directly held by a statement, not those of nested statements. Targets of
    assignments, output bindings and the control variable of a FOR loop only when includeAssigned.
    A call statement is its own expression.
     */
    public static List<Expression> expressions(Statement statement, boolean includeAssigned) {
        List<Expression> result = new ArrayList<>();
        if (statement instanceof AssignmentStatement as) {
            if (includeAssigned) result.addAll(as.variables());
            result.add(as.expression());
        } else if (statement instanceof ReferenceAssignmentStatement ras) {
            if (includeAssigned) result.add(ras.variable());
            result.add(ras.expression());
        } else if (statement instanceof FunctionCallStatement fcs) {
            result.add(fcs);
        } else if (statement instanceof IfStatement is) {
            result.add(is.condition());
            is.elseIfs().forEach(e -> result.add(e.condition()));
        } else if (statement instanceof CaseStatement cs) {
            result.add(cs.expression());
            cs.cases().forEach(c -> result.addAll(c.matches()));
        } else if (statement instanceof WhileStatement ws) {
            result.add(ws.condition());
        } else if (statement instanceof RepeatStatement rs) {
            result.add(rs.until());
        } else if (statement instanceof ForStatement fs) {
            if (includeAssigned) result.add(fs.control());
            result.add(fs.from());
            result.add(fs.to());
            if (fs.step() != null) result.add(fs.step());
        } else if (statement instanceof NoOpStatement nos) {
            result.add(nos.variable());
        }
        return result;
    }

    public static List<Expression> expressions(Statement statement) {
        return expressions(statement, false);
    }

    /*
    The expression itself followed by its sub-expressions, pre-order. An excluded expression is
    skipped together with everything below it. The callee of a call is not visited; the values
    bound to output parameters only when includeAssigned.
     */
    public static List<Expression> subExpressions(Expression expression, Predicate<Expression> exclude,
                                                  boolean includeAssigned) {
        List<Expression> result = new ArrayList<>();
        addSubExpressions(expression, exclude, includeAssigned, result);
        return result;
    }

    public static List<Expression> subExpressions(Expression expression) {
        return subExpressions(expression, null, false);
    }

    private static void addSubExpressions(Expression expression, Predicate<Expression> exclude,
                                          boolean includeAssigned, List<Expression> result) {
        if (expression == null || exclude != null && exclude.test(expression)) return;
        result.add(expression);
        if (expression instanceof UnaryOperation uo) {
            addSubExpressions(uo.expression(), exclude, includeAssigned, result);
        } else if (expression instanceof BinaryOperation bo) {
            addSubExpressions(bo.left(), exclude, includeAssigned, result);
            addSubExpressions(bo.right(), exclude, includeAssigned, result);
        } else if (expression instanceof ParenthesizedExpression pe) {
            addSubExpressions(pe.expression(), exclude, includeAssigned, result);
        } else if (expression instanceof CallExpression call) {
            for (ParameterAssignment pa : call.parameters()) {
                if (pa.output() && !includeAssigned) continue;
                addSubExpressions(pa.value(), exclude, includeAssigned, result);
            }
        } else if (expression instanceof MultiElementVariable mev) {
            for (Accessor accessor : mev.elements()) {
                if (accessor instanceof Accessor.SubscriptList sl) {
                    sl.subscripts().forEach(s -> addSubExpressions(s, exclude, includeAssigned, result));
                }
            }
        }
    }

    // all sub-expressions of all statements of the routine, reachable or not
    public static List<Expression> allSubExpressions(Routine routine) {
        List<Expression> result = new ArrayList<>();
        for (Statement statement : statements(routine)) {
            for (Expression expression : expressions(statement)) {
                addSubExpressions(expression, null, false, result);
            }
        }
        return result;
    }
}
