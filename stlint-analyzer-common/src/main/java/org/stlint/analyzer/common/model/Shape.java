package org.stlint.analyzer.common.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/*
Closed set of node-shape tags. Lint checks are registered per shape; an element matches its own
shape and every ancestor shape, so a function call statement is seen by checks on STATEMENT,
FUNCTION_CALL_STATEMENT, CALL and EXPRESSION.
 */
public final class Shape<T extends Element> {

    public static final Shape<Statement> STATEMENT = new Shape<>("statement", Statement.class);
    public static final Shape<Expression> EXPRESSION = new Shape<>("expression", Expression.class);
    public static final Shape<CallExpression> CALL = new Shape<>("call", CallExpression.class, EXPRESSION);
    public static final Shape<Routine> ROUTINE = new Shape<>("routine", Routine.class);

    public static final Shape<AssignmentStatement> ASSIGNMENT =
            new Shape<>("assignment", AssignmentStatement.class, STATEMENT);
    public static final Shape<ReferenceAssignmentStatement> REFERENCE_ASSIGNMENT =
            new Shape<>("referenceAssignment", ReferenceAssignmentStatement.class, STATEMENT);
    public static final Shape<FunctionCallStatement> FUNCTION_CALL_STATEMENT =
            new Shape<>("functionCallStatement", FunctionCallStatement.class, STATEMENT, CALL);
    public static final Shape<IfStatement> IF = new Shape<>("if", IfStatement.class, STATEMENT);
    public static final Shape<CaseStatement> CASE = new Shape<>("case", CaseStatement.class, STATEMENT);
    public static final Shape<WhileStatement> WHILE = new Shape<>("while", WhileStatement.class, STATEMENT);
    public static final Shape<RepeatStatement> REPEAT = new Shape<>("repeat", RepeatStatement.class, STATEMENT);
    public static final Shape<ForStatement> FOR = new Shape<>("for", ForStatement.class, STATEMENT);
    public static final Shape<ExitStatement> EXIT = new Shape<>("exit", ExitStatement.class, STATEMENT);
    public static final Shape<ContinueStatement> CONTINUE =
            new Shape<>("continue", ContinueStatement.class, STATEMENT);
    public static final Shape<ReturnStatement> RETURN = new Shape<>("return", ReturnStatement.class, STATEMENT);
    public static final Shape<LabeledStatement> LABELED = new Shape<>("labeled", LabeledStatement.class, STATEMENT);
    public static final Shape<JumpStatement> JUMP = new Shape<>("jump", JumpStatement.class, STATEMENT);
    public static final Shape<NoOpStatement> NO_OP = new Shape<>("noOp", NoOpStatement.class, STATEMENT);

    public static final Shape<Literal> LITERAL = new Shape<>("literal", Literal.class, EXPRESSION);
    public static final Shape<SimpleVariable> SIMPLE_VARIABLE =
            new Shape<>("simpleVariable", SimpleVariable.class, EXPRESSION);
    public static final Shape<MultiElementVariable> MULTI_ELEMENT_VARIABLE =
            new Shape<>("multiElementVariable", MultiElementVariable.class, EXPRESSION);
    public static final Shape<DirectVariable> DIRECT_VARIABLE =
            new Shape<>("directVariable", DirectVariable.class, EXPRESSION);
    public static final Shape<UnaryOperation> UNARY_OPERATION =
            new Shape<>("unaryOperation", UnaryOperation.class, EXPRESSION);
    public static final Shape<BinaryOperation> BINARY_OPERATION =
            new Shape<>("binaryOperation", BinaryOperation.class, EXPRESSION);
    public static final Shape<ParenthesizedExpression> PARENTHESIZED =
            new Shape<>("parenthesized", ParenthesizedExpression.class, EXPRESSION);
    public static final Shape<FunctionCall> FUNCTION_CALL = new Shape<>("functionCall", FunctionCall.class, CALL);
    public static final Shape<ParameterAssignment> PARAMETER =
            new Shape<>("parameter", ParameterAssignment.class);

    public static final Shape<FunctionBlock> FUNCTION_BLOCK =
            new Shape<>("functionBlock", FunctionBlock.class, ROUTINE);
    public static final Shape<Method> METHOD = new Shape<>("method", Method.class, ROUTINE);
    public static final Shape<PropertyAccessor> PROPERTY_ACCESSOR =
            new Shape<>("propertyAccessor", PropertyAccessor.class, ROUTINE);
    public static final Shape<Function> FUNCTION = new Shape<>("function", Function.class, ROUTINE);
    public static final Shape<Property> PROPERTY = new Shape<>("property", Property.class);
    public static final Shape<Declaration> DECLARATION = new Shape<>("declaration", Declaration.class);

    private final String name;
    private final Class<T> type;
    private final List<Shape<?>> lineage;

    private Shape(String name, Class<T> type, Shape<?>... parents) {
        this.name = name;
        this.type = type;
        Set<Shape<?>> set = new LinkedHashSet<>();
        set.add(this);
        for (Shape<?> parent : parents) {
            set.addAll(parent.lineage);
        }
        this.lineage = List.copyOf(new ArrayList<>(set));
    }

    public String name() {
        return name;
    }

    public Class<T> type() {
        return type;
    }

    // this shape first, then the lineage of each parent in declaration order, without duplicates
    public List<Shape<?>> lineage() {
        return lineage;
    }

    public boolean matches(Element element) {
        return element.shape().lineage.contains(this);
    }

    public T cast(Element element) {
        return type.cast(element);
    }

    @Override
    public String toString() {
        return name;
    }
}
