package org.stlint.analyzer.common.model;

import java.util.Arrays;
import java.util.List;

/*
Shorthand constructors for tests that build programs without a parser. Elements carry no
position information unless one is passed explicitly.
 */
public class Ast {

    private Ast() {
    }

    public static SimpleVariable var(String name) {
        return new SimpleVariable(name, null);
    }

    public static SimpleVariable var(String name, SourceMeta meta) {
        return new SimpleVariable(name, meta);
    }

    public static MultiElementVariable field(String name, String... fields) {
        List<Accessor> accessors = Arrays.stream(fields)
                .map(f -> (Accessor) new Accessor.FieldSelector(f, false)).toList();
        return new MultiElementVariable(name, accessors, null);
    }

    public static MultiElementVariable deref(String name, String field) {
        return new MultiElementVariable(name, List.of(new Accessor.FieldSelector(field, true)), null);
    }

    public static MultiElementVariable element(String name, Accessor... accessors) {
        return new MultiElementVariable(name, List.of(accessors), null);
    }

    public static Accessor.SubscriptList subscript(Expression... subscripts) {
        return new Accessor.SubscriptList(List.of(subscripts));
    }

    public static Accessor.FieldSelector select(String field) {
        return new Accessor.FieldSelector(field, false);
    }

    public static Literal intLit(long value) {
        return new Literal(Literal.Kind.INTEGER, Long.toString(value), null, null);
    }

    public static Literal typed(String typeName, String value) {
        Literal.Kind kind = value.contains(".") ? Literal.Kind.REAL : Literal.Kind.INTEGER;
        return new Literal(kind, value, typeName, null);
    }

    public static Literal realLit(String value) {
        return new Literal(Literal.Kind.REAL, value, null, null);
    }

    public static Literal boolLit(boolean value) {
        return new Literal(Literal.Kind.BOOLEAN, value ? "TRUE" : "FALSE", null, null);
    }

    public static Literal stringLit(String value) {
        return new Literal(Literal.Kind.STRING, "'" + value + "'", null, null);
    }

    public static Literal literal(Literal.Kind kind, String value) {
        return new Literal(kind, value, null, null);
    }

    public static BinaryOperation binary(Expression left, String op, Expression right) {
        return new BinaryOperation(op, left, right, null);
    }

    public static BinaryOperation binary(Expression left, String op, Expression right, SourceMeta meta) {
        return new BinaryOperation(op, left, right, meta);
    }

    public static UnaryOperation unary(String op, Expression expression) {
        return new UnaryOperation(op, expression, null);
    }

    public static ParenthesizedExpression parens(Expression expression) {
        return new ParenthesizedExpression(expression, null);
    }

    public static ParameterAssignment arg(Expression value) {
        return new ParameterAssignment(null, value, false, null);
    }

    public static ParameterAssignment arg(String name, Expression value) {
        return new ParameterAssignment(name, value, false, null);
    }

    public static ParameterAssignment out(String name, Expression value) {
        return new ParameterAssignment(name, value, true, null);
    }

    public static FunctionCall call(String name, ParameterAssignment... parameters) {
        return new FunctionCall(var(name), List.of(parameters), null);
    }

    public static FunctionCall call(Expression name, ParameterAssignment... parameters) {
        return new FunctionCall(name, List.of(parameters), null);
    }

    public static FunctionCallStatement callStatement(String name, ParameterAssignment... parameters) {
        return new FunctionCallStatement(var(name), List.of(parameters), null);
    }

    public static FunctionCallStatement callStatement(Expression name, ParameterAssignment... parameters) {
        return new FunctionCallStatement(name, List.of(parameters), null);
    }

    public static AssignmentStatement assign(String variable, Expression value) {
        return assign(var(variable), value);
    }

    public static AssignmentStatement assign(Expression variable, Expression value) {
        return new AssignmentStatement(List.of(variable), value, AssignmentStatement.Kind.ASSIGN, null);
    }

    public static AssignmentStatement assign(Expression variable, Expression value, SourceMeta meta) {
        return new AssignmentStatement(List.of(variable), value, AssignmentStatement.Kind.ASSIGN, meta);
    }

    public static AssignmentStatement set(Expression variable, Expression value) {
        return new AssignmentStatement(List.of(variable), value, AssignmentStatement.Kind.SET, null);
    }

    public static ReferenceAssignmentStatement refAssign(Expression variable, Expression value) {
        return new ReferenceAssignmentStatement(variable, value, null);
    }

    public static StatementList block(Statement... statements) {
        return StatementList.of(statements);
    }

    public static IfStatement ifThen(Expression condition, Statement... statements) {
        return new IfStatement(condition, StatementList.of(statements), List.of(), null, null);
    }

    public static IfStatement ifThenElse(Expression condition, StatementList statements, StatementList elseStatements) {
        return new IfStatement(condition, statements, List.of(), elseStatements, null);
    }

    public static IfStatement ifChain(Expression condition, StatementList statements, List<IfStatement.ElseIf> elseIfs,
                                      StatementList elseStatements) {
        return new IfStatement(condition, statements, elseIfs, elseStatements, null);
    }

    public static IfStatement.ElseIf elsif(Expression condition, Statement... statements) {
        return new IfStatement.ElseIf(condition, StatementList.of(statements));
    }

    public static CaseStatement caseOf(Expression selector, List<CaseStatement.Case> cases, StatementList elseStatements) {
        return new CaseStatement(selector, cases, elseStatements, null);
    }

    public static CaseStatement.Case when(Expression match, Statement... statements) {
        return new CaseStatement.Case(List.of(match), StatementList.of(statements));
    }

    public static WhileStatement whileLoop(Expression condition, Statement... statements) {
        return new WhileStatement(condition, StatementList.of(statements), null);
    }

    public static RepeatStatement repeatLoop(Expression until, Statement... statements) {
        return new RepeatStatement(StatementList.of(statements), until, null);
    }

    public static ForStatement forLoop(String control, Expression from, Expression to, Statement... statements) {
        return new ForStatement(var(control), from, to, null, StatementList.of(statements), null);
    }

    public static ExitStatement exit() {
        return new ExitStatement(null);
    }

    public static ContinueStatement continueLoop() {
        return new ContinueStatement(null);
    }

    public static ReturnStatement ret() {
        return new ReturnStatement(null);
    }

    public static LabeledStatement label(String label, Statement statement) {
        return new LabeledStatement(label, statement, null);
    }

    public static JumpStatement jump(String label) {
        return new JumpStatement(label, null);
    }

    public static Declaration decl(String name, String type, DeclarationBlock block) {
        return new Declaration(name, type, block);
    }

    public static Declaration initialized(String name, String type, DeclarationBlock block) {
        return new Declaration(name, type, block, true, null, null);
    }
}
