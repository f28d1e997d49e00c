package org.stlint.analyzer.common.model;

public record UnaryOperation(String op, Expression expression, SourceMeta meta) implements Expression {

    @Override
    public String text() {
        return op.length() > 1 ? op + " " + expression.text() : op + expression.text();
    }

    @Override
    public Shape<?> shape() {
        return Shape.UNARY_OPERATION;
    }
}
