package org.stlint.analyzer.common.model;

public record ParenthesizedExpression(Expression expression, SourceMeta meta) implements Expression {

    @Override
    public String text() {
        return "(" + expression.text() + ")";
    }

    @Override
    public Shape<?> shape() {
        return Shape.PARENTHESIZED;
    }
}
