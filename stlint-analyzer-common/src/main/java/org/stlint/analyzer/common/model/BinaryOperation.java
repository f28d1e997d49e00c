package org.stlint.analyzer.common.model;

public record BinaryOperation(String op, Expression left, Expression right, SourceMeta meta) implements Expression {

    @Override
    public String text() {
        return left.text() + " " + op + " " + right.text();
    }

    @Override
    public Shape<?> shape() {
        return Shape.BINARY_OPERATION;
    }
}
