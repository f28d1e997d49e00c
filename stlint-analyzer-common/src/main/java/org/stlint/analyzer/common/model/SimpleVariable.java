package org.stlint.analyzer.common.model;

public record SimpleVariable(String name, SourceMeta meta) implements Expression {

    @Override
    public String text() {
        return name;
    }

    @Override
    public Shape<?> shape() {
        return Shape.SIMPLE_VARIABLE;
    }
}
