package org.stlint.analyzer.common.model;

// %IX0.1, %QW4, ...
public record DirectVariable(String location, SourceMeta meta) implements Expression {

    @Override
    public String text() {
        return location;
    }

    @Override
    public Shape<?> shape() {
        return Shape.DIRECT_VARIABLE;
    }
}
