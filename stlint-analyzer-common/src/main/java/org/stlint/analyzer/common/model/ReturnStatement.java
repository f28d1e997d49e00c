package org.stlint.analyzer.common.model;

public record ReturnStatement(SourceMeta meta) implements Statement {

    @Override
    public Shape<?> shape() {
        return Shape.RETURN;
    }
}
