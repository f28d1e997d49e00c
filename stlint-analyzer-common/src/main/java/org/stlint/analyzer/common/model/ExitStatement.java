package org.stlint.analyzer.common.model;

public record ExitStatement(SourceMeta meta) implements Statement {

    @Override
    public Shape<?> shape() {
        return Shape.EXIT;
    }
}
