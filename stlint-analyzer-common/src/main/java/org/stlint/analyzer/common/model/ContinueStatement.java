package org.stlint.analyzer.common.model;

public record ContinueStatement(SourceMeta meta) implements Statement {

    @Override
    public Shape<?> shape() {
        return Shape.CONTINUE;
    }
}
