package org.stlint.analyzer.common.model;

// a bare variable followed by a semicolon
public record NoOpStatement(Expression variable, SourceMeta meta) implements Statement {

    @Override
    public Shape<?> shape() {
        return Shape.NO_OP;
    }
}
