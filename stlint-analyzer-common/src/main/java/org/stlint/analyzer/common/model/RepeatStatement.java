package org.stlint.analyzer.common.model;

public record RepeatStatement(StatementList statements, Expression until,
                              SourceMeta meta) implements LoopStatement {

    @Override
    public Shape<?> shape() {
        return Shape.REPEAT;
    }
}
