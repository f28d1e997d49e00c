package org.stlint.analyzer.common.model;

public record WhileStatement(Expression condition, StatementList statements,
                             SourceMeta meta) implements LoopStatement {

    @Override
    public Shape<?> shape() {
        return Shape.WHILE;
    }
}
