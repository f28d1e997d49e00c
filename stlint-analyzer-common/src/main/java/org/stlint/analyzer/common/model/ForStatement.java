package org.stlint.analyzer.common.model;

// FOR control := from TO to [BY step] DO statements END_FOR; step may be null
public record ForStatement(SimpleVariable control, Expression from, Expression to, Expression step,
                           StatementList statements, SourceMeta meta) implements LoopStatement {

    @Override
    public Shape<?> shape() {
        return Shape.FOR;
    }
}
