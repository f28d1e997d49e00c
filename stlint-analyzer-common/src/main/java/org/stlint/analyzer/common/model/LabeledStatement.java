package org.stlint.analyzer.common.model;

// label: statement; the statement may be absent
public record LabeledStatement(String label, Statement statement, SourceMeta meta) implements Statement {

    @Override
    public Shape<?> shape() {
        return Shape.LABELED;
    }
}
