package org.stlint.analyzer.common.model;

// ref REF= value
public record ReferenceAssignmentStatement(Expression variable, Expression expression,
                                           SourceMeta meta) implements Statement {

    @Override
    public Shape<?> shape() {
        return Shape.REFERENCE_ASSIGNMENT;
    }
}
