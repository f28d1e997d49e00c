package org.stlint.analyzer.common.model;

import java.util.List;

/*
a := b (ASSIGN), a S= b (SET), a R= b (RESET). Chained assignments (a := b := c) have more than
one variable.
 */
public record AssignmentStatement(List<Expression> variables, Expression expression, Kind kind,
                                  SourceMeta meta) implements Statement {

    public enum Kind {ASSIGN, SET, RESET}

    public AssignmentStatement {
        variables = List.copyOf(variables);
    }

    @Override
    public Shape<?> shape() {
        return Shape.ASSIGNMENT;
    }
}
