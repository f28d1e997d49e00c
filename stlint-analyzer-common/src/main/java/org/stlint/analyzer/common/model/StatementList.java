package org.stlint.analyzer.common.model;

import java.util.List;

public record StatementList(List<Statement> statements) {

    public static final StatementList EMPTY = new StatementList(List.of());

    public StatementList {
        statements = List.copyOf(statements);
    }

    public static StatementList of(Statement... statements) {
        return new StatementList(List.of(statements));
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
