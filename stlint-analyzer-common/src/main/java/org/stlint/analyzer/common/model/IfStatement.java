package org.stlint.analyzer.common.model;

import java.util.ArrayList;
import java.util.List;

public record IfStatement(Expression condition, StatementList statements, List<ElseIf> elseIfs,
                          StatementList elseStatements, SourceMeta meta) implements Statement {

    public record ElseIf(Expression condition, StatementList statements) {
    }

    public IfStatement {
        elseIfs = List.copyOf(elseIfs);
    }

    public boolean hasElse() {
        return elseStatements != null;
    }

    @Override
    public List<StatementList> subBlocks() {
        List<StatementList> list = new ArrayList<>();
        list.add(statements);
        elseIfs.forEach(e -> list.add(e.statements()));
        if (elseStatements != null) list.add(elseStatements);
        return list;
    }

    @Override
    public Shape<?> shape() {
        return Shape.IF;
    }
}
