package org.stlint.analyzer.common.model;

import java.util.List;

public interface LoopStatement extends Statement {

    StatementList statements();

    @Override
    default List<StatementList> subBlocks() {
        return List.of(statements());
    }
}
