package org.stlint.analyzer.common.model;

import java.util.List;

public interface Statement extends Element {

    // the statement lists nested directly inside this statement, in source order
    default List<StatementList> subBlocks() {
        return List.of();
    }

    default boolean hasSubBlocks() {
        return !subBlocks().isEmpty();
    }
}
