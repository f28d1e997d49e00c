package org.stlint.analyzer.common.model;

import java.util.List;
import java.util.Map;

public record GlobalVariableList(String name, Map<String, Declaration> declarations) {

    public GlobalVariableList {
        declarations = Declarations.frozen(declarations);
    }

    public GlobalVariableList(String name, List<Declaration> declarations) {
        this(name, Declarations.byName(declarations));
    }
}
