package org.stlint.analyzer.common.model;

import java.util.List;
import java.util.Map;

public record Function(String name, String returnType, Map<String, Declaration> declarations,
                       StatementList implementation, String declarationSource, String implementationSource,
                       SourceMeta meta) implements Routine {

    public Function {
        declarations = Declarations.frozen(declarations);
    }

    public Function(String name, String returnType, List<Declaration> declarations) {
        this(name, returnType, Declarations.byName(declarations), null, null, null, null);
    }

    @Override
    public Shape<?> shape() {
        return Shape.FUNCTION;
    }
}
