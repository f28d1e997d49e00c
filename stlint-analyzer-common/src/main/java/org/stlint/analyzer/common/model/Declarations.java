package org.stlint.analyzer.common.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class Declarations {

    private Declarations() {
    }

    // name-keyed, in declaration order
    public static Map<String, Declaration> byName(Collection<Declaration> declarations) {
        Map<String, Declaration> map = new LinkedHashMap<>();
        for (Declaration declaration : declarations) {
            map.put(declaration.name(), declaration);
        }
        return map;
    }

    // unmodifiable copy that keeps the iteration order
    public static Map<String, Declaration> frozen(Map<String, Declaration> declarations) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(declarations));
    }
}
