package org.stlint.analyzer.common.model;

import java.util.Map;

/*
Anything with an executable statement list: function block body, method, property accessor,
function.
 */
public interface Routine extends Element {

    String name();

    Map<String, Declaration> declarations();

    // null when the routine has no implementation (abstract methods, declaration-only blocks)
    StatementList implementation();

    // null for routines without return value
    String returnType();

    // source text of the declaration section, used to render locations of declarations
    String declarationSource();

    // source text of the implementation, used to render locations of statements and expressions
    String implementationSource();

    default boolean hasImplementation() {
        return implementation() != null;
    }
}
