package org.stlint.analyzer.prepwork.scope;

/*
Result of a name resolution.

name: the name as it was declared (the suggestion for a mis-capitalized reference), or null.
type: the declared type, or null when unresolved or complex.
complex: the name denotes a type, a function, or a method: something that has no value type.
diagnostic: why the resolution failed, when there is something to say about it.
 */
public record Resolution(String name, String type, boolean complex, String diagnostic) {

    public static final Resolution UNRESOLVED = new Resolution(null, null, false, null);

    public static Resolution of(String name, String type) {
        return new Resolution(name, type, false, null);
    }

    public static Resolution ofComplex(String name) {
        return new Resolution(name, null, true, null);
    }

    public static Resolution failed(String name, String diagnostic) {
        return new Resolution(name, null, false, diagnostic);
    }

    public boolean isResolved() {
        return complex || type != null;
    }
}
