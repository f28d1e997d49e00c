package org.stlint.analyzer.common.model;

/*
A variable declaration. The type is kept as it was written: INT, ARRAY [1..10] OF REAL,
REFERENCE TO ST_Axis, FB_Motor. location is the I/O address for AT %I* declarations, or null.
 */
public record Declaration(String name, String type, DeclarationBlock block, boolean hasInitializer,
                          String location, SourceMeta meta) implements Element {

    public Declaration(String name, String type, DeclarationBlock block) {
        this(name, type, block, false, null, null);
    }

    public boolean isInitialized() {
        return hasInitializer || block.initializedExternally();
    }

    @Override
    public Shape<?> shape() {
        return Shape.DECLARATION;
    }
}
