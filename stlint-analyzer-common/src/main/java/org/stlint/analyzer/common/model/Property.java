package org.stlint.analyzer.common.model;

// getter and setter may each be absent
public record Property(String name, String type, PropertyAccessor getter, PropertyAccessor setter,
                       SourceMeta meta) implements Element {

    public Property(String name, String type, PropertyAccessor getter, PropertyAccessor setter) {
        this(name, type, getter, setter, null);
    }

    @Override
    public Shape<?> shape() {
        return Shape.PROPERTY;
    }
}
