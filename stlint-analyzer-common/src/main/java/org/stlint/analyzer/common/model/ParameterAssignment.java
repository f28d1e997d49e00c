package org.stlint.analyzer.common.model;

/*
Argument of a call. Unnamed input: name == null. Named input: name := value.
Output binding: name => value, with output == true. The value may be null for an output
binding that is left open.
 */
public record ParameterAssignment(String name, Expression value, boolean output,
                                  SourceMeta meta) implements Element {

    public String text() {
        String v = value == null ? "" : value.text();
        if (name == null) return v;
        return name + (output ? " => " : " := ") + v;
    }

    @Override
    public Shape<?> shape() {
        return Shape.PARAMETER;
    }
}
