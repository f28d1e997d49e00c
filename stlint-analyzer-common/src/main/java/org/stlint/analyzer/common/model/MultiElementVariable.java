package org.stlint.analyzer.common.model;

import java.util.List;

// name followed by at least one accessor: fbMotor.nSpeed, aValues[i].bOk, SUPER^.M_Init
public record MultiElementVariable(String name, List<Accessor> elements, SourceMeta meta) implements Expression {

    public MultiElementVariable {
        elements = List.copyOf(elements);
    }

    @Override
    public String text() {
        StringBuilder sb = new StringBuilder(name);
        elements.forEach(e -> sb.append(e.text()));
        return sb.toString();
    }

    @Override
    public Shape<?> shape() {
        return Shape.MULTI_ELEMENT_VARIABLE;
    }
}
