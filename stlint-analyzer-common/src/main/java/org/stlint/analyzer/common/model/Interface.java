package org.stlint.analyzer.common.model;

import java.util.List;

public record Interface(String name, List<String> extendsNames, List<String> methodNames,
                        List<String> propertyNames) {

    public Interface {
        extendsNames = List.copyOf(extendsNames);
        methodNames = List.copyOf(methodNames);
        propertyNames = List.copyOf(propertyNames);
    }
}
