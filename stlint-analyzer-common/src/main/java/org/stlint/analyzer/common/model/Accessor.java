package org.stlint.analyzer.common.model;

import java.util.List;
import java.util.stream.Collectors;

// one step of a multi-element variable: [i, j] or .field (^.field when dereferencing a pointer)
public sealed interface Accessor {

    String text();

    record SubscriptList(List<Expression> subscripts) implements Accessor {
        public SubscriptList {
            subscripts = List.copyOf(subscripts);
        }

        @Override
        public String text() {
            return subscripts.stream().map(Expression::text).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    record FieldSelector(String field, boolean dereferenced) implements Accessor {
        @Override
        public String text() {
            return (dereferenced ? "^." : ".") + field;
        }
    }
}
