package org.stlint.analyzer.common.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/*
Getter or setter of a property. Its name is the property name: inside the getter that name is
the return value, inside the setter it is the value being set.
 */
public record PropertyAccessor(String name, Kind kind, String returnType, Map<String, Declaration> declarations,
                               StatementList implementation, String declarationSource,
                               String implementationSource, SourceMeta meta) implements Routine {

    public enum Kind {GET, SET}

    public PropertyAccessor {
        declarations = Declarations.frozen(declarations);
    }

    @Override
    public Shape<?> shape() {
        return Shape.PROPERTY_ACCESSOR;
    }

    public static class Builder {
        private final String name;
        private final Kind kind;
        private final String returnType;
        private final List<Declaration> declarations = new ArrayList<>();
        private StatementList implementation;
        private String declarationSource;
        private String implementationSource;
        private SourceMeta meta;

        public Builder(String name, Kind kind, String returnType) {
            this.name = name;
            this.kind = kind;
            this.returnType = returnType;
        }

        public Builder addDeclaration(Declaration declaration) {
            declarations.add(declaration);
            return this;
        }

        public Builder setImplementation(Statement... statements) {
            this.implementation = StatementList.of(statements);
            return this;
        }

        public Builder setImplementation(StatementList implementation) {
            this.implementation = implementation;
            return this;
        }

        public Builder setDeclarationSource(String declarationSource) {
            this.declarationSource = declarationSource;
            return this;
        }

        public Builder setImplementationSource(String implementationSource) {
            this.implementationSource = implementationSource;
            return this;
        }

        public Builder setMeta(SourceMeta meta) {
            this.meta = meta;
            return this;
        }

        public PropertyAccessor build() {
            return new PropertyAccessor(name, kind, returnType, Declarations.byName(declarations), implementation,
                    declarationSource, implementationSource, meta);
        }
    }
}
