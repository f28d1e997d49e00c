package org.stlint.analyzer.common.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record Method(String name, String returnType, boolean isAbstract, Map<String, Declaration> declarations,
                     StatementList implementation, String declarationSource, String implementationSource,
                     SourceMeta meta) implements Routine {

    public Method {
        declarations = Declarations.frozen(declarations);
    }

    @Override
    public Shape<?> shape() {
        return Shape.METHOD;
    }

    public static class Builder {
        private final String name;
        private String returnType;
        private boolean isAbstract;
        private final List<Declaration> declarations = new ArrayList<>();
        private StatementList implementation;
        private String declarationSource;
        private String implementationSource;
        private SourceMeta meta;

        public Builder(String name) {
            this.name = name;
        }

        public Builder setReturnType(String returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder setAbstract(boolean isAbstract) {
            this.isAbstract = isAbstract;
            return this;
        }

        public Builder addDeclaration(Declaration declaration) {
            declarations.add(declaration);
            return this;
        }

        public Builder setImplementation(StatementList implementation) {
            this.implementation = implementation;
            return this;
        }

        public Builder setImplementation(Statement... statements) {
            this.implementation = StatementList.of(statements);
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

        public Method build() {
            return new Method(name, returnType, isAbstract, Declarations.byName(declarations), implementation,
                    declarationSource, implementationSource, meta);
        }
    }
}
