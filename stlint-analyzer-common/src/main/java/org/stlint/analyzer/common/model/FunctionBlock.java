package org.stlint.analyzer.common.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/*
A stateful type with fields (its declarations), a body (implementation), methods and properties.
Single inheritance through extendsName; the base type is looked up by name in the Program.
 */
public record FunctionBlock(String name, String extendsName, boolean isAbstract, Map<String, Declaration> declarations,
                            StatementList implementation, List<Method> methods, List<Property> properties,
                            Path file, String declarationSource, String implementationSource,
                            SourceMeta meta) implements Routine {

    public FunctionBlock {
        declarations = Declarations.frozen(declarations);
        methods = List.copyOf(methods);
        properties = List.copyOf(properties);
    }

    @Override
    public String returnType() {
        return null;
    }

    // own members only; inherited members are found through ScopeContext
    public Method method(String methodName) {
        return methods.stream().filter(m -> Names.equal(m.name(), methodName)).findFirst().orElse(null);
    }

    public Property property(String propertyName) {
        return properties.stream().filter(p -> Names.equal(p.name(), propertyName)).findFirst().orElse(null);
    }

    public boolean declaresMethodOrProperty(String memberName) {
        return method(memberName) != null || property(memberName) != null;
    }

    @Override
    public Shape<?> shape() {
        return Shape.FUNCTION_BLOCK;
    }

    @Override
    public String toString() {
        return "FunctionBlock " + name;
    }

    public static class Builder {
        private final String name;
        private String extendsName;
        private boolean isAbstract;
        private final List<Declaration> declarations = new ArrayList<>();
        private StatementList implementation;
        private final List<Method> methods = new ArrayList<>();
        private final List<Property> properties = new ArrayList<>();
        private Path file;
        private String declarationSource;
        private String implementationSource;
        private SourceMeta meta;

        public Builder(String name) {
            this.name = name;
        }

        public Builder setExtends(String extendsName) {
            this.extendsName = extendsName;
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

        public Builder addMethod(Method method) {
            methods.add(method);
            return this;
        }

        public Builder addProperty(Property property) {
            properties.add(property);
            return this;
        }

        public Builder setFile(Path file) {
            this.file = file;
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

        public FunctionBlock build() {
            return new FunctionBlock(name, extendsName, isAbstract, Declarations.byName(declarations), implementation,
                    methods, properties, file, declarationSource, implementationSource, meta);
        }
    }
}
