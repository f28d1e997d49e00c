package org.stlint.analyzer.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/*
The parsed program: read-only after construction, name-keyed maps in insertion order.
 */
public final class Program {
    private final Map<String, FunctionBlock> functionBlocks;
    private final Map<String, GlobalVariableList> globals;
    private final Map<String, DataType> dataTypes;
    private final Map<String, Function> functions;
    private final Map<String, Interface> interfaces;

    private Program(Builder b) {
        this.functionBlocks = Collections.unmodifiableMap(new LinkedHashMap<>(b.functionBlocks));
        this.globals = Collections.unmodifiableMap(new LinkedHashMap<>(b.globals));
        this.dataTypes = Collections.unmodifiableMap(new LinkedHashMap<>(b.dataTypes));
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(b.functions));
        this.interfaces = Collections.unmodifiableMap(new LinkedHashMap<>(b.interfaces));
    }

    public Map<String, FunctionBlock> functionBlocks() {
        return functionBlocks;
    }

    public Map<String, GlobalVariableList> globals() {
        return globals;
    }

    public Map<String, DataType> dataTypes() {
        return dataTypes;
    }

    public Map<String, Function> functions() {
        return functions;
    }

    public Map<String, Interface> interfaces() {
        return interfaces;
    }

    public FunctionBlock functionBlock(String name) {
        return Names.get(functionBlocks, name);
    }

    public DataType dataType(String name) {
        return Names.get(dataTypes, name);
    }

    public Function function(String name) {
        return Names.get(functions, name);
    }

    public static class Builder {
        private final Map<String, FunctionBlock> functionBlocks = new LinkedHashMap<>();
        private final Map<String, GlobalVariableList> globals = new LinkedHashMap<>();
        private final Map<String, DataType> dataTypes = new LinkedHashMap<>();
        private final Map<String, Function> functions = new LinkedHashMap<>();
        private final Map<String, Interface> interfaces = new LinkedHashMap<>();

        public Builder addFunctionBlock(FunctionBlock functionBlock) {
            functionBlocks.put(functionBlock.name(), functionBlock);
            return this;
        }

        public Builder addGlobals(GlobalVariableList globalVariableList) {
            globals.put(globalVariableList.name(), globalVariableList);
            return this;
        }

        public Builder addDataType(DataType dataType) {
            dataTypes.put(dataType.name(), dataType);
            return this;
        }

        public Builder addFunction(Function function) {
            functions.put(function.name(), function);
            return this;
        }

        public Builder addInterface(Interface anInterface) {
            interfaces.put(anInterface.name(), anInterface);
            return this;
        }

        public Program build() {
            return new Program(this);
        }
    }
}
