package org.stlint.analyzer.common.model;

import java.util.List;

public record FunctionCall(Expression name, List<ParameterAssignment> parameters,
                           SourceMeta meta) implements CallExpression {

    public FunctionCall {
        parameters = List.copyOf(parameters);
    }

    @Override
    public Shape<?> shape() {
        return Shape.FUNCTION_CALL;
    }
}
