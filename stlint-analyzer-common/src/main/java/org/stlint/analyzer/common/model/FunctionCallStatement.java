package org.stlint.analyzer.common.model;

import java.util.List;

/*
A call used as a statement. The same object is both a Statement and an expression (CallExpression),
so a traversal can reach it twice: once as statement, once as the outermost expression of itself.
 */
public record FunctionCallStatement(Expression name, List<ParameterAssignment> parameters,
                                    SourceMeta meta) implements Statement, CallExpression {

    public FunctionCallStatement {
        parameters = List.copyOf(parameters);
    }

    @Override
    public Shape<?> shape() {
        return Shape.FUNCTION_CALL_STATEMENT;
    }
}
