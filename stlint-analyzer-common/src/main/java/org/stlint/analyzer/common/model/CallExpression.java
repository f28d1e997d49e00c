package org.stlint.analyzer.common.model;

import java.util.List;

/*
Common view on FunctionCall (an expression) and FunctionCallStatement (a call used as a statement).
The callee is either a SimpleVariable (function, function block body) or a MultiElementVariable
(method of an instance, SUPER^.method).
 */
public interface CallExpression extends Expression {

    Expression name();

    List<ParameterAssignment> parameters();

    // null when the callee is not a simple name
    default String simpleName() {
        return name() instanceof SimpleVariable sv ? sv.name() : null;
    }

    @Override
    default String text() {
        StringBuilder sb = new StringBuilder(name().text()).append('(');
        boolean first = true;
        for (ParameterAssignment pa : parameters()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(pa.text());
        }
        return sb.append(')').toString();
    }
}
