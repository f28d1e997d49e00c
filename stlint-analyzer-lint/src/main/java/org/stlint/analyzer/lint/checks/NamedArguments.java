package org.stlint.analyzer.lint.checks;

import org.stlint.analyzer.common.model.*;
import org.stlint.analyzer.common.settings.Settings;
import org.stlint.analyzer.lint.CheckContext;
import org.stlint.analyzer.lint.LintCheck;
import org.stlint.analyzer.lint.Requirement;
import org.stlint.analyzer.lint.Violation;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/*
Calls with more than the configured number of arguments must name them, so that arguments of
compatible types cannot be swapped by accident. Functions and methods can be exempted; a method
either by name or as TYPE.METHOD, where TYPE is the declared type of the instance.
 */
public class NamedArguments implements LintCheck<FunctionCallStatement> {

    @Override
    public String code() {
        return "ARG001";
    }

    @Override
    public Shape<FunctionCallStatement> shape() {
        return Shape.FUNCTION_CALL_STATEMENT;
    }

    @Override
    public String description() {
        return "Calls with many arguments must use named arguments";
    }

    @Override
    public Set<Requirement> requirements() {
        return Set.of(Requirement.SCOPE, Requirement.SETTINGS);
    }

    @Override
    public List<Violation> check(FunctionCallStatement call, CheckContext context) {
        Settings settings = context.settings();
        if (call.parameters().size() <= settings.maxNamelessArgs()) return List.of();
        String callee = call.name().text();
        if (settings.allowsNamelessArgs(callee)) return List.of();

        String methodName;
        String baseType = null;
        if (call.name() instanceof MultiElementVariable mev) {
            List<Accessor> elements = mev.elements();
            Accessor last = elements.isEmpty() ? null : elements.get(elements.size() - 1);
            if (last instanceof Accessor.FieldSelector fs) {
                methodName = fs.field();
                baseType = context.scope().getMultiElementType(mev.name(), elements.subList(0, elements.size() - 1));
            } else {
                // the body of a function block in an array
                methodName = null;
            }
        } else {
            methodName = call.simpleName();
            FunctionBlock functionBlock = context.scope().currentFunctionBlock();
            if (functionBlock != null) baseType = functionBlock.name();
        }
        if (methodName != null && settings.allowsNamelessArgs(baseType, methodName)) return List.of();
        if (settings.namelessArgMethods().contains(callee)) return List.of();

        String suffix = baseType == null ? "" : " (function block method " + baseType + ":" + methodName + ")";
        List<Violation> violations = new ArrayList<>();
        for (ParameterAssignment parameter : call.parameters()) {
            if (!parameter.output() && parameter.name() == null) {
                violations.add(Violation.of("Unnamed parameter in function call to " + callee + suffix, parameter));
            }
        }
        return violations;
    }
}
