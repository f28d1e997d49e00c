package org.stlint.analyzer.lint.checks;

import org.stlint.analyzer.common.model.Declaration;
import org.stlint.analyzer.common.model.DeclarationBlock;
import org.stlint.analyzer.common.model.Method;
import org.stlint.analyzer.common.model.Shape;
import org.stlint.analyzer.lint.CheckContext;
import org.stlint.analyzer.lint.LintCheck;
import org.stlint.analyzer.lint.Requirement;
import org.stlint.analyzer.lint.Violation;
import org.stlint.analyzer.prepwork.flow.Assignments;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

// an output without initial value must be assigned on all code paths
public class MethodOutputs implements LintCheck<Method> {

    @Override
    public String code() {
        return "RET002";
    }

    @Override
    public Shape<Method> shape() {
        return Shape.METHOD;
    }

    @Override
    public String description() {
        return "Method must assign its output variables on all code paths";
    }

    @Override
    public Set<Requirement> requirements() {
        return Set.of(Requirement.SCOPE, Requirement.FLOW_GRAPHS);
    }

    @Override
    public List<Violation> check(Method method, CheckContext context) {
        if (method.isAbstract() || !method.hasImplementation()) return List.of();
        List<Violation> violations = new ArrayList<>();
        for (Declaration declaration : method.declarations().values()) {
            if (declaration.block() != DeclarationBlock.VAR_OUTPUT || declaration.isInitialized()) continue;
            if (!Assignments.hasAssignment(context.flowGraphs(), method, declaration.name())) {
                violations.add(Violation.of("Method "
                                            + MethodReturnValue.qualifiedName(context.scope().currentFunctionBlock(),
                        method.name()) + " does not assign to output variable " + declaration.name()
                                            + " on all code paths", declaration));
            }
        }
        return violations;
    }
}
