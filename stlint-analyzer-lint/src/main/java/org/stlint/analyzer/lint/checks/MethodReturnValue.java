package org.stlint.analyzer.lint.checks;

import org.stlint.analyzer.common.model.FunctionBlock;
import org.stlint.analyzer.common.model.Method;
import org.stlint.analyzer.common.model.Shape;
import org.stlint.analyzer.lint.CheckContext;
import org.stlint.analyzer.lint.LintCheck;
import org.stlint.analyzer.lint.Requirement;
import org.stlint.analyzer.lint.Violation;
import org.stlint.analyzer.prepwork.flow.Assignments;

import java.util.List;
import java.util.Set;

public class MethodReturnValue implements LintCheck<Method> {

    @Override
    public String code() {
        return "RET001";
    }

    @Override
    public Shape<Method> shape() {
        return Shape.METHOD;
    }

    @Override
    public String description() {
        return "Method with a return type must assign its return value on all code paths";
    }

    @Override
    public Set<Requirement> requirements() {
        return Set.of(Requirement.SCOPE, Requirement.FLOW_GRAPHS);
    }

    @Override
    public List<Violation> check(Method method, CheckContext context) {
        if (method.isAbstract() || !method.hasImplementation() || method.returnType() == null) return List.of();
        if (Assignments.hasAssignment(context.flowGraphs(), method, method.name())) return List.of();
        return List.of(Violation.of("Method " + qualifiedName(context.scope().currentFunctionBlock(), method.name())
                                    + " does not return a value on all code paths, even though it should (return type "
                                    + method.returnType() + ")", method));
    }

    static String qualifiedName(FunctionBlock functionBlock, String name) {
        return functionBlock == null ? name : functionBlock.name() + "." + name;
    }
}
