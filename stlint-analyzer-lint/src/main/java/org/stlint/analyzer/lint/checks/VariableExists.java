package org.stlint.analyzer.lint.checks;

import org.stlint.analyzer.common.model.Shape;
import org.stlint.analyzer.common.model.SimpleVariable;
import org.stlint.analyzer.lint.CheckContext;
import org.stlint.analyzer.lint.LintCheck;
import org.stlint.analyzer.lint.Requirement;
import org.stlint.analyzer.lint.Violation;
import org.stlint.analyzer.prepwork.scope.Resolution;
import org.stlint.analyzer.prepwork.scope.ScopeContext;

import java.util.List;
import java.util.Set;

// a referenced variable must exist, with the capitalization of its declaration
public class VariableExists implements LintCheck<SimpleVariable> {

    @Override
    public String code() {
        return "VAR001";
    }

    @Override
    public Shape<SimpleVariable> shape() {
        return Shape.SIMPLE_VARIABLE;
    }

    @Override
    public String description() {
        return "Variable does not exist, or is written with a different capitalization";
    }

    @Override
    public Set<Requirement> requirements() {
        return Set.of(Requirement.SCOPE);
    }

    @Override
    public List<Violation> check(SimpleVariable variable, CheckContext context) {
        ScopeContext scope = context.scope();
        Resolution resolution = scope.resolve(variable.name(), true);
        // failures with a diagnostic are reported as invalid scoping
        if (resolution.isResolved() || resolution.diagnostic() != null) return List.of();
        String message = "Variable " + variable.name() + " cannot be found in the current context";
        String suggestion = scope.suggestion(variable.name());
        if (suggestion != null) message += ", did you mean '" + suggestion + "'?";
        return List.of(Violation.of(message, variable));
    }
}
