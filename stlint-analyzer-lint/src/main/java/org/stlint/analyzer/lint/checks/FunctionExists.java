package org.stlint.analyzer.lint.checks;

import org.stlint.analyzer.common.ResolutionException;
import org.stlint.analyzer.common.model.FunctionCallStatement;
import org.stlint.analyzer.common.model.Shape;
import org.stlint.analyzer.common.settings.Settings;
import org.stlint.analyzer.lint.CheckContext;
import org.stlint.analyzer.lint.LintCheck;
import org.stlint.analyzer.lint.Requirement;
import org.stlint.analyzer.lint.Violation;
import org.stlint.analyzer.prepwork.scope.ScopeContext;

import java.util.List;
import java.util.Locale;
import java.util.Set;

// a function called by its simple name must exist, with the capitalization of its declaration
public class FunctionExists implements LintCheck<FunctionCallStatement> {

    @Override
    public String code() {
        return "FUNC001";
    }

    @Override
    public Shape<FunctionCallStatement> shape() {
        return Shape.FUNCTION_CALL_STATEMENT;
    }

    @Override
    public String description() {
        return "Called function does not exist, or is written with a different capitalization";
    }

    @Override
    public Set<Requirement> requirements() {
        return Set.of(Requirement.SCOPE, Requirement.SETTINGS);
    }

    @Override
    public List<Violation> check(FunctionCallStatement call, CheckContext context) {
        String name = call.simpleName();
        if (name == null) return List.of();
        Settings settings = context.settings();
        if (settings.builtinFunctions().contains(name)) return List.of();
        ScopeContext scope = context.scope();
        boolean resolved;
        try {
            resolved = scope.resolve(name, true).isResolved();
        } catch (ResolutionException re) {
            return List.of();
        }
        if (resolved) return List.of();
        String upper = name.toUpperCase(Locale.ROOT);
        String suggestion = settings.builtinFunctions().contains(upper) ? upper : scope.suggestion(name);
        String message = "Function " + name + " not found";
        if (suggestion != null) message += ", did you mean '" + suggestion + "'?";
        return List.of(Violation.of(message, call.name()));
    }
}
