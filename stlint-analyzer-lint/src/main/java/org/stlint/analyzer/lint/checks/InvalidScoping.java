package org.stlint.analyzer.lint.checks;

import org.stlint.analyzer.common.ResolutionException;
import org.stlint.analyzer.common.model.Shape;
import org.stlint.analyzer.common.model.SimpleVariable;
import org.stlint.analyzer.lint.CheckContext;
import org.stlint.analyzer.lint.LintCheck;
import org.stlint.analyzer.lint.Requirement;
import org.stlint.analyzer.lint.Violation;
import org.stlint.analyzer.prepwork.scope.Resolution;

import java.util.List;
import java.util.Set;

/*
THIS or SUPER where there is no function block, SUPER where no base declares the current member,
the name of a routine without return value used as a variable.
 */
public class InvalidScoping implements LintCheck<SimpleVariable> {

    @Override
    public String code() {
        return "VAR000";
    }

    @Override
    public Shape<SimpleVariable> shape() {
        return Shape.SIMPLE_VARIABLE;
    }

    @Override
    public String description() {
        return "Variable used in a scope where it has no meaning";
    }

    @Override
    public Set<Requirement> requirements() {
        return Set.of(Requirement.SCOPE);
    }

    @Override
    public List<Violation> check(SimpleVariable variable, CheckContext context) {
        Resolution resolution;
        try {
            resolution = context.scope().resolve(variable.name());
        } catch (ResolutionException re) {
            return List.of(Violation.of(re.getMessage(), variable));
        }
        if (resolution.diagnostic() != null && resolution.type() == null) {
            return List.of(Violation.of("Cannot resolve " + variable.name() + ": " + resolution.diagnostic(), variable));
        }
        return List.of();
    }
}
