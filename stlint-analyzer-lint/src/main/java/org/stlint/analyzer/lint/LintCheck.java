package org.stlint.analyzer.lint;

import org.stlint.analyzer.common.model.Element;
import org.stlint.analyzer.common.model.Shape;

import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;

/*
A rule: a function from one element of the accepted shape, and its context, to violations.
The code must be unique in a registry and match [A-Z]{2,4}[0-9]{3,4}.
 */
public interface LintCheck<T extends Element> {

    String code();

    Shape<T> shape();

    String description();

    default Set<Requirement> requirements() {
        return Set.of();
    }

    List<Violation> check(T element, CheckContext context);

    static <T extends Element> LintCheck<T> of(String code, Shape<T> shape, String description,
                                               Set<Requirement> requirements,
                                               BiFunction<T, CheckContext, List<Violation>> function) {
        return new FunctionLintCheck<>(code, shape, description, Set.copyOf(requirements), function);
    }
}
