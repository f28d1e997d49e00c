package org.stlint.analyzer.lint;

import org.stlint.analyzer.common.model.Element;
import org.stlint.analyzer.common.model.Shape;

import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;

record FunctionLintCheck<T extends Element>(String code, Shape<T> shape, String description,
                                            Set<Requirement> requirements,
                                            BiFunction<T, CheckContext, List<Violation>> function)
        implements LintCheck<T> {

    @Override
    public List<Violation> check(T element, CheckContext context) {
        return function.apply(element, context);
    }
}
