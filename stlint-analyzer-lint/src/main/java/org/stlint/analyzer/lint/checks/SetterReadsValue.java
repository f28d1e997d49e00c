package org.stlint.analyzer.lint.checks;

import org.stlint.analyzer.common.model.*;
import org.stlint.analyzer.lint.CheckContext;
import org.stlint.analyzer.lint.LintCheck;
import org.stlint.analyzer.lint.Violation;
import org.stlint.analyzer.prepwork.Elements;

import java.util.List;

public class SetterReadsValue implements LintCheck<Property> {

    @Override
    public String code() {
        return "PROP001";
    }

    @Override
    public Shape<Property> shape() {
        return Shape.PROPERTY;
    }

    @Override
    public String description() {
        return "Property setter must use the value it is given";
    }

    @Override
    public List<Violation> check(Property property, CheckContext context) {
        PropertyAccessor setter = property.setter();
        if (setter == null || !setter.hasImplementation()) return List.of();
        for (Expression expression : Elements.allSubExpressions(setter)) {
            if (expression instanceof SimpleVariable sv && Names.equal(sv.name(), property.name())) {
                return List.of();
            }
        }
        return List.of(Violation.of("Property setter variable '" + property.name() + "' is never read", setter)
                .withSource(setter));
    }
}
