package org.stlint.analyzer.lint.checks;

import org.stlint.analyzer.common.model.Property;
import org.stlint.analyzer.common.model.PropertyAccessor;
import org.stlint.analyzer.common.model.Shape;
import org.stlint.analyzer.common.model.Statement;
import org.stlint.analyzer.lint.CheckContext;
import org.stlint.analyzer.lint.LintCheck;
import org.stlint.analyzer.lint.Violation;
import org.stlint.analyzer.prepwork.Elements;
import org.stlint.analyzer.prepwork.flow.Assignments;

import java.util.ArrayList;
import java.util.List;

// taking the address of the value is not a write here
public class SetterWritesValue implements LintCheck<Property> {

    @Override
    public String code() {
        return "PROP002";
    }

    @Override
    public Shape<Property> shape() {
        return Shape.PROPERTY;
    }

    @Override
    public String description() {
        return "Property setter must not overwrite the value it is given";
    }

    @Override
    public List<Violation> check(Property property, CheckContext context) {
        PropertyAccessor setter = property.setter();
        if (setter == null) return List.of();
        List<Violation> violations = new ArrayList<>();
        for (Statement statement : Elements.statements(setter)) {
            if (Assignments.isAssignmentFor(property.name(), statement, false)) {
                violations.add(Violation.of("Property setter variable '" + property.name() + "' is written to",
                        statement).withSource(setter));
            }
        }
        return violations;
    }
}
