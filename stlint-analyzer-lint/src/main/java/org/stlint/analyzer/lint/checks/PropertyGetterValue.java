package org.stlint.analyzer.lint.checks;

import org.stlint.analyzer.common.model.Property;
import org.stlint.analyzer.common.model.PropertyAccessor;
import org.stlint.analyzer.common.model.Shape;
import org.stlint.analyzer.lint.CheckContext;
import org.stlint.analyzer.lint.LintCheck;
import org.stlint.analyzer.lint.Requirement;
import org.stlint.analyzer.lint.Violation;
import org.stlint.analyzer.prepwork.flow.Assignments;

import java.util.List;
import java.util.Set;

public class PropertyGetterValue implements LintCheck<Property> {

    @Override
    public String code() {
        return "RET101";
    }

    @Override
    public Shape<Property> shape() {
        return Shape.PROPERTY;
    }

    @Override
    public String description() {
        return "Property getter must assign the property value on all code paths";
    }

    @Override
    public Set<Requirement> requirements() {
        return Set.of(Requirement.SCOPE, Requirement.FLOW_GRAPHS);
    }

    @Override
    public List<Violation> check(Property property, CheckContext context) {
        PropertyAccessor getter = property.getter();
        if (getter == null || !getter.hasImplementation()) return List.of();
        if (Assignments.hasAssignment(context.flowGraphs(), getter, property.name())) return List.of();
        String name = MethodReturnValue.qualifiedName(context.scope().currentFunctionBlock(), property.name());
        return List.of(Violation.of("Property getter " + name
                                    + " does not return a value on all code paths, even though it should (property type "
                                    + property.type() + ")",
                getter).withSource(getter));
    }
}
