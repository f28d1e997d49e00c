package org.stlint.analyzer.lint.checks;

import org.stlint.analyzer.common.model.BinaryOperation;
import org.stlint.analyzer.common.model.Shape;
import org.stlint.analyzer.common.types.TypeSystem;
import org.stlint.analyzer.lint.CheckContext;
import org.stlint.analyzer.lint.LintCheck;
import org.stlint.analyzer.lint.Requirement;
import org.stlint.analyzer.lint.Violation;

import java.util.List;
import java.util.Set;

public class UnsignedSubtraction implements LintCheck<BinaryOperation> {

    @Override
    public String code() {
        return "EXP001";
    }

    @Override
    public Shape<BinaryOperation> shape() {
        return Shape.BINARY_OPERATION;
    }

    @Override
    public String description() {
        return "Subtraction in an unsigned integer type may underflow";
    }

    @Override
    public Set<Requirement> requirements() {
        return Set.of(Requirement.SCOPE);
    }

    @Override
    public List<Violation> check(BinaryOperation operation, CheckContext context) {
        if (!"-".equals(operation.op())) return List.of();
        String type = context.scope().getExprType(operation);
        if (TypeSystem.isUnsignedInteger(type)) {
            return List.of(Violation.of("Potential unsigned integer underflow in subtraction expression", operation));
        }
        return List.of();
    }
}
