package org.stlint.analyzer.lint.checks;

import org.stlint.analyzer.common.model.*;
import org.stlint.analyzer.lint.CheckContext;
import org.stlint.analyzer.lint.LintCheck;
import org.stlint.analyzer.lint.Violation;

import java.util.List;

/*
Only constant divisors are accepted, and SIZEOF(...), which is never zero.
 */
public class DivisionByZero implements LintCheck<BinaryOperation> {

    @Override
    public String code() {
        return "EXP002";
    }

    @Override
    public Shape<BinaryOperation> shape() {
        return Shape.BINARY_OPERATION;
    }

    @Override
    public String description() {
        return "Division by a non-constant divisor may divide by zero";
    }

    @Override
    public List<Violation> check(BinaryOperation operation, CheckContext context) {
        if (!"/".equals(operation.op())) return List.of();
        Expression divisor = operation.right();
        while (divisor instanceof ParenthesizedExpression pe) divisor = pe.expression();
        if (divisor instanceof Literal) return List.of();
        if (divisor instanceof CallExpression call && Names.equal(call.simpleName(), "SIZEOF")) return List.of();
        return List.of(Violation.of("Potential division by zero", operation));
    }
}
