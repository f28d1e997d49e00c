package org.stlint.analyzer.lint.checks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stlint.analyzer.common.model.*;
import org.stlint.analyzer.lint.CheckContext;
import org.stlint.analyzer.lint.LintCheck;
import org.stlint.analyzer.lint.Requirement;
import org.stlint.analyzer.lint.Violation;
import org.stlint.analyzer.prepwork.scope.ScopeContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/*
A CASE over an enumeration without ELSE must have an arm for every value. Matches are the qualified
value E.V, or the bare value V.
 */
public class EnumCaseCoverage implements LintCheck<CaseStatement> {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnumCaseCoverage.class);

    @Override
    public String code() {
        return "STAT001";
    }

    @Override
    public Shape<CaseStatement> shape() {
        return Shape.CASE;
    }

    @Override
    public String description() {
        return "Case statement over an enumeration must cover all values, or have an else clause";
    }

    @Override
    public Set<Requirement> requirements() {
        return Set.of(Requirement.SCOPE);
    }

    @Override
    public List<Violation> check(CaseStatement statement, CheckContext context) {
        if (statement.hasElse()) return List.of();
        ScopeContext scope = context.scope();
        String typeName = scope.getExprType(statement.expression());
        DataType dataType = typeName == null ? null : scope.program().dataType(typeName);
        if (dataType == null || !dataType.isEnum()) return List.of();

        List<String> missing = new ArrayList<>(dataType.enumValues());
        for (CaseStatement.Case c : statement.cases()) {
            for (Expression match : c.matches()) {
                String value = enumValue(dataType, match);
                if (value == null) {
                    LOGGER.warn("Non-enumerated value in enum case match: {} in {}", match.text(),
                            scope.currentLocation());
                } else if (!missing.removeIf(v -> Names.equal(v, value))) {
                    LOGGER.warn("Found unknown enumerated value for enum {}: {}", dataType.name(), match.text());
                }
            }
        }
        if (missing.isEmpty()) return List.of();
        return List.of(Violation.of("Case statement without else clause is missing cases for enum type "
                                    + dataType.name() + " (missing values " + missing + ")", statement));
    }

    private static String enumValue(DataType dataType, Expression match) {
        if (match instanceof MultiElementVariable mev && Names.equal(mev.name(), dataType.name())
            && mev.elements().size() == 1 && mev.elements().get(0) instanceof Accessor.FieldSelector fs) {
            return fs.field();
        }
        if (match instanceof SimpleVariable sv) {
            return sv.name();
        }
        return null;
    }
}
