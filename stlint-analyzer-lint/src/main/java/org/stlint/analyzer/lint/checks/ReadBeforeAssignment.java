package org.stlint.analyzer.lint.checks;

import org.stlint.analyzer.common.model.*;
import org.stlint.analyzer.lint.CheckContext;
import org.stlint.analyzer.lint.LintCheck;
import org.stlint.analyzer.lint.Requirement;
import org.stlint.analyzer.lint.Violation;
import org.stlint.analyzer.prepwork.Elements;
import org.stlint.analyzer.prepwork.flow.Assignments;

import java.util.*;
import java.util.function.Predicate;

/*
A variable of the routine without initializer that is read in a statement, while there is a path
from the entry of the routine to that statement on which it is never assigned.
Arguments of __QUERYINTERFACE are outputs in disguise, and are not reads.
The UNTIL condition of a REPEAT belongs to the loop head, which precedes the body: a variable that is
only assigned in the body is reported when UNTIL reads it.
 */
public class ReadBeforeAssignment implements LintCheck<Statement> {
    private static final Predicate<Expression> QUERY_INTERFACE =
            e -> e instanceof CallExpression call && Names.equal(call.simpleName(), "__QUERYINTERFACE");

    @Override
    public String code() {
        return "VAR100";
    }

    @Override
    public Shape<Statement> shape() {
        return Shape.STATEMENT;
    }

    @Override
    public String description() {
        return "Variable without initial value may be read before it is assigned to";
    }

    @Override
    public Set<Requirement> requirements() {
        return Set.of(Requirement.SCOPE, Requirement.FLOW_GRAPHS);
    }

    @Override
    public List<Violation> check(Statement statement, CheckContext context) {
        Routine routine = context.scope().currentRoutine();
        if (routine == null || !routine.hasImplementation()) return List.of();
        Map<String, Declaration> candidates = new LinkedHashMap<>();
        routine.declarations().forEach((name, d) -> {
            if (!d.isInitialized()) candidates.put(name, d);
        });
        if (candidates.isEmpty()) return List.of();

        List<Violation> violations = new ArrayList<>();
        Set<String> reported = new HashSet<>();
        for (Expression expression : Elements.expressions(statement)) {
            for (Expression sub : Elements.subExpressions(expression, QUERY_INTERFACE, false)) {
                if (!(sub instanceof SimpleVariable sv)) continue;
                Declaration declaration = Names.get(candidates, sv.name());
                if (declaration == null || !reported.add(declaration.name())) continue;
                if (Assignments.isAssignmentFor(declaration.name(), statement)) continue;
                if (!Assignments.hasAssignmentBefore(context.flowGraphs(), statement, routine, declaration.name())) {
                    violations.add(Violation.of("Variable " + declaration.name()
                                                + " may be read before it is assigned to", sv));
                }
            }
        }
        return violations;
    }
}
