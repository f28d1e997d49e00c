package org.stlint.analyzer.prepwork.flow;

import org.stlint.analyzer.common.model.*;
import org.stlint.analyzer.prepwork.Elements;

/*
Does a statement (possibly) give a variable a value? Assignments to a field or an element of the
variable count, as do the control variable of a FOR loop and output bindings of calls. Taking the
address with ADR(...) counts too by default: what happens through the pointer is not tracked.
 */
public class Assignments {

    private Assignments() {
    }

    public static boolean isAssignmentFor(String variable, Statement statement) {
        return isAssignmentFor(variable, statement, true);
    }

    public static boolean isAssignmentFor(String variable, Statement statement, boolean adrIsAssignment) {
        if (statement instanceof AssignmentStatement as) {
            for (Expression target : as.variables()) {
                if (isTarget(variable, target)) return true;
            }
        } else if (statement instanceof ReferenceAssignmentStatement ras) {
            if (isTarget(variable, ras.variable())) return true;
        } else if (statement instanceof ForStatement fs) {
            if (Names.equal(fs.control().name(), variable)) return true;
        }
        for (Expression expression : Elements.expressions(statement)) {
            for (Expression sub : Elements.subExpressions(expression)) {
                if (sub instanceof CallExpression call && isAssignedInCall(variable, call, adrIsAssignment)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isTarget(String variable, Expression target) {
        if (target instanceof SimpleVariable sv) return Names.equal(sv.name(), variable);
        if (target instanceof MultiElementVariable mev) return Names.equal(mev.name(), variable);
        return false;
    }

    private static boolean isAssignedInCall(String variable, CallExpression call, boolean adrIsAssignment) {
        if (adrIsAssignment && Names.equal(call.simpleName(), "ADR") && !call.parameters().isEmpty()
            && call.parameters().get(0).value() instanceof SimpleVariable sv && Names.equal(sv.name(), variable)) {
            return true;
        }
        for (ParameterAssignment pa : call.parameters()) {
            if (pa.output() && pa.value() instanceof SimpleVariable sv && Names.equal(sv.name(), variable)) {
                return true;
            }
        }
        return false;
    }

    // assigned on every path through the routine
    public static boolean hasAssignment(FlowGraphs flowGraphs, Routine routine, String variable) {
        return flowGraphs.predicateHoldsOnAllPaths(routine, s -> isAssignmentFor(variable, s)) == null;
    }

    // assigned on every path from the entry of the routine to the statement
    public static boolean hasAssignmentBefore(FlowGraphs flowGraphs, Statement statement, Routine routine,
                                              String variable) {
        return flowGraphs.predicateHoldsOnAllPathsTo(routine, statement, s -> isAssignmentFor(variable, s)) == null;
    }
}
