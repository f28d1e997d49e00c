package org.stlint.analyzer.prepwork.flow;

import org.stlint.analyzer.common.model.Routine;
import org.stlint.analyzer.common.model.Statement;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/*
The flow graphs of one run, built on first use and kept per routine (by identity).
Not thread-safe; one instance per analyzed program.
 */
public class FlowGraphs {
    private final Map<Routine, FlowGraph> graphs = new IdentityHashMap<>();

    public FlowGraph graph(Routine routine) {
        return graphs.computeIfAbsent(routine, FlowGraphBuilder::build);
    }

    public int size() {
        return graphs.size();
    }

    // the failing path, or null when the predicate holds on all paths through the routine
    public List<FlowNode> predicateHoldsOnAllPaths(Routine routine, Predicate<Statement> predicate) {
        return graph(routine).failingPath(predicate);
    }

    // the failing path, or null when the predicate holds on all paths from the entry to the target
    public List<FlowNode> predicateHoldsOnAllPathsTo(Routine routine, Statement target,
                                                     Predicate<Statement> predicate) {
        return graph(routine).failingPathTo(target, predicate);
    }
}
