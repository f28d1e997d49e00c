package org.stlint.analyzer.prepwork.flow;

import org.stlint.analyzer.common.model.*;

import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/*
Control flow graph of one routine. Nodes live in a list and refer to each other by index, so the
back edges of loops need no special treatment. There is exactly one entry node. The end node is
absent when no path reaches the end of the statement list.
 */
public class FlowGraph {
    private final Routine routine;
    private final List<FlowNode> nodes;
    private final int entry;
    private final int end;

    private record Step(int node, List<FlowNode> path) {
    }

    FlowGraph(Routine routine, List<FlowNode> nodes, int entry, int end) {
        this.routine = routine;
        this.nodes = List.copyOf(nodes);
        this.entry = entry;
        this.end = end;
    }

    // null when built for a bare statement list
    public Routine routine() {
        return routine;
    }

    public List<FlowNode> nodes() {
        return nodes;
    }

    public FlowNode node(int index) {
        return nodes.get(index);
    }

    public FlowNode entry() {
        return nodes.get(entry);
    }

    public boolean hasEnd() {
        return end != FlowGraphBuilder.NONE;
    }

    public FlowNode end() {
        return hasEnd() ? nodes.get(end) : null;
    }

    // the node, reachable from the entry, that holds or owns the statement; null when unreachable
    public FlowNode nodeOf(Statement statement) {
        Set<Integer> visited = new HashSet<>();
        Deque<Integer> todo = new ArrayDeque<>();
        todo.push(entry);
        while (!todo.isEmpty()) {
            int i = todo.pop();
            if (!visited.add(i)) continue;
            FlowNode node = nodes.get(i);
            if (node.contains(statement)) return node;
            node.successors().forEach(todo::push);
        }
        return null;
    }

    /*
    A path from the entry to a terminal node on which no node satisfies the predicate, or null
    when there is none. A node satisfies the predicate when its owner or one of its statements
    does; its successors are then not explored. Nodes that cannot be reached from the entry are
    never looked at.
     */
    public List<FlowNode> failingPath(Predicate<Statement> predicate) {
        Set<Integer> visited = new HashSet<>();
        Deque<Step> todo = new ArrayDeque<>();
        todo.push(new Step(entry, List.of()));
        while (!todo.isEmpty()) {
            Step step = todo.pop();
            if (!visited.add(step.node)) continue;
            FlowNode node = nodes.get(step.node);
            if (satisfies(node, predicate)) continue;
            List<FlowNode> path = new ArrayList<>(step.path);
            path.add(node);
            if (node.isTerminal()) return path;
            pushAll(todo, node.successors(), visited, path);
        }
        return null;
    }

    /*
    A path from the entry to the target statement on which the predicate is not satisfied before
    the target, or null when there is none (also when the target cannot be reached). The search
    runs backwards from the node of the target; the target itself, and whatever follows it in
    its node, never counts.
     */
    public List<FlowNode> failingPathTo(Statement target, Predicate<Statement> predicate) {
        FlowNode targetNode = nodeOf(target);
        if (targetNode == null) return null;
        Set<Integer> visited = new HashSet<>();
        Deque<Step> todo = new ArrayDeque<>();
        todo.push(new Step(targetNode.index(), List.of()));
        while (!todo.isEmpty()) {
            Step step = todo.pop();
            if (!visited.add(step.node)) continue;
            FlowNode node = nodes.get(step.node);
            if (satisfiesBefore(node, target, predicate)) continue;
            List<FlowNode> path = new ArrayList<>(step.path.size() + 1);
            path.add(node);
            path.addAll(step.path);
            if (node.predecessors().isEmpty()) return path;
            pushAll(todo, node.predecessors(), visited, path);
        }
        return null;
    }

    // in reverse, so that the first edge is explored first
    private static void pushAll(Deque<Step> todo, Set<Integer> next, Set<Integer> visited, List<FlowNode> path) {
        List<Integer> list = new ArrayList<>(next);
        Collections.reverse(list);
        for (int i : list) {
            if (!visited.contains(i)) todo.push(new Step(i, path));
        }
    }

    private static boolean satisfies(FlowNode node, Predicate<Statement> predicate) {
        if (node.owner() != null && predicate.test(node.owner())) return true;
        for (Statement statement : node.statements()) {
            if (predicate.test(statement)) return true;
        }
        return false;
    }

    private static boolean satisfiesBefore(FlowNode node, Statement target, Predicate<Statement> predicate) {
        if (node.owner() == target) return false;
        if (node.owner() != null && predicate.test(node.owner())) return true;
        for (Statement statement : node.statements()) {
            if (statement == target) return false;
            if (predicate.test(statement)) return true;
        }
        return false;
    }

    // debugging aid: the part of the graph reachable from the entry, in dot notation
    public String toDot() {
        StringBuilder sb = new StringBuilder("digraph G {\n");
        sb.append("    node [fontname = \"courier new\"];\n");
        String lineBreak = "<BR ALIGN=\"LEFT\"/>";
        Set<Integer> visited = new LinkedHashSet<>();
        Deque<Integer> todo = new ArrayDeque<>();
        todo.push(entry);
        while (!todo.isEmpty()) {
            int i = todo.pop();
            if (!visited.add(i)) continue;
            FlowNode node = nodes.get(i);
            String statements = node.statements().stream().map(s -> escape(describe(s)))
                    .collect(Collectors.joining(lineBreak));
            String label = node.label() == null ? statements
                    : "<B>" + escape(node.label()) + "</B>" + lineBreak + lineBreak + statements;
            sb.append("    n").append(i).append(" [label=<").append(label).append(lineBreak).append(">];\n");
            for (int next : node.successors()) {
                sb.append("    n").append(i).append(" -> n").append(next).append(";\n");
                todo.push(next);
            }
        }
        return sb.append("}").toString();
    }

    private static String escape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    public static String describe(Statement statement) {
        if (statement instanceof AssignmentStatement as) {
            String op = switch (as.kind()) {
                case ASSIGN -> " := ";
                case SET -> " S= ";
                case RESET -> " R= ";
            };
            return as.variables().stream().map(Expression::text).collect(Collectors.joining(op))
                   + op + as.expression().text();
        }
        if (statement instanceof ReferenceAssignmentStatement ras) {
            return ras.variable().text() + " REF= " + ras.expression().text();
        }
        if (statement instanceof FunctionCallStatement fcs) return fcs.text();
        if (statement instanceof NoOpStatement nos) return nos.variable().text();
        if (statement instanceof ReturnStatement) return "RETURN";
        if (statement instanceof ExitStatement) return "EXIT";
        if (statement instanceof ContinueStatement) return "CONTINUE";
        if (statement instanceof LabeledStatement ls) return ls.label() + ":";
        return statement.shape().name();
    }

    @Override
    public String toString() {
        return "FlowGraph of " + (routine == null ? "statements" : routine.name()) + ", " + nodes.size() + " nodes";
    }
}
