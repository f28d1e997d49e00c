package org.stlint.analyzer.prepwork.flow;

import org.stlint.analyzer.common.model.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/*
A basic block of a flow graph. Nodes are addressed by their index in the graph; edges are sets of
indices. The owner is the control statement (IF, CASE, loop, label) a node stands for, if any.
 */
public class FlowNode {
    private final int index;
    private final String label;
    private final Statement owner;
    private final List<Statement> statements = new ArrayList<>();
    private final Set<Integer> successors = new LinkedHashSet<>();
    private final Set<Integer> predecessors = new LinkedHashSet<>();

    FlowNode(int index, String label, Statement owner) {
        this.index = index;
        this.label = label;
        this.owner = owner;
    }

    public int index() {
        return index;
    }

    public String label() {
        return label;
    }

    public Statement owner() {
        return owner;
    }

    public List<Statement> statements() {
        return Collections.unmodifiableList(statements);
    }

    public Set<Integer> successors() {
        return Collections.unmodifiableSet(successors);
    }

    public Set<Integer> predecessors() {
        return Collections.unmodifiableSet(predecessors);
    }

    public boolean isTerminal() {
        return successors.isEmpty();
    }

    public boolean contains(Statement statement) {
        if (owner == statement) return true;
        for (Statement s : statements) {
            if (s == statement) return true;
        }
        return false;
    }

    void addStatement(Statement statement) {
        statements.add(statement);
    }

    void addSuccessor(int successor) {
        successors.add(successor);
    }

    void addPredecessor(int predecessor) {
        predecessors.add(predecessor);
    }

    @Override
    public String toString() {
        return "n" + index + (label == null ? "" : ":" + label);
    }
}
