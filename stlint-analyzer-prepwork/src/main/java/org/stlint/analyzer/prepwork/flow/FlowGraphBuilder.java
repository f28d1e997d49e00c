package org.stlint.analyzer.prepwork.flow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stlint.analyzer.common.StructuralException;
import org.stlint.analyzer.common.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/*
One structural pass over a statement list. Every method returns the index of the node at which the
code continues, or NONE when the remainder of the branch cannot be reached (after RETURN, EXIT,
CONTINUE, or a compound statement none of whose arms completes). Unreachable statements are not
added to the graph.

IF, CASE and loops get a head node owning the statement. Arms hang off the head; an IF without
ELSE gets an empty "_else" arm, a CASE without ELSE gets nothing. A loop head has the body as one
successor and an empty "_else" node leading to the loop exit as the other; the end of the body
loops back to the head.
 */
public class FlowGraphBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlowGraphBuilder.class);

    static final int NONE = -1;

    private final List<FlowNode> nodes = new ArrayList<>();

    private FlowGraphBuilder() {
    }

    public static FlowGraph build(Routine routine) {
        FlowGraphBuilder builder = new FlowGraphBuilder();
        int entry = builder.newNode(routine.shape().name() + " " + routine.name(), null);
        int end = routine.implementation() == null ? entry
                : builder.statements(routine.implementation(), entry, NONE, NONE);
        LOGGER.debug("Flow graph of {}: {} nodes, {}", routine.name(), builder.nodes.size(),
                end == NONE ? "no end node" : "end node " + end);
        return new FlowGraph(routine, builder.nodes, entry, end);
    }

    public static FlowGraph build(StatementList statementList) {
        FlowGraphBuilder builder = new FlowGraphBuilder();
        int entry = builder.newNode("statements", null);
        int end = builder.statements(statementList, entry, NONE, NONE);
        return new FlowGraph(null, builder.nodes, entry, end);
    }

    private int newNode(String label, Statement owner) {
        FlowNode node = new FlowNode(nodes.size(), label, owner);
        nodes.add(node);
        return node.index();
    }

    private void link(int from, int to) {
        nodes.get(from).addSuccessor(to);
        nodes.get(to).addPredecessor(from);
    }

    private int addNext(int from, String label, Statement owner) {
        int next = newNode(label, owner);
        link(from, next);
        return next;
    }

    private int join(List<Integer> armEnds, String label) {
        List<Integer> reached = armEnds.stream().filter(i -> i != NONE).toList();
        if (reached.isEmpty()) return NONE;
        int post = newNode(label, null);
        reached.forEach(i -> link(i, post));
        return post;
    }

    private int statements(StatementList statementList, int end, int exitTo, int continueTo) {
        int current = end;
        for (Statement statement : statementList.statements()) {
            if (current == NONE) break;
            current = statement(statement, current, exitTo, continueTo);
        }
        return current;
    }

    private int statement(Statement statement, int end, int exitTo, int continueTo) {
        if (statement instanceof IfStatement is) {
            int head = addNext(end, "if " + is.condition().text(), is);
            List<Integer> armEnds = new ArrayList<>();
            armEnds.add(statements(is.statements(), addNext(head, "then", null), exitTo, continueTo));
            for (IfStatement.ElseIf elseIf : is.elseIfs()) {
                int arm = addNext(head, "elsif " + elseIf.condition().text(), null);
                armEnds.add(statements(elseIf.statements(), arm, exitTo, continueTo));
            }
            if (is.elseStatements() != null) {
                armEnds.add(statements(is.elseStatements(), addNext(head, "else", null), exitTo, continueTo));
            } else {
                armEnds.add(addNext(head, "_else", null));
            }
            return join(armEnds, "if_end");
        }
        if (statement instanceof CaseStatement cs) {
            int head = addNext(end, "case " + cs.expression().text(), cs);
            List<Integer> armEnds = new ArrayList<>();
            for (CaseStatement.Case c : cs.cases()) {
                String label = c.matches().stream().map(Expression::text).collect(Collectors.joining(", "));
                armEnds.add(statements(c.statements(), addNext(head, label, null), exitTo, continueTo));
            }
            if (cs.elseStatements() != null) {
                armEnds.add(statements(cs.elseStatements(), addNext(head, "else", null), exitTo, continueTo));
            }
            return join(armEnds, "case_end");
        }
        if (statement instanceof LoopStatement loop) {
            int head = addNext(end, loopLabel(loop), loop);
            int bodyStart = addNext(head, "loop_start", null);
            int loopEnd = newNode("loop_end", null);
            int bodyEnd = statements(loop.statements(), bodyStart, loopEnd, head);
            if (bodyEnd != NONE) link(bodyEnd, head);
            int conditionFalse = addNext(head, "_else", null);
            link(conditionFalse, loopEnd);
            return loopEnd;
        }
        if (statement instanceof LabeledStatement ls) {
            int labeled = addNext(end, ls.label(), ls);
            return ls.statement() == null ? labeled : statement(ls.statement(), labeled, exitTo, continueTo);
        }
        if (statement instanceof ExitStatement) {
            if (exitTo == NONE) throw new StructuralException(statement, "EXIT used outside of a loop");
            nodes.get(end).addStatement(statement);
            link(end, exitTo);
            return NONE;
        }
        if (statement instanceof ContinueStatement) {
            if (continueTo == NONE) throw new StructuralException(statement, "CONTINUE used outside of a loop");
            nodes.get(end).addStatement(statement);
            link(end, continueTo);
            return NONE;
        }
        if (statement instanceof ReturnStatement) {
            nodes.get(end).addStatement(statement);
            return NONE;
        }
        if (statement instanceof JumpStatement js) {
            throw new StructuralException(statement, "JMP " + js.label() + " is not supported");
        }
        nodes.get(end).addStatement(statement);
        return end;
    }

    private static String loopLabel(LoopStatement loop) {
        if (loop instanceof WhileStatement ws) return "while " + ws.condition().text();
        if (loop instanceof RepeatStatement rs) return "repeat until " + rs.until().text();
        if (loop instanceof ForStatement fs) return "for " + fs.control().name();
        return "loop";
    }
}
