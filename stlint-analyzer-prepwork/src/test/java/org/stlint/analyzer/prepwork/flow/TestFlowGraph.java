package org.stlint.analyzer.prepwork.flow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.stlint.analyzer.common.StructuralException;
import org.stlint.analyzer.common.model.*;
import org.stlint.analyzer.prepwork.CommonTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.stlint.analyzer.common.model.Ast.*;

public class TestFlowGraph extends CommonTest {

    private static boolean assignsResult(Statement s) {
        return Assignments.isAssignmentFor("result", s);
    }

    @DisplayName("IF without ELSE continues past the IF")
    @Test
    public void test1() {
        Method m = method("M", "INT",
                ifThen(var("cond"), assign("result", intLit(1)), ret()),
                assign("result", intLit(2)));
        FlowGraph graph = FlowGraphBuilder.build(m);
        assertTrue(graph.hasEnd());
        assertNull(graph.failingPath(TestFlowGraph::assignsResult));
        assertEquals("if_end", graph.end().label());
    }

    @DisplayName("every terminal node assigns")
    @Test
    public void test2() {
        Method m = method("M", "INT",
                ifChain(var("a"), block(assign("result", intLit(1)), ret()),
                        List.of(elsif(var("b"), assign("result", intLit(2)))),
                        block(assign("result", intLit(3)))));
        FlowGraph graph = FlowGraphBuilder.build(m);
        assertNull(graph.failingPath(TestFlowGraph::assignsResult));
    }

    @DisplayName("a path without assignment is returned as counterexample")
    @Test
    public void test3() {
        AssignmentStatement other = assign("x", intLit(3));
        Method m = method("M", "INT",
                ifThen(var("cond"), assign("result", intLit(1))),
                other);
        FlowGraph graph = FlowGraphBuilder.build(m);
        List<FlowNode> path = graph.failingPath(TestFlowGraph::assignsResult);
        assertNotNull(path);
        assertSame(graph.entry(), path.get(0));
        assertEquals(List.of("method M", "if cond", "_else", "if_end"), path.stream().map(FlowNode::label).toList());
        assertTrue(path.get(path.size() - 1).contains(other));
    }

    @DisplayName("EXIT or CONTINUE outside a loop, and JMP, cannot be built")
    @Test
    public void test4() {
        StructuralException se = assertThrows(StructuralException.class,
                () -> FlowGraphBuilder.build(method("M", null, exit())));
        assertNotNull(se.getElement());
        assertThrows(StructuralException.class, () -> FlowGraphBuilder.build(method("M", null,
                ifThen(var("a"), continueLoop()))));
        assertThrows(StructuralException.class, () -> FlowGraphBuilder.build(method("M", null,
                label("start", assign("x", intLit(1))), jump("start"))));
        assertDoesNotThrow(() -> FlowGraphBuilder.build(method("M", null, whileLoop(var("a"), exit()))));
    }

    @DisplayName("every arm returns: no end node, trailing code left out")
    @Test
    public void test5() {
        AssignmentStatement trailing = assign("x", intLit(1));
        Method m = method("M", "INT",
                ifThenElse(var("a"), block(assign("result", intLit(1)), ret()),
                        block(assign("result", intLit(2)), ret())),
                trailing);
        FlowGraph graph = FlowGraphBuilder.build(m);
        assertFalse(graph.hasEnd());
        assertNull(graph.end());
        assertNull(graph.nodeOf(trailing));
        assertNull(graph.failingPath(TestFlowGraph::assignsResult));
        assertNull(graph.failingPathTo(trailing, TestFlowGraph::assignsResult));
    }

    @DisplayName("loops: back edge, EXIT and CONTINUE, termination on cycles")
    @Test
    public void test6() {
        ExitStatement exit = exit();
        WhileStatement loop = whileLoop(var("a"),
                ifThen(var("b"), exit),
                ifThen(var("c"), continueLoop()),
                assign("y", intLit(1)));
        Method m = method("M", "INT", loop, assign("z", intLit(2)));
        FlowGraph graph = FlowGraphBuilder.build(m);
        FlowNode head = graph.nodeOf(loop);
        assertSame(loop, head.owner());
        assertEquals(2, head.successors().size());
        // entry, CONTINUE and the end of the body
        assertEquals(3, head.predecessors().size());
        FlowNode exitNode = graph.nodeOf(exit);
        assertEquals(List.of("loop_end"), exitNode.successors().stream().map(i -> graph.node(i).label()).toList());

        assertNotNull(graph.failingPath(TestFlowGraph::assignsResult));
        assertNull(graph.failingPath(s -> Assignments.isAssignmentFor("z", s)));
        // y is not assigned when the loop body does not run
        assertNotNull(graph.failingPath(s -> Assignments.isAssignmentFor("y", s)));
    }

    @DisplayName("a loop body that always returns does not loop back")
    @Test
    public void test7() {
        WhileStatement loop = whileLoop(var("a"), assign("result", intLit(1)), ret());
        Method m = method("M", "INT", loop);
        FlowGraph graph = FlowGraphBuilder.build(m);
        assertTrue(graph.hasEnd());
        assertEquals(1, graph.nodeOf(loop).predecessors().size());
        // the condition can be false at the first evaluation
        List<FlowNode> path = graph.failingPath(TestFlowGraph::assignsResult);
        assertNotNull(path);
        assertEquals("loop_end", path.get(path.size() - 1).label());
    }

    @DisplayName("assigned before a statement")
    @Test
    public void test8() {
        AssignmentStatement read = assign("y", var("x"));
        AssignmentStatement readInLoop = assign("y", var("w"));
        Method m = method("M", "INT",
                ifThenElse(var("a"), block(assign("x", intLit(1))), block(ret())),
                read,
                whileLoop(var("b"), readInLoop, assign("w", intLit(1))));
        FlowGraphs flowGraphs = new FlowGraphs();
        assertTrue(Assignments.hasAssignmentBefore(flowGraphs, read, m, "x"));
        assertFalse(Assignments.hasAssignmentBefore(flowGraphs, read, m, "y"));
        // the first iteration reads w before the assignment
        List<FlowNode> path = flowGraphs.predicateHoldsOnAllPathsTo(m, readInLoop,
                s -> Assignments.isAssignmentFor("w", s));
        assertNotNull(path);
        assertSame(flowGraphs.graph(m).entry(), path.get(0));
        assertTrue(path.get(path.size() - 1).contains(readInLoop));
        assertEquals(1, flowGraphs.size());
    }

    @DisplayName("the target itself does not count")
    @Test
    public void test9() {
        AssignmentStatement selfAssign = assign("x", binary(var("x"), "+", intLit(1)));
        Method m = method("M", null, selfAssign);
        FlowGraphs flowGraphs = new FlowGraphs();
        assertFalse(Assignments.hasAssignmentBefore(flowGraphs, selfAssign, m, "x"));
        assertTrue(Assignments.hasAssignment(flowGraphs, m, "x"));
    }

    @DisplayName("CASE without ELSE has no catch-all arm")
    @Test
    public void test10() {
        CaseStatement cs = caseOf(var("mode"), List.of(
                when(intLit(1), assign("result", intLit(1)), ret()),
                when(intLit(2), assign("result", intLit(2)), ret())), null);
        Method m = method("M", "INT", cs, assign("x", intLit(0)));
        FlowGraph graph = FlowGraphBuilder.build(m);
        assertFalse(graph.hasEnd());
        assertNull(graph.failingPath(TestFlowGraph::assignsResult));

        CaseStatement withElse = caseOf(var("mode"), List.of(when(intLit(1), assign("result", intLit(1)))),
                block(assign("x", intLit(1))));
        FlowGraph graph2 = FlowGraphBuilder.build(method("M", "INT", withElse));
        assertTrue(graph2.hasEnd());
        List<FlowNode> path = graph2.failingPath(TestFlowGraph::assignsResult);
        assertNotNull(path);
        assertTrue(path.stream().anyMatch(n -> "else".equals(n.label())));
    }

    @DisplayName("labeled statements, FOR control variable, dot output")
    @Test
    public void test11() {
        ForStatement fs = forLoop("i", intLit(1), intLit(10), assign("x", var("i")));
        LabeledStatement ls = label("lbl", assign("result", intLit(1)));
        Method m = method("M", "INT", fs, ls);
        FlowGraph graph = FlowGraphBuilder.build(m);
        assertNull(graph.failingPath(s -> Assignments.isAssignmentFor("i", s)));
        FlowNode labeled = graph.nodeOf(ls);
        assertEquals("lbl", labeled.label());
        assertSame(ls, labeled.owner());
        assertEquals(1, labeled.statements().size());
        String dot = graph.toDot();
        assertTrue(dot.startsWith("digraph G {"));
        assertTrue(dot.contains("<B>for i</B>"));
        assertTrue(dot.contains("result := 1"));
        assertTrue(dot.endsWith("}"));
    }
}
