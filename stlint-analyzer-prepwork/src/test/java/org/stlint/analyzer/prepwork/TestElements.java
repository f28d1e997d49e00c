package org.stlint.analyzer.prepwork;

import org.junit.jupiter.api.Test;
import org.stlint.analyzer.common.model.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.stlint.analyzer.common.model.Ast.*;

public class TestElements extends CommonTest {

    @Test
    public void test1() {
        AssignmentStatement a1 = assign("x", intLit(1));
        ReturnStatement r = ret();
        AssignmentStatement a2 = assign("y", var("x"));
        IfStatement is = ifThen(var("b"), a1, r);
        WhileStatement ws = whileLoop(var("c"), a2);
        Method m = method("M", "INT", is, ws);
        // pre-order, including the statement after RETURN
        assertEquals(List.of(is, a1, r, ws, a2), Elements.statements(m));
    }

    @Test
    public void test2() {
        AssignmentStatement a = assign(field("st", "x"), binary(var("a"), "+", var("b")));
        assertEquals(1, Elements.expressions(a).size());
        assertEquals(2, Elements.expressions(a, true).size());
        FunctionCallStatement fcs = callStatement("F", arg("IN", var("i")), out("OUT", var("o")));
        assertSame(fcs, Elements.expressions(fcs).get(0));
        List<Expression> subs = Elements.subExpressions(fcs);
        assertEquals(2, subs.size());
        assertSame(fcs, subs.get(0));
        assertEquals("i", subs.get(1).text());
        assertEquals(3, Elements.subExpressions(fcs, null, true).size());
    }

    @Test
    public void test3() {
        Expression e = binary(element("a", subscript(var("i"))), "*", call("F", arg(unary("-", var("z")))));
        List<String> texts = Elements.subExpressions(e).stream().map(Expression::text).toList();
        assertEquals(List.of("a[i] * F(-z)", "a[i]", "i", "F(-z)", "-z", "z"), texts);
        List<String> excluded = Elements.subExpressions(e, x -> x instanceof FunctionCall, false)
                .stream().map(Expression::text).toList();
        assertEquals(List.of("a[i] * F(-z)", "a[i]", "i"), excluded);
    }

    @Test
    public void test4() {
        ForStatement fs = new ForStatement(var("i"), intLit(0), var("n"), intLit(2), block(), null);
        assertEquals(3, Elements.expressions(fs).size());
        assertEquals(4, Elements.expressions(fs, true).size());
        CaseStatement cs = caseOf(var("mode"), List.of(when(intLit(1), assign("x", intLit(1)))), null);
        assertEquals(2, Elements.expressions(cs).size());
    }
}
