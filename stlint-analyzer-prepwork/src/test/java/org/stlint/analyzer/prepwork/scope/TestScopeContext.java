package org.stlint.analyzer.prepwork.scope;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.stlint.analyzer.common.ResolutionException;
import org.stlint.analyzer.common.model.*;
import org.stlint.analyzer.common.settings.Settings;
import org.stlint.analyzer.prepwork.CommonTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.stlint.analyzer.common.model.Ast.*;
import static org.stlint.analyzer.common.model.DeclarationBlock.*;

public class TestScopeContext extends CommonTest {

    private static Program program(FunctionBlock... functionBlocks) {
        Program.Builder b = new Program.Builder();
        for (FunctionBlock fb : functionBlocks) b.addFunctionBlock(fb);
        b.addGlobals(new GlobalVariableList("GVL_Main", List.of(decl("gCounter", "UDINT", VAR_GLOBAL))));
        b.addDataType(DataType.struct("ST_Point", null, List.of(decl("fX", "LREAL", VAR), decl("fY", "LREAL", VAR))));
        b.addDataType(DataType.struct("ST_Point3", "ST_Point", List.of(decl("fZ", "LREAL", VAR))));
        b.addDataType(DataType.enumeration("E_Mode", List.of("Idle", "Run")));
        b.addFunction(new Function("F_Scale", "REAL", List.of(decl("fIn", "REAL", VAR_INPUT))));
        return b.build();
    }

    @DisplayName("case-insensitive lookup returns the declared spelling")
    @Test
    public void test1() {
        Method m = new Method.Builder("M_Count").addDeclaration(decl("x_Counter", "INT", VAR)).build();
        FunctionBlock fb = new FunctionBlock.Builder("FB_A").addMethod(m).build();
        ScopeContext context = new ScopeContext(program(fb), Settings.DEFAULT);
        try (ScopeContext.Guard g1 = context.enterFunctionBlock(fb); ScopeContext.Guard g2 = context.enterRoutine(m)) {
            Resolution r = context.resolve("X_COUNTER");
            assertEquals("x_Counter", r.name());
            assertEquals("INT", r.type());
            assertEquals("x_Counter", context.suggestion("x_counter"));
            assertFalse(context.resolve("X_COUNTER", true).isResolved());
            assertEquals("INT", context.getVarType("x_Counter", true));
            assertEquals("FB_A.M_Count", context.currentLocation());
        }
        assertEquals("<global>", context.currentLocation());
        assertEquals(Resolution.UNRESOLVED, context.resolve("x_Counter"));
    }

    @DisplayName("inherited fields resolve in the derived function block")
    @Test
    public void test2() {
        FunctionBlock a = new FunctionBlock.Builder("A").addDeclaration(decl("f", "BOOL", VAR)).build();
        FunctionBlock b = new FunctionBlock.Builder("B").setExtends("A").build();
        ScopeContext context = new ScopeContext(program(a, b), Settings.DEFAULT);
        try (ScopeContext.Guard g = context.enterFunctionBlock(b)) {
            Resolution r = context.resolve("f");
            assertTrue(r.isResolved());
            assertEquals("BOOL", r.type());
            assertEquals("B", context.getVarType("THIS^"));
            assertEquals("A", context.getVarType("SUPER^"));
            assertEquals("BOOL", context.getExprType(deref("THIS", "f")));
        }
        assertEquals(List.of(b, a), context.allExtends(b, true));
        assertEquals(List.of(a), context.allExtends(b, false));
    }

    @DisplayName("SUPER in an override without ancestor declaration gives a diagnostic")
    @Test
    public void test3() {
        Method init = new Method.Builder("M_Init").setReturnType("BOOL").build();
        Method other = new Method.Builder("M_Other").build();
        FunctionBlock base = new FunctionBlock.Builder("FB_Base").addMethod(init).build();
        FunctionBlock middle = new FunctionBlock.Builder("FB_Middle").setExtends("FB_Base").build();
        FunctionBlock derived = new FunctionBlock.Builder("FB_Derived").setExtends("FB_Middle")
                .addMethod(init).addMethod(other).build();
        ScopeContext context = new ScopeContext(program(base, middle, derived), Settings.DEFAULT);
        try (ScopeContext.Guard g = context.enterFunctionBlock(derived)) {
            try (ScopeContext.Guard g2 = context.enterRoutine(init)) {
                // skips FB_Middle, which does not declare M_Init
                assertEquals("FB_Base", context.getVarType("SUPER"));
                assertEquals("BOOL", context.getVarType("m_init"));
            }
            try (ScopeContext.Guard g2 = context.enterRoutine(other)) {
                Resolution r = context.resolve("SUPER^");
                assertFalse(r.isResolved());
                assertNotNull(r.diagnostic());
                assertThrows(ResolutionException.class, () -> context.resolve("M_Other"));
            }
        }
        assertThrows(ResolutionException.class, () -> context.resolve("THIS"));
        assertThrows(ResolutionException.class, () -> context.resolve("SUPER"));
    }

    @DisplayName("scopes are restored when the body throws")
    @Test
    public void test4() {
        Method m = new Method.Builder("M").addDeclaration(decl("local", "INT", VAR)).build();
        FunctionBlock fb = new FunctionBlock.Builder("FB").addMethod(m).build();
        ScopeContext context = new ScopeContext(program(fb), Settings.DEFAULT);
        int depth = context.depth();
        assertThrows(IllegalStateException.class, () -> {
            try (ScopeContext.Guard g1 = context.enterFunctionBlock(fb); ScopeContext.Guard g2 = context.enterRoutine(m)) {
                assertEquals(depth + 1, context.depth());
                throw new IllegalStateException("body fails");
            }
        });
        assertNull(context.currentFunctionBlock());
        assertNull(context.currentRoutine());
        assertEquals(depth, context.depth());

        try (ScopeContext.Guard g = context.enterFunctionBlock(fb)) {
            assertThrows(IllegalStateException.class, () -> context.enterFunctionBlock(fb));
            try (ScopeContext.Guard g2 = context.enterRoutine(m)) {
                assertThrows(IllegalStateException.class, () -> context.enterRoutine(m));
            }
        }
    }

    @DisplayName("resolution order: builtins, complex entities, members, layers")
    @Test
    public void test5() {
        Property prop = new Property("P_Speed", "LREAL", null, null);
        Method m = new Method.Builder("M_Run").setReturnType("BOOL")
                .addDeclaration(decl("gCounter", "INT", VAR)).build();
        FunctionBlock fb = new FunctionBlock.Builder("FB_Axis").addDeclaration(decl("nState", "DINT", VAR))
                .addProperty(prop).addMethod(m).build();
        Settings settings = new Settings.Builder().addBuiltinSymbol("TwinCAT_SystemInfoVarList", "<TYPE>")
                .addBuiltinSymbol("_TaskInfo", "ARRAY [1..4] OF PlcTaskSystemInfo").build();
        ScopeContext context = new ScopeContext(program(fb), settings);
        assertEquals("UDINT", context.getVarType("GCOUNTER"));
        assertTrue(context.resolve("st_point").complex());
        assertTrue(context.resolve("INT_TO_REAL").complex());
        assertTrue(context.resolve("f_scale").complex());
        assertTrue(context.resolve("TwinCAT_SystemInfoVarList").complex());
        assertEquals("ARRAY [1..4] OF PlcTaskSystemInfo", context.getVarType("_taskinfo"));
        try (ScopeContext.Guard g = context.enterFunctionBlock(fb); ScopeContext.Guard g2 = context.enterRoutine(m)) {
            assertEquals("DINT", context.getVarType("nState"));
            assertEquals("LREAL", context.getVarType("p_speed"));
            assertTrue(context.resolve("M_Run").isResolved());
            assertEquals("BOOL", context.getVarType("M_Run"));
            // the local declaration shadows the global one
            assertEquals("INT", context.getVarType("gCounter"));
        }
    }

    @DisplayName("multi-element variables")
    @Test
    public void test6() {
        FunctionBlock fb = new FunctionBlock.Builder("FB")
                .addDeclaration(decl("aGrid", "ARRAY [1..3, 1..3] OF ST_Point", VAR))
                .addDeclaration(decl("stPoint", "ST_Point3", VAR))
                .addDeclaration(decl("refPoint", "REFERENCE TO ST_Point", VAR))
                .addDeclaration(decl("pPoint", "POINTER TO ST_Point", VAR))
                .build();
        ScopeContext context = new ScopeContext(program(fb), Settings.DEFAULT);
        try (ScopeContext.Guard g = context.enterFunctionBlock(fb)) {
            assertEquals("LREAL", context.getExprType(element("aGrid", subscript(var("i"), var("j")), select("fX"))));
            Resolution partial = context.resolveMultiElement("aGrid", List.of(subscript(var("i"))));
            assertFalse(partial.isResolved());
            assertTrue(partial.diagnostic().contains("partial"));
            assertEquals("LREAL", context.getExprType(field("stPoint", "fX")));
            assertEquals("LREAL", context.getExprType(field("stPoint", "fZ")));
            assertNull(context.getExprType(field("stPoint", "fW")));
            assertEquals("LREAL", context.getExprType(field("refPoint", "fY")));
            assertEquals("LREAL", context.getExprType(deref("pPoint", "fY")));
            assertEquals("UDINT", context.getExprType(field("GVL_Main", "gCounter")));
            assertEquals("E_Mode", context.getExprType(field("E_Mode", "Run")));
        }
    }

    @DisplayName("expression types")
    @Test
    public void test7() {
        FunctionBlock timer = new FunctionBlock.Builder("TON").addDeclaration(decl("Q", "BOOL", VAR_OUTPUT)).build();
        Method getPos = new Method.Builder("M_GetPos").setReturnType("LREAL").build();
        FunctionBlock fb = new FunctionBlock.Builder("FB")
                .addDeclaration(decl("nA", "INT", VAR))
                .addDeclaration(decl("nB", "UDINT", VAR))
                .addDeclaration(decl("fbTimer", "TON", VAR))
                .addDeclaration(decl("fbOther", "FB", VAR))
                .addMethod(getPos)
                .build();
        ScopeContext context = new ScopeContext(program(timer, fb), Settings.DEFAULT);
        try (ScopeContext.Guard g = context.enterFunctionBlock(fb)) {
            assertEquals("UDINT", context.getExprType(binary(var("nA"), "+", var("nB"))));
            assertEquals("INT", context.getExprType(binary(var("nA"), "MOD", var("nB"))));
            assertEquals("BOOL", context.getExprType(binary(var("nA"), "<", var("nB"))));
            assertEquals("BOOL", context.getExprType(unary("NOT", var("nA"))));
            assertEquals("INT", context.getExprType(parens(unary("-", var("nA")))));
            assertEquals("LREAL", context.getExprType(binary(realLit("1.5"), "*", var("nA"))));
            assertEquals("UINT", context.getExprType(typed("UINT", "5")));
            assertEquals("STRING", context.getExprType(stringLit("abc")));
            assertEquals("REAL", context.getExprType(call("DINT_TO_REAL", arg(var("nA")))));
            assertEquals("INT", context.getExprType(call("LEN", arg(stringLit("x")))));
            assertEquals("REAL", context.getExprType(call("F_Scale", arg(var("nA")))));
            assertEquals("TON", context.getExprType(call("fbTimer")));
            assertEquals("LREAL", context.getExprType(call("M_GetPos")));
            assertEquals("LREAL", context.getExprType(call(field("fbOther", "M_GetPos"))));
            assertNull(context.getExprType(new DirectVariable("%IX0.1", null)));
            assertThrows(ResolutionException.class, () -> context.getExprType(binary(var("nA"), "SHL", intLit(2))));
            assertThrows(ResolutionException.class, () -> context.getExprType(unary("~", var("nA"))));
        }
    }

    @DisplayName("getFieldType over function blocks, properties and aliases")
    @Test
    public void test8() {
        FunctionBlock a = new FunctionBlock.Builder("A").addDeclaration(decl("nA", "INT", VAR_OUTPUT))
                .addProperty(new Property("P_Ok", "BOOL", null, null)).build();
        FunctionBlock b = new FunctionBlock.Builder("B").setExtends("A").build();
        Program program = new Program.Builder().addFunctionBlock(a).addFunctionBlock(b)
                .addDataType(DataType.struct("ST_X", null, List.of(decl("n", "WORD", VAR))))
                .addDataType(DataType.alias("T_X", "ST_X"))
                .build();
        ScopeContext context = new ScopeContext(program, Settings.DEFAULT);
        assertEquals("INT", context.getFieldType("B", "na"));
        assertEquals("BOOL", context.getFieldType("B", "P_Ok"));
        assertEquals("WORD", context.getFieldType("T_X", "n"));
        assertNull(context.getFieldType("INT", "n"));
    }

    @DisplayName("cyclic and missing extensions end the chain")
    @Test
    public void test9() {
        FunctionBlock a = new FunctionBlock.Builder("A").setExtends("B").build();
        FunctionBlock b = new FunctionBlock.Builder("B").setExtends("A").build();
        FunctionBlock c = new FunctionBlock.Builder("C").setExtends("Missing").build();
        ScopeContext context = new ScopeContext(program(a, b, c), Settings.DEFAULT);
        assertEquals(List.of(a, b), context.allExtends(a, true));
        assertEquals(List.of(c), context.allExtends(c, true));
        try (ScopeContext.Guard g = context.enterFunctionBlock(a)) {
            assertFalse(context.resolve("unknown").isResolved());
        }
    }
}
