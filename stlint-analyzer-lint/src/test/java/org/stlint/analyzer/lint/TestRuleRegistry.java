package org.stlint.analyzer.lint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.stlint.analyzer.common.ConfigurationException;
import org.stlint.analyzer.common.ResolutionException;
import org.stlint.analyzer.common.StructuralException;
import org.stlint.analyzer.common.model.*;
import org.stlint.analyzer.common.settings.CheckSettings;
import org.stlint.analyzer.common.settings.Settings;
import org.stlint.analyzer.common.settings.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.stlint.analyzer.common.model.Ast.*;

public class TestRuleRegistry extends CommonTest {

    private static <T extends Element> LintCheck<T> always(String code, Shape<T> shape) {
        return LintCheck.of(code, shape, "always", Set.of(), (e, c) -> List.of(Violation.of(code, e)));
    }

    @Test
    @DisplayName("codes are unique and well-formed")
    public void test1() {
        RuleRegistry registry = new RuleRegistry();
        registry.register(always("TST001", Shape.STATEMENT));
        registry.register(always("AB1234", Shape.STATEMENT));
        assertThrows(ConfigurationException.class, () -> registry.register(always("TST001", Shape.EXPRESSION)));
        assertThrows(ConfigurationException.class, () -> registry.register(always("X001", Shape.STATEMENT)));
        assertThrows(ConfigurationException.class, () -> registry.register(always("tst002", Shape.STATEMENT)));
        assertThrows(ConfigurationException.class, () -> registry.register(always("ABCDE001", Shape.STATEMENT)));
        assertThrows(ConfigurationException.class, () -> registry.register(always("TST12345", Shape.STATEMENT)));
        assertEquals(2, registry.size());
        assertEquals("TST001", registry.list().get(0).code());
    }

    @Test
    @DisplayName("a copy is independent of the original")
    public void test2() {
        RuleRegistry registry = new RuleRegistry().register(always("TST001", Shape.STATEMENT));
        RuleRegistry copy = registry.copy();
        copy.register(always("TST002", Shape.STATEMENT));
        assertEquals(1, registry.size());
        assertEquals(2, copy.size());
        assertNull(registry.check("TST002"));
    }

    @Test
    @DisplayName("checks run for every shape of the lineage, in lineage order")
    public void test3() {
        RuleRegistry registry = new RuleRegistry()
                .register(always("TST004", Shape.EXPRESSION))
                .register(always("TST003", Shape.CALL))
                .register(always("TST002", Shape.STATEMENT))
                .register(always("TST001", Shape.FUNCTION_CALL_STATEMENT))
                .register(always("TST005", Shape.ASSIGNMENT));
        List<Finding> findings = registry.dispatch(callStatement("F_Do"), CheckContext.of(Settings.DEFAULT),
                FindingReporter.NONE);
        assertEquals(List.of("TST001", "TST002", "TST003", "TST004"), findings.stream().map(Finding::code).toList());
    }

    @Test
    @DisplayName("a requirement that cannot be supplied fails the dispatch, a disabled check never runs")
    public void test4() {
        LintCheck<Statement> needsFlow = LintCheck.of("TST001", Shape.STATEMENT, "flow",
                Set.of(Requirement.FLOW_GRAPHS), (s, c) -> List.of());
        RuleRegistry registry = new RuleRegistry().register(needsFlow);
        CheckContext context = CheckContext.of(Settings.DEFAULT);
        assertEquals(Set.of(Requirement.SETTINGS), context.available());
        MisconfiguredRuleException e = assertThrows(MisconfiguredRuleException.class,
                () -> registry.dispatch(ret(), context, FindingReporter.NONE));
        assertTrue(e.getMessage().contains("FLOW_GRAPHS"));

        Settings disabled = new Settings.Builder().setCheck("TST001", CheckSettings.disabled()).build();
        assertTrue(registry.dispatch(ret(), CheckContext.of(disabled), FindingReporter.NONE).isEmpty());
    }

    @Test
    @DisplayName("resolution failures in a check are logged, structural failures propagate")
    public void test5() {
        RuleRegistry registry = new RuleRegistry()
                .register(LintCheck.of("TST001", Shape.STATEMENT, "resolution", Set.of(), (s, c) -> {
                    throw new ResolutionException(s, "cannot resolve");
                }))
                .register(always("TST002", Shape.STATEMENT));
        List<Finding> findings = registry.dispatch(ret(), CheckContext.of(Settings.DEFAULT), FindingReporter.NONE);
        assertEquals(1, findings.size());
        assertEquals("TST002", findings.get(0).code());

        RuleRegistry failing = new RuleRegistry()
                .register(LintCheck.of("TST003", Shape.STATEMENT, "structure", Set.of(), (s, c) -> {
                    throw new StructuralException(s, "broken");
                }));
        assertThrows(StructuralException.class,
                () -> failing.dispatch(ret(), CheckContext.of(Settings.DEFAULT), FindingReporter.NONE));
    }

    @Test
    @DisplayName("findings below the level are reported, but not returned")
    public void test6() {
        Settings settings = new Settings.Builder()
                .setCheck("TST001", CheckSettings.at(Severity.INFO))
                .setCheck("TST002", CheckSettings.at(Severity.WARNING))
                .build();
        RuleRegistry registry = new RuleRegistry()
                .register(always("TST001", Shape.STATEMENT))
                .register(always("TST002", Shape.STATEMENT))
                .register(always("TST003", Shape.STATEMENT));
        List<Finding> reported = new ArrayList<>();
        List<Finding> findings = registry.dispatch(ret(), CheckContext.of(settings), reported::add);
        assertEquals(List.of("TST002", "TST003"), findings.stream().map(Finding::code).toList());
        assertEquals(3, reported.size());
        assertEquals(Severity.INFO, reported.get(0).severity());
        assertEquals(Severity.ERROR, findings.get(1).severity());
    }
}
