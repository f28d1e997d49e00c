package org.stlint.analyzer.lint.checks;

import org.stlint.analyzer.lint.LintCheck;
import org.stlint.analyzer.lint.RuleRegistry;

import java.util.List;

public class BuiltinChecks {

    private BuiltinChecks() {
    }

    public static List<LintCheck<?>> all() {
        return List.of(new UnsignedSubtraction(), new DivisionByZero(),
                new InvalidScoping(), new VariableExists(), new ReadBeforeAssignment(),
                new MethodReturnValue(), new MethodOutputs(), new PropertyGetterValue(),
                new SetterReadsValue(), new SetterWritesValue(),
                new EnumCaseCoverage(), new NamedArguments(), new FunctionExists());
    }

    public static RuleRegistry registerAll(RuleRegistry registry) {
        all().forEach(registry::register);
        return registry;
    }

    public static RuleRegistry newRegistry() {
        return registerAll(new RuleRegistry());
    }
}
