package org.stlint.analyzer.lint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stlint.analyzer.common.model.*;
import org.stlint.analyzer.common.settings.Settings;
import org.stlint.analyzer.prepwork.Elements;
import org.stlint.analyzer.prepwork.flow.FlowGraphs;
import org.stlint.analyzer.prepwork.scope.ScopeContext;

import java.util.*;

/*
Walks a program and hands every element to the registry.

Per function block: the block itself, its declarations and its body, then each method (with its
declarations and statements), then each property followed by its accessors. Functions of the
program come last, outside any function block. Statements are enumerated structurally, so that
unreachable code is checked as well; each element is dispatched once, even when it is reachable
along two traversal routes.
 */
public class LintAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(LintAnalyzer.class);

    private final RuleRegistry registry;
    private final Settings settings;
    private final FindingReporter reporter;
    private final Options options;

    public record Options(boolean includeFunctions, boolean visitParameters) {
        public static class Builder {
            boolean includeFunctions = true;
            boolean visitParameters = true;

            public Builder setIncludeFunctions(boolean includeFunctions) {
                this.includeFunctions = includeFunctions;
                return this;
            }

            public Builder setVisitParameters(boolean visitParameters) {
                this.visitParameters = visitParameters;
                return this;
            }

            public Options build() {
                return new Options(includeFunctions, visitParameters);
            }
        }
    }

    public LintAnalyzer(RuleRegistry registry, Settings settings) {
        this(registry, settings, FindingReporter.NONE, new Options.Builder().build());
    }

    public LintAnalyzer(RuleRegistry registry, Settings settings, FindingReporter reporter) {
        this(registry, settings, reporter, new Options.Builder().build());
    }

    public LintAnalyzer(RuleRegistry registry, Settings settings, FindingReporter reporter, Options options) {
        this.registry = Objects.requireNonNull(registry);
        this.settings = Objects.requireNonNull(settings);
        this.reporter = Objects.requireNonNull(reporter);
        this.options = Objects.requireNonNull(options);
    }

    public LintResult go(Program program) {
        Run run = new Run(program);
        for (FunctionBlock functionBlock : program.functionBlocks().values()) {
            run.doFunctionBlock(functionBlock);
        }
        if (options.includeFunctions()) {
            for (Function function : program.functions().values()) {
                run.doFunction(function);
            }
        }
        LOGGER.info("Found {} problem(s) in {} function block(s) and {} function(s), {} flow graph(s)",
                run.findings.size(), program.functionBlocks().size(), program.functions().size(),
                run.flowGraphs.size());
        return new LintResult(run.findings);
    }

    // the state of one go(...) call
    private class Run {
        final ScopeContext scope;
        final FlowGraphs flowGraphs = new FlowGraphs();
        final CheckContext context;
        final Set<Element> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        final List<Finding> findings = new ArrayList<>();

        Run(Program program) {
            scope = new ScopeContext(program, settings);
            context = new CheckContext(scope, settings, flowGraphs);
        }

        void doFunctionBlock(FunctionBlock functionBlock) {
            try {
                try (ScopeContext.Guard ignored = scope.enterFunctionBlock(functionBlock)) {
                    visit(functionBlock);
                    doDeclarations(functionBlock);
                    doStatements(functionBlock);
                }
                for (Method method : functionBlock.methods()) {
                    try (ScopeContext.Guard fb = scope.enterFunctionBlock(functionBlock);
                         ScopeContext.Guard m = scope.enterRoutine(method)) {
                        doRoutine(method);
                    }
                }
                for (Property property : functionBlock.properties()) {
                    try (ScopeContext.Guard fb = scope.enterFunctionBlock(functionBlock)) {
                        visit(property);
                        for (PropertyAccessor accessor : accessors(property)) {
                            try (ScopeContext.Guard a = scope.enterRoutine(accessor)) {
                                doRoutine(accessor);
                            }
                        }
                    }
                }
            } catch (RuntimeException re) {
                LOGGER.error("Caught exception in lint analyzer, function block {}", functionBlock.name());
                throw re;
            }
        }

        void doFunction(Function function) {
            try (ScopeContext.Guard f = scope.enterRoutine(function)) {
                doRoutine(function);
            } catch (RuntimeException re) {
                LOGGER.error("Caught exception in lint analyzer, function {}", function.name());
                throw re;
            }
        }

        private List<PropertyAccessor> accessors(Property property) {
            List<PropertyAccessor> list = new ArrayList<>(2);
            if (property.getter() != null) list.add(property.getter());
            if (property.setter() != null) list.add(property.setter());
            return list;
        }

        private void doRoutine(Routine routine) {
            visit(routine);
            doDeclarations(routine);
            doStatements(routine);
        }

        private void doDeclarations(Routine routine) {
            routine.declarations().values().forEach(this::visit);
        }

        private void doStatements(Routine routine) {
            for (Statement statement : Elements.statements(routine)) {
                visit(statement);
                for (Expression expression : Elements.expressions(statement)) {
                    for (Expression sub : Elements.subExpressions(expression)) {
                        visit(sub);
                        if (options.visitParameters() && sub instanceof CallExpression call) {
                            call.parameters().forEach(this::visit);
                        }
                    }
                }
            }
        }

        private void visit(Element element) {
            if (!visited.add(element)) return;
            findings.addAll(registry.dispatch(element, context, reporter));
        }
    }
}
