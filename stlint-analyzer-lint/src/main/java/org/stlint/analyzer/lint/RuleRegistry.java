package org.stlint.analyzer.lint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stlint.analyzer.common.ConfigurationException;
import org.stlint.analyzer.common.ResolutionException;
import org.stlint.analyzer.common.model.*;
import org.stlint.analyzer.common.settings.CheckSettings;
import org.stlint.analyzer.common.settings.Settings;
import org.stlint.analyzer.prepwork.scope.ScopeContext;

import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;

/*
Maps node shapes to the checks registered for them, and runs them.

For every element, the checks registered for any shape of its lineage run, shape by shape, in
registration order. A finding is produced for each violation, unless the violating line carries a
suppression comment for the check's code. Every unsuppressed finding goes to the reporter; only
those with a severity at or above the configured level are returned.
 */
public class RuleRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(RuleRegistry.class);
    public static final Pattern CODE = Pattern.compile("[A-Z]{2,4}\\d{3,4}");

    private final Map<Shape<?>, List<LintCheck<?>>> checksByShape = new LinkedHashMap<>();
    private final Map<String, LintCheck<?>> checksByCode = new LinkedHashMap<>();

    public RuleRegistry register(LintCheck<?> check) {
        String code = check.code();
        if (code == null || !CODE.matcher(code).matches()) {
            throw new ConfigurationException("Invalid check code '" + code + "'");
        }
        if (checksByCode.containsKey(code)) {
            throw new ConfigurationException("Check code " + code + " registered twice");
        }
        checksByCode.put(code, check);
        checksByShape.computeIfAbsent(check.shape(), s -> new ArrayList<>()).add(check);
        LOGGER.debug("Registered {} for shape {}", code, check.shape());
        return this;
    }

    // in registration order
    public List<LintCheck<?>> list() {
        return List.copyOf(checksByCode.values());
    }

    public LintCheck<?> check(String code) {
        return checksByCode.get(code);
    }

    public int size() {
        return checksByCode.size();
    }

    public RuleRegistry copy() {
        RuleRegistry copy = new RuleRegistry();
        checksByCode.values().forEach(copy::register);
        return copy;
    }

    public List<Finding> dispatch(Element element, CheckContext context, FindingReporter reporter) {
        List<Finding> findings = new ArrayList<>();
        Settings settings = context.settings();
        for (Shape<?> shape : element.shape().lineage()) {
            List<LintCheck<?>> checks = checksByShape.get(shape);
            if (checks == null) continue;
            for (LintCheck<?> check : checks) {
                CheckSettings checkSettings = settings.checkSettings(check.code());
                if (!checkSettings.enabled()) continue;
                verifyRequirements(check, context);
                List<Violation> violations;
                try {
                    violations = run(check, element, context);
                } catch (ResolutionException re) {
                    LOGGER.warn("Check {} failed on {} in {}: {}", check.code(), element,
                            context.scope() == null ? "?" : context.scope().currentLocation(), re.getMessage());
                    continue;
                }
                for (Violation violation : violations) {
                    Location location = locate(violation, element, context.scope());
                    if (Suppressions.isSuppressed(location.errorLine(), check.code())) {
                        LOGGER.debug("Suppressed {} at {}", check.code(), location.line());
                        continue;
                    }
                    Finding finding = new Finding(check.code(), checkSettings.level(), violation.message(), location);
                    reporter.report(finding);
                    if (checkSettings.level().isIncludedAt(settings.level())) {
                        findings.add(finding);
                    }
                }
            }
        }
        return findings;
    }

    private static void verifyRequirements(LintCheck<?> check, CheckContext context) {
        Set<Requirement> missing = EnumSet.noneOf(Requirement.class);
        missing.addAll(check.requirements());
        missing.removeAll(context.available());
        if (!missing.isEmpty()) {
            throw new MisconfiguredRuleException("Check " + check.code() + " requires " + missing
                                                 + ", which cannot be supplied");
        }
    }

    private static <T extends Element> List<Violation> run(LintCheck<T> check, Element element, CheckContext context) {
        List<Violation> violations = check.check(check.shape().cast(element), context);
        return violations == null ? List.of() : violations;
    }

    /*
    Position from the violation's meta, else from the violating element, else from the checked element.
    Source text from the routine of the violation, else the active routine, else the active function
    block: its declaration section for declarations and named units, its implementation otherwise.
     */
    static Location locate(Violation violation, Element element, ScopeContext scope) {
        FunctionBlock functionBlock = scope == null ? null : scope.currentFunctionBlock();
        Routine activeRoutine = scope == null ? null : scope.currentRoutine();
        Element violating = violation.element() != null ? violation.element() : element;
        SourceMeta meta = violation.meta() != null ? violation.meta() : violating.meta();
        Routine source = violation.source() != null ? violation.source()
                : activeRoutine != null ? activeRoutine : functionBlock;
        String text = null;
        if (source != null) {
            boolean inDeclaration = violating instanceof Declaration || violating instanceof Routine
                                    || violating instanceof Property;
            text = inDeclaration ? source.declarationSource() : source.implementationSource();
        }
        Path file = violation.file() != null ? violation.file() : functionBlock == null ? null : functionBlock.file();
        String method = source == null || source == functionBlock ? null : source.name();
        if (meta == null) {
            return new Location(file, functionBlock == null ? null : functionBlock.name(), method,
                    null, null, null, text, null, null, null);
        }
        return new Location(file, functionBlock == null ? null : functionBlock.name(), method,
                meta.line(), meta.column(), meta.endColumn(),
                text, meta.containerLine(), meta.containerColumn(), meta.containerEndColumn());
    }

    @Override
    public String toString() {
        return "RuleRegistry" + checksByCode.keySet();
    }
}
