package org.stlint.analyzer.lint;

import org.stlint.analyzer.common.settings.Settings;
import org.stlint.analyzer.prepwork.flow.FlowGraphs;
import org.stlint.analyzer.prepwork.scope.ScopeContext;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/*
Everything a check may use besides the element itself. Settings are always present; the scope and
the flow graphs only when the dispatcher can supply them.
 */
public record CheckContext(ScopeContext scope, Settings settings, FlowGraphs flowGraphs) {

    public CheckContext {
        Objects.requireNonNull(settings);
    }

    public static CheckContext of(Settings settings) {
        return new CheckContext(null, settings, null);
    }

    public Set<Requirement> available() {
        Set<Requirement> set = EnumSet.of(Requirement.SETTINGS);
        if (scope != null) set.add(Requirement.SCOPE);
        if (flowGraphs != null) set.add(Requirement.FLOW_GRAPHS);
        return set;
    }
}
