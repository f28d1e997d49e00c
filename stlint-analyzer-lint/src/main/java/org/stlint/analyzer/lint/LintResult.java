package org.stlint.analyzer.lint;

import java.util.List;

public record LintResult(List<Finding> findings) {

    public LintResult {
        findings = List.copyOf(findings);
    }

    public boolean isEmpty() {
        return findings.isEmpty();
    }

    // process exit status: 1 when at least one finding remains after gating and suppression
    public int exitCode() {
        return findings.isEmpty() ? 0 : 1;
    }

    public List<Finding> findings(String code) {
        return findings.stream().filter(f -> f.code().equals(code)).toList();
    }
}
