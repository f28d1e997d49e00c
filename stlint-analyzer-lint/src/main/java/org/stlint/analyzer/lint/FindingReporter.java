package org.stlint.analyzer.lint;

import java.io.PrintStream;

/*
Receives every finding that is not suppressed, as it is produced, including those that are left
out of the result because of their level.
 */
@FunctionalInterface
public interface FindingReporter {

    FindingReporter NONE = finding -> {
    };

    void report(Finding finding);

    static FindingReporter printing(PrintStream out, int maxContext) {
        return finding -> {
            out.println(finding.pretty(maxContext));
            out.println();
        };
    }
}
