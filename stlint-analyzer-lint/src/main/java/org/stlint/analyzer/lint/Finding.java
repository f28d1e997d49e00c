package org.stlint.analyzer.lint;

import org.stlint.analyzer.common.settings.Severity;

public record Finding(String code, Severity severity, String message, Location location) {

    // LEVEL: CODE: message, followed by the rendered location
    public String pretty(int maxContext) {
        return severity + ": " + code + ": " + message + "\n" + location.pretty(maxContext);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
