package org.stlint.analyzer.common.settings;

import java.util.Locale;

/*
Ordered from most to least severe. A finding is reported when its severity is at least as severe
as the minimum level of the run.
 */
public enum Severity {
    ERROR, WARNING, INFO, FINE;

    public boolean isIncludedAt(Severity minimum) {
        return ordinal() <= minimum.ordinal();
    }

    // accepts the name in any case, or the numeric value 0..3
    public static Severity parse(Object value) {
        if (value instanceof Severity severity) return severity;
        if (value instanceof Number number) {
            int i = number.intValue();
            if (i >= 0 && i < values().length) return values()[i];
            throw new IllegalArgumentException("Severity out of range: " + i);
        }
        if (value instanceof String s) {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        }
        throw new IllegalArgumentException("Cannot convert to severity: " + value);
    }
}
