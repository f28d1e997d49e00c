package org.stlint.analyzer.lint;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
Inline suppression: a line ending in // noqa: CODE1 CODE2 suppresses exactly the listed codes.
Codes are case-sensitive.
 */
public class Suppressions {
    private static final String CODE = "[A-Z]{2,4}\\d{3,4}";
    private static final Pattern NOQA = Pattern.compile("//\\s*noqa:\\s*(" + CODE + "(?:\\s+" + CODE + ")*)\\s*$");

    private Suppressions() {
    }

    public static Set<String> suppressedCodes(String line) {
        if (line == null) return Set.of();
        Matcher m = NOQA.matcher(line);
        if (!m.find()) return Set.of();
        return Set.of(m.group(1).trim().split("\\s+"));
    }

    public static boolean isSuppressed(String line, String code) {
        return suppressedCodes(line).contains(code);
    }
}
