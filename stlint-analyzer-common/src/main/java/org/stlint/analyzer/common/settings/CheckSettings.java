package org.stlint.analyzer.common.settings;

public record CheckSettings(boolean enabled, Severity level) {

    public static final CheckSettings DEFAULT = new CheckSettings(true, Severity.ERROR);

    public CheckSettings {
        if (level == null) level = Severity.ERROR;
    }

    public static CheckSettings disabled() {
        return new CheckSettings(false, Severity.ERROR);
    }

    public static CheckSettings at(Severity level) {
        return new CheckSettings(true, level);
    }
}
