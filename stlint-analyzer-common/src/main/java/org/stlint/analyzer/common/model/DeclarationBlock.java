package org.stlint.analyzer.common.model;

import java.util.Locale;

public enum DeclarationBlock {
    VAR_INPUT, VAR_OUTPUT, VAR_IN_OUT, VAR, VAR_GLOBAL, VAR_INST, VAR_STAT, VAR_TEMP;

    public static DeclarationBlock of(String keyword) {
        return valueOf(keyword.trim().toUpperCase(Locale.ROOT));
    }

    /*
    inputs and in-outs are provided by the caller, instance variables of methods are assumed to
    carry their value from the previous call
     */
    public boolean initializedExternally() {
        return this == VAR_INPUT || this == VAR_IN_OUT || this == VAR_INST;
    }
}
