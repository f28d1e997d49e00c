package org.stlint.analyzer.lint;

import org.stlint.analyzer.common.ConfigurationException;

public class MisconfiguredRuleException extends ConfigurationException {

    public MisconfiguredRuleException(String message) {
        super(message);
    }
}
