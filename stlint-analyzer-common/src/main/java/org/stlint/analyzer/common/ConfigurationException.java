package org.stlint.analyzer.common;

// bad rule registration or bad settings; raised before any analysis starts
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
