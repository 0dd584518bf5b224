package com.workflow.exception;

/**
 * Exception thrown when compiler configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends ConditionCompilerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
