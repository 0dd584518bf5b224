package com.workflow.exception;

/**
 * Exception thrown when a command trigger cannot be turned into a condition.
 */
public class CommandConditionException extends ConditionCompilerException {

    public CommandConditionException(String message) {
        super(message);
    }

    public CommandConditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
