package com.workflow.exception;

/**
 * Base exception for the condition compiler.
 */
public class ConditionCompilerException extends RuntimeException {

    public ConditionCompilerException(String message) {
        super(message);
    }

    public ConditionCompilerException(String message, Throwable cause) {
        super(message, cause);
    }
}
