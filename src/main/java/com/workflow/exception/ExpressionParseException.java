package com.workflow.exception;

/**
 * Exception thrown when a condition expression cannot be tokenized or parsed.
 * A malformed guard aborts compilation of the enclosing workflow.
 */
public class ExpressionParseException extends ConditionCompilerException {

    private final int position;

    public ExpressionParseException(String message) {
        this(message, -1);
    }

    public ExpressionParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Character offset of the offending token, or -1 when the error is not tied to a position.
     */
    public int getPosition() {
        return position;
    }
}
