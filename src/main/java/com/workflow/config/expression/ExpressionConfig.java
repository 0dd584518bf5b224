package com.workflow.config.expression;

/**
 * Operator and delimiter symbols of the condition expression grammar.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Two-character logical operators.
     */
    public static final String AND = "&&";
    public static final String OR = "||";

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char NOT = '!';
        public static final char EQUALS = '=';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKTICK = '`';
        public static final char BACKSLASH = '\\';

        private Operators() {
        }
    }

    /**
     * Opening delimiter of a platform expression wrapper.
     */
    public static final String WRAPPER_OPEN = "${{";

    /**
     * Closing delimiter of a platform expression wrapper.
     */
    public static final String WRAPPER_CLOSE = "}}";

    public static boolean isQuote(char c) {
        return c == Operators.QUOTE_SINGLE || c == Operators.QUOTE_DOUBLE || c == Operators.BACKTICK;
    }

    /**
     * Whether a logical operator ({@code &&} or {@code ||}) starts at the given offset.
     */
    public static boolean isLogicalOperatorAt(String input, int pos) {
        return input.startsWith(AND, pos) || input.startsWith(OR, pos);
    }

    /**
     * Whether the '!' at the given offset is a NOT operator rather than the start of {@code !=}.
     */
    public static boolean isNotOperatorAt(String input, int pos) {
        return input.charAt(pos) == Operators.NOT
                && (pos + 1 >= input.length() || input.charAt(pos + 1) != Operators.EQUALS);
    }
}
