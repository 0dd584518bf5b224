package com.workflow.render;

import java.util.regex.Pattern;

import static com.workflow.config.expression.ExpressionConfig.WRAPPER_CLOSE;
import static com.workflow.config.expression.ExpressionConfig.WRAPPER_OPEN;

/**
 * Helpers for the {@code ${{ ... }}} wrapper around platform expressions.
 */
public final class ExpressionWrapper {

    private static final Pattern LINE_BREAKS = Pattern.compile("[\\n\\t]");
    private static final Pattern SPACE_RUNS = Pattern.compile(" {2,}");

    private ExpressionWrapper() {
    }

    /**
     * Remove a surrounding {@code ${{ }}} wrapper, trimming inside and out.
     * Input without a complete wrapper is only trimmed.
     */
    public static String strip(String expression) {
        String expr = expression.trim();
        if (expr.startsWith(WRAPPER_OPEN) && expr.endsWith(WRAPPER_CLOSE)
                && expr.length() >= WRAPPER_OPEN.length() + WRAPPER_CLOSE.length()) {
            return expr.substring(WRAPPER_OPEN.length(), expr.length() - WRAPPER_CLOSE.length()).trim();
        }
        return expr;
    }

    public static String wrap(String expression) {
        return WRAPPER_OPEN + " " + expression + " " + WRAPPER_CLOSE;
    }

    /**
     * Normalize an expression so multiline and single-line renderings compare equal:
     * newlines and tabs become spaces, space runs collapse, ends are trimmed.
     */
    public static String normalizeForComparison(String expression) {
        String normalized = LINE_BREAKS.matcher(expression).replaceAll(" ");
        normalized = SPACE_RUNS.matcher(normalized).replaceAll(" ");
        return normalized.trim();
    }
}
