package com.workflow.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.workflow.config.expression.ExpressionConfig.*;

/**
 * Splits long rendered expressions into lines without changing their meaning.
 * <p>
 * The first pass breaks after {@code &&} / {@code ||} once the current line passes the break
 * threshold, or earlier when the text up to the next operator would overflow the maximum.
 * Lines still over the maximum length go through a second pass that breaks after a balanced
 * parenthesis group followed by a logical operator. Quoted literals are never split and
 * a break is only taken where the operator is followed by whitespace, so joining the lines with
 * single spaces gives back the original text up to whitespace runs.
 */
public class ExpressionLineBreaker {

    private static final Logger log = LoggerFactory.getLogger(ExpressionLineBreaker.class);

    public static final int DEFAULT_MAX_LINE_LENGTH = 120;
    public static final int DEFAULT_BREAK_THRESHOLD = 100;

    private final int maxLineLength;
    private final int breakThreshold;

    /**
     * Minimum length of the accumulated text before a parenthesis group may end a line:
     * two thirds of the maximum, 80 at the default width.
     */
    private final int parenGroupMinLength;

    public ExpressionLineBreaker() {
        this(DEFAULT_MAX_LINE_LENGTH, DEFAULT_BREAK_THRESHOLD);
    }

    public ExpressionLineBreaker(int maxLineLength, int breakThreshold) {
        if (maxLineLength <= 0 || breakThreshold <= 0) {
            throw new IllegalArgumentException("Line lengths must be positive");
        }
        if (breakThreshold > maxLineLength) {
            throw new IllegalArgumentException("Break threshold " + breakThreshold
                    + " exceeds max line length " + maxLineLength);
        }
        this.maxLineLength = maxLineLength;
        this.breakThreshold = breakThreshold;
        this.parenGroupMinLength = maxLineLength * 2 / 3;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public int getBreakThreshold() {
        return breakThreshold;
    }

    /**
     * Break an expression into lines at logical operators, falling back to parenthesis groups.
     *
     * @param expression Rendered expression
     * @return Lines in order; a single element when the expression already fits
     */
    public List<String> breakLongExpression(String expression) {
        if (expression.length() <= maxLineLength) {
            return List.of(expression);
        }
        log.debug("Breaking long expression: length={}", expression.length());

        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int length = expression.length();
        int i = 0;

        while (i < length) {
            char c = expression.charAt(i);

            if (isQuote(c)) {
                i = appendQuoted(expression, i, current);
                continue;
            }

            if (isLogicalOperatorAt(expression, i)) {
                current.append(expression, i, i + 2);
                i += 2;

                if (isWhitespaceAt(expression, i)) {
                    int lineLength = current.toString().trim().length();
                    int next = skipBlanks(expression, i);
                    if (lineLength > breakThreshold
                            || lineLength + 1 + nextSegmentLength(expression, next) > maxLineLength) {
                        lines.add(current.toString().trim());
                        current.setLength(0);
                        i = next;
                    }
                }
                continue;
            }

            current.append(c);
            i++;
        }

        if (!current.toString().isBlank()) {
            lines.add(current.toString().trim());
        }

        List<String> finalLines = new ArrayList<>();
        for (String line : lines) {
            if (line.length() > maxLineLength) {
                finalLines.addAll(breakAtParentheses(line));
            } else {
                finalLines.add(line);
            }
        }
        return finalLines;
    }

    /**
     * Break a long line after balanced parenthesis groups that are followed by a logical operator.
     * A line with no such position is returned unchanged.
     *
     * @param expression Line to break
     * @return Lines in order
     */
    public List<String> breakAtParentheses(String expression) {
        if (expression.length() <= maxLineLength) {
            return List.of(expression);
        }

        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int length = expression.length();
        int depth = 0;
        int i = 0;

        while (i < length) {
            char c = expression.charAt(i);

            if (isQuote(c)) {
                i = appendQuoted(expression, i, current);
                continue;
            }

            current.append(c);
            if (c == Operators.LEFT_PAREN) {
                depth++;
            } else if (c == Operators.RIGHT_PAREN) {
                depth--;
                if (depth == 0 && current.length() > parenGroupMinLength && i < length - 1) {
                    int j = skipBlanks(expression, i + 1);
                    if (isLogicalOperatorAt(expression, j) && isWhitespaceAt(expression, j + 2)) {
                        current.append(expression, i + 1, j + 2);
                        lines.add(current.toString().trim());
                        current.setLength(0);
                        i = skipBlanks(expression, j + 2);
                        continue;
                    }
                }
            }
            i++;
        }

        if (!current.toString().isBlank()) {
            lines.add(current.toString().trim());
        }
        return lines;
    }

    /**
     * Append the quoted literal starting at {@code start}, closing quote included.
     *
     * @return Offset just past the literal
     */
    private static int appendQuoted(String expression, int start, StringBuilder current) {
        int end = skipQuoted(expression, start);
        current.append(expression, start, end);
        return end;
    }

    /**
     * Length of the text from {@code start} through the next logical operator outside quotes
     * that is followed by whitespace, or through the end of the expression when there is none.
     */
    private static int nextSegmentLength(String expression, int start) {
        int length = expression.length();
        int i = start;
        while (i < length) {
            char c = expression.charAt(i);
            if (isQuote(c)) {
                i = skipQuoted(expression, i);
                continue;
            }
            if (isLogicalOperatorAt(expression, i) && isWhitespaceAt(expression, i + 2)) {
                return expression.substring(start, i + 2).trim().length();
            }
            i++;
        }
        return expression.substring(start).trim().length();
    }

    private static int skipQuoted(String expression, int start) {
        char quote = expression.charAt(start);
        int i = start + 1;
        while (i < expression.length()) {
            char c = expression.charAt(i++);
            if (c == quote) {
                break;
            }
            if (c == Operators.BACKSLASH && i < expression.length()) {
                i++;
            }
        }
        return i;
    }

    private static boolean isWhitespaceAt(String expression, int pos) {
        return pos < expression.length() && Character.isWhitespace(expression.charAt(pos));
    }

    private static int skipBlanks(String expression, int pos) {
        while (pos < expression.length() && Character.isWhitespace(expression.charAt(pos))) {
            pos++;
        }
        return pos;
    }
}
