package com.workflow.config.expression;

import com.workflow.exception.ExpressionParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.workflow.config.expression.ExpressionConfig.*;

/**
 * Tokenizer for condition expressions.
 * <p>
 * Only the logical structure is recognized: {@code &&}, {@code ||}, {@code !} and grouping
 * parentheses. Everything else is an opaque literal run, which may itself contain balanced
 * parentheses (function calls) and quoted strings. Operators and parentheses inside quotes
 * never split a literal.
 */
public final class ExpressionTokenizer {

    private static final Logger log = LoggerFactory.getLogger(ExpressionTokenizer.class);

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, always terminated by an EOF token
     * @throws ExpressionParseException if a literal run turns out to be empty
     */
    public List<Token> tokenize() {
        log.debug("Tokenizing expression of length {}", length);
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            // Skip whitespace
            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            if (input.startsWith(AND, pos)) {
                pos += 2;
                tokens.add(new Token(TokenType.AND, AND, start));
            } else if (input.startsWith(OR, pos)) {
                pos += 2;
                tokens.add(new Token(TokenType.OR, OR, start));
            } else if (isNotOperatorAt(input, pos)) {
                advance();
                tokens.add(new Token(TokenType.NOT, "!", start));
            } else if (c == Operators.LEFT_PAREN) {
                advance();
                tokens.add(new Token(TokenType.LPAREN, "(", start));
            } else if (c == Operators.RIGHT_PAREN) {
                advance();
                tokens.add(new Token(TokenType.RPAREN, ")", start));
            } else {
                tokens.add(readLiteral());
            }
        }

        tokens.add(new Token(TokenType.EOF, "", pos));
        return tokens;
    }

    /**
     * Read a literal run up to the next logical operator or unmatched ')' at depth zero.
     */
    private Token readLiteral() {
        int start = pos;
        int parenDepth = 0;

        while (!isAtEnd()) {
            char c = peek();

            if (isQuote(c)) {
                skipQuoted();
                continue;
            }

            // Parentheses belonging to the literal itself, e.g. function call arguments
            if (c == Operators.LEFT_PAREN) {
                parenDepth++;
                advance();
                continue;
            }
            if (c == Operators.RIGHT_PAREN) {
                if (parenDepth == 0) {
                    break;
                }
                parenDepth--;
                advance();
                continue;
            }

            if (parenDepth == 0 && (isLogicalOperatorAt(input, pos) || isNotOperatorAt(input, pos))) {
                break;
            }

            advance();
        }

        String literal = input.substring(start, pos).trim();
        if (literal.isEmpty()) {
            throw new ExpressionParseException("unexpected empty literal at position " + start, start);
        }
        return new Token(TokenType.LITERAL, literal, start);
    }

    /**
     * Skip a quoted section including both quotes. An unterminated quote runs to the end of input.
     */
    private void skipQuoted() {
        char quote = advance();
        while (!isAtEnd()) {
            char c = advance();
            if (c == quote) {
                return;
            }
            if (c == Operators.BACKSLASH && !isAtEnd()) {
                advance();
            }
        }
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
