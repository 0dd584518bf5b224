package com.workflow.config.expression;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.impl.AndNode;
import com.workflow.condition.impl.ExpressionNode;
import com.workflow.condition.impl.NotNode;
import com.workflow.condition.impl.OrNode;
import com.workflow.exception.ExpressionParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Parser for condition expressions.
 * Converts tokens into a ConditionNode tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: NOT > AND > OR):
 * <pre>
 * expression := or
 * or         := and ('||' and)*
 * and        := unary ('&amp;&amp;' unary)*
 * unary      := '!' unary | primary
 * primary    := '(' expression ')' | literal
 * </pre>
 * Literals become {@link ExpressionNode}s holding their text unmodified.
 */
public final class ExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(ExpressionParser.class);

    private final String input;
    private final List<Token> tokens;
    private int index;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into a ConditionNode tree.
     *
     * @return Root condition node
     * @throws ExpressionParseException if the tokens do not form a complete expression
     */
    public ConditionNode parse() {
        ConditionNode result = parseExpression();
        if (!check(TokenType.EOF)) {
            throw unexpected();
        }
        log.debug("Parsed expression with {} tokens", tokens.size());
        return result;
    }

    private ConditionNode parseExpression() {
        return parseOr();
    }

    private ConditionNode parseOr() {
        ConditionNode left = parseAnd();
        while (match(TokenType.OR)) {
            left = new OrNode(left, parseAnd());
        }
        return left;
    }

    private ConditionNode parseAnd() {
        ConditionNode left = parseUnary();
        while (match(TokenType.AND)) {
            left = new AndNode(left, parseUnary());
        }
        return left;
    }

    private ConditionNode parseUnary() {
        if (match(TokenType.NOT)) {
            return new NotNode(parseUnary());
        }
        return parsePrimary();
    }

    private ConditionNode parsePrimary() {
        if (log.isTraceEnabled()) {
            log.trace("Parsing primary expression at token {}", peek());
        }

        // Parenthesized expression
        if (match(TokenType.LPAREN)) {
            ConditionNode expr = parseExpression();
            if (!check(TokenType.RPAREN)) {
                throw error("expected ')' at position " + peek().position());
            }
            advance();
            return expr;
        }

        if (match(TokenType.LITERAL)) {
            return new ExpressionNode(previous().text());
        }

        throw unexpected();
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ExpressionParseException unexpected() {
        Token token = peek();
        return error("unexpected token '" + token.text() + "' at position " + token.position());
    }

    private ExpressionParseException error(String message) {
        log.debug("Failed to parse expression '{}': {}", input, message);
        return new ExpressionParseException(message, peek().position());
    }
}
