package com.workflow.config;

import com.workflow.condition.ConditionNode;
import com.workflow.config.expression.ExpressionParser;
import com.workflow.config.expression.ExpressionTokenizer;
import com.workflow.config.expression.Token;
import com.workflow.exception.ExpressionParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Facade for parsing boolean condition expressions into ConditionNode trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Logical operators: &amp;&amp;, ||, !</li>
 *   <li>Parentheses for grouping</li>
 *   <li>Opaque literals: property paths, comparisons, function calls with their own
 *   parentheses, and single-, double- or backtick-quoted strings with backslash escapes</li>
 * </ul>
 * <p>
 * Precedence: ! > &amp;&amp; > || (parentheses override)
 * <p>
 * Each call uses a fresh tokenizer and parser, so the facade is safe for concurrent use.
 */
public final class ConditionExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(ConditionExpressionParser.class);

    private ConditionExpressionParser() {
    }

    /**
     * Parse a condition expression into a ConditionNode tree.
     *
     * @param expression Expression string without the {@code ${{ }}} wrapper
     * @return Parsed condition tree
     * @throws ExpressionParseException if the expression is blank or malformed
     */
    public static ConditionNode parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionParseException("empty expression");
        }
        log.debug("Parsing expression: {}", expression);

        // Tokenize
        ExpressionTokenizer tokenizer = new ExpressionTokenizer(expression);
        List<Token> tokens = tokenizer.tokenize();

        // Parse
        ExpressionParser parser = new ExpressionParser(expression, tokens);
        return parser.parse();
    }
}
