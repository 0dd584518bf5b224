package com.workflow.config;

import com.workflow.command.CommandConditionBuilder;
import com.workflow.command.CommentEventTable;
import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;
import com.workflow.condition.impl.ExpressionNode;
import com.workflow.exception.ExpressionParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.workflow.condition.Conditions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConditionExpressionParser.
 */
class ConditionExpressionParserTest {

    private static String reparse(String text) {
        return ConditionExpressionParser.parse(text).render();
    }

    // =====================================================================
    // Precedence
    // =====================================================================

    @ParameterizedTest
    @CsvSource(delimiterString = "=>", value = {
            "a || b && c   => (a) || ((b) && (c))",
            "!a && b       => (!(a)) && (b)",
            "a && b || c   => ((a) && (b)) || (c)",
            "a && (b || c) => (a) && ((b) || (c))",
            "!(a || b)     => !((a) || (b))",
            "!!a           => !(!(a))",
            "a || b || c   => ((a) || (b)) || (c)",
            "((a))         => a"
    })
    @DisplayName("Operators bind NOT > AND > OR")
    void shouldHonorPrecedence(String input, String expected) {
        assertEquals(expected, reparse(input));
    }

    @Test
    @DisplayName("Bare literal parses to an expression node with unmodified text")
    void shouldParseLiteral() {
        ConditionNode node = ConditionExpressionParser.parse("  github.event.action == 'opened'  ");

        assertEquals(ConditionType.EXPRESSION, node.getType());
        assertEquals("github.event.action == 'opened'", ((ExpressionNode) node).getExpression());
    }

    @Test
    @DisplayName("&& inside a quoted function argument does not split the literal")
    void shouldBeQuoteAware() {
        ConditionNode node = ConditionExpressionParser.parse("contains(x, '&&')");

        assertEquals(ConditionType.EXPRESSION, node.getType());
        assertEquals("contains(x, '&&')", node.render());
    }

    @Test
    @DisplayName("!= is part of the literal, not a NOT operator")
    void shouldParseNotEquals() {
        ConditionNode node = ConditionExpressionParser.parse("github.event_name != 'push' && !cancelled()");

        assertEquals(ConditionType.AND, node.getType());
        assertEquals("(github.event_name != 'push') && (!(cancelled()))", node.render());
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\t\n"})
    @DisplayName("Blank input fails with 'empty expression'")
    void shouldRejectEmpty(String input) {
        ExpressionParseException e = assertThrows(ExpressionParseException.class,
                () -> ConditionExpressionParser.parse(input));
        assertEquals("empty expression", e.getMessage());
    }

    @Test
    @DisplayName("Null input fails with 'empty expression'")
    void shouldRejectNull() {
        assertThrows(ExpressionParseException.class, () -> ConditionExpressionParser.parse(null));
    }

    @Test
    @DisplayName("Unclosed group reports the expected ')'")
    void shouldRejectUnclosedParen() {
        ExpressionParseException e = assertThrows(ExpressionParseException.class,
                () -> ConditionExpressionParser.parse("(a"));
        assertEquals("expected ')' at position 2", e.getMessage());
        assertEquals(2, e.getPosition());
    }

    @Test
    @DisplayName("Trailing ')' is an unexpected token")
    void shouldRejectTrailingParen() {
        ExpressionParseException e = assertThrows(ExpressionParseException.class,
                () -> ConditionExpressionParser.parse("a)"));
        assertEquals("unexpected token ')' at position 1", e.getMessage());
    }

    @Test
    @DisplayName("Missing operand is an unexpected token")
    void shouldRejectMissingOperand() {
        ExpressionParseException e = assertThrows(ExpressionParseException.class,
                () -> ConditionExpressionParser.parse("&& a"));
        assertEquals("unexpected token '&&' at position 0", e.getMessage());

        e = assertThrows(ExpressionParseException.class, () -> ConditionExpressionParser.parse("a &&"));
        assertEquals("unexpected token '' at position 4", e.getMessage());
    }

    @Test
    @DisplayName("Empty group is rejected")
    void shouldRejectEmptyGroup() {
        ExpressionParseException e = assertThrows(ExpressionParseException.class,
                () -> ConditionExpressionParser.parse("a && ()"));
        assertEquals("unexpected token ')' at position 6", e.getMessage());
    }

    // =====================================================================
    // Round trip
    // =====================================================================

    @Test
    @DisplayName("Binary trees survive a reparse unchanged")
    void shouldRoundTripBinaryTrees() {
        List<ConditionNode> trees = List.of(
                and(eventTypeEquals("issues"), contains(property("github.event.issue.body"), string("/bot"))),
                or(not(eventTypeEquals("push")), and(expression("a"), expression("b"))),
                new CommandConditionBuilder(CommentEventTable.defaults())
                        .build(List.of("bot"), List.of("issues"), true)
        );

        for (ConditionNode tree : trees) {
            String first = tree.render();
            assertEquals(first, tree.render());
            assertEquals(first, reparse(first));
        }
    }

    @Test
    @DisplayName("Rendering is stable after one reparse")
    void shouldBeIdempotentUnderReparse() {
        List<ConditionNode> trees = List.of(
                not(functionCall("cancelled")),
                disjunction(false, eventTypeEquals("issues"), eventTypeEquals("push"), expression("always()")),
                new CommandConditionBuilder(CommentEventTable.defaults())
                        .build(List.of("bot", "helper"), null, true)
        );

        for (ConditionNode tree : trees) {
            String once = reparse(tree.render());
            assertEquals(once, reparse(once));
        }
    }
}
