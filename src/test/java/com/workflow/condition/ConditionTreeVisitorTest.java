package com.workflow.condition;

import com.workflow.config.ConditionExpressionParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static com.workflow.condition.Conditions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConditionTreeVisitor.
 */
class ConditionTreeVisitorTest {

    @Test
    @DisplayName("Should visit expression leaves left to right, depth first")
    void shouldVisitLeavesInOrder() {
        ConditionNode node = ConditionExpressionParser.parse("a && (b || !c) && d");
        List<String> seen = new ArrayList<>();

        ConditionTreeVisitor.visit(node, expr -> seen.add(expr.getExpression()));

        assertEquals(List.of("a", "b", "c", "d"), seen);
    }

    @Test
    @DisplayName("Should recurse into disjunctions and parentheses")
    void shouldVisitDisjunctionTerms() {
        ConditionNode node = disjunction(false,
                expression("a"),
                parentheses(not(expression("b"))),
                expression("c"));
        List<String> seen = new ArrayList<>();

        ConditionTreeVisitor.visit(node, expr -> seen.add(expr.getExpression()));

        assertEquals(List.of("a", "b", "c"), seen);
    }

    @Test
    @DisplayName("Comparisons and calls are atomic and not entered")
    void shouldNotEnterAtomicNodes() {
        ConditionNode node = and(expression("x"),
                or(eventTypeEquals("issues"), contains(property("labels"), string("bug"))));
        List<String> seen = new ArrayList<>();

        ConditionTreeVisitor.visit(node, expr -> seen.add(expr.getExpression()));

        assertEquals(List.of("x"), seen);
    }

    @Test
    @DisplayName("First visitor error stops the walk and propagates")
    void shouldStopAtFirstError() {
        ConditionNode node = ConditionExpressionParser.parse("a && b && c");
        List<String> seen = new ArrayList<>();
        ExpressionNodeVisitor<IOException> visitor = expr -> {
            seen.add(expr.getExpression());
            if (expr.getExpression().equals("b")) {
                throw new IOException("bad leaf " + expr.getExpression());
            }
        };

        IOException e = assertThrows(IOException.class, () -> ConditionTreeVisitor.visit(node, visitor));

        assertEquals("bad leaf b", e.getMessage());
        assertEquals(List.of("a", "b"), seen);
    }

    @Test
    @DisplayName("Null tree is a no-op")
    void shouldIgnoreNull() {
        List<String> seen = new ArrayList<>();
        ConditionTreeVisitor.visit(null, expr -> seen.add(expr.getExpression()));
        assertTrue(seen.isEmpty());
    }
}
