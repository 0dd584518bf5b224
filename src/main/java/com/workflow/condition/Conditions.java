package com.workflow.condition;

import com.workflow.condition.impl.AndNode;
import com.workflow.condition.impl.BooleanLiteralNode;
import com.workflow.condition.impl.ComparisonNode;
import com.workflow.condition.impl.ContainsNode;
import com.workflow.condition.impl.DisjunctionNode;
import com.workflow.condition.impl.ExpressionNode;
import com.workflow.condition.impl.FunctionCallNode;
import com.workflow.condition.impl.NotNode;
import com.workflow.condition.impl.NumberLiteralNode;
import com.workflow.condition.impl.OrNode;
import com.workflow.condition.impl.ParenthesesNode;
import com.workflow.condition.impl.PropertyAccessNode;
import com.workflow.condition.impl.StringLiteralNode;
import com.workflow.condition.impl.TernaryNode;

import java.util.List;

/**
 * Factory methods for assembling condition trees programmatically.
 * <p>
 * Only structural well-formedness is guaranteed; callers are responsible for semantic
 * correctness such as not comparing incompatible values.
 */
public final class Conditions {

    /**
     * Property holding the name of the event that triggered the workflow.
     */
    public static final String EVENT_NAME_PROPERTY = "github.event_name";

    private Conditions() {
    }

    public static ConditionNode expression(String text) {
        return new ExpressionNode(text);
    }

    /**
     * Create a raw expression carrying a description for multiline rendering.
     */
    public static ConditionNode expression(String text, String description) {
        return new ExpressionNode(text, description);
    }

    public static ConditionNode and(ConditionNode left, ConditionNode right) {
        return new AndNode(left, right);
    }

    public static ConditionNode or(ConditionNode left, ConditionNode right) {
        return new OrNode(left, right);
    }

    public static ConditionNode not(ConditionNode child) {
        return new NotNode(child);
    }

    public static ConditionNode parentheses(ConditionNode child) {
        return new ParenthesesNode(child);
    }

    public static ConditionNode comparison(ConditionNode left, ComparisonOperator operator, ConditionNode right) {
        return new ComparisonNode(left, operator, right);
    }

    public static ConditionNode equalTo(ConditionNode left, ConditionNode right) {
        return comparison(left, ComparisonOperator.EQ, right);
    }

    public static ConditionNode notEqualTo(ConditionNode left, ConditionNode right) {
        return comparison(left, ComparisonOperator.NE, right);
    }

    public static ConditionNode contains(ConditionNode array, ConditionNode value) {
        return new ContainsNode(array, value);
    }

    public static ConditionNode functionCall(String name, ConditionNode... arguments) {
        return new FunctionCallNode(name, List.of(arguments));
    }

    public static ConditionNode property(String path) {
        return new PropertyAccessNode(path);
    }

    public static ConditionNode string(String value) {
        return new StringLiteralNode(value);
    }

    public static ConditionNode bool(boolean value) {
        return new BooleanLiteralNode(value);
    }

    public static ConditionNode number(String value) {
        return new NumberLiteralNode(value);
    }

    public static ConditionNode nullLiteral() {
        return new ExpressionNode("null");
    }

    public static ConditionNode ternary(ConditionNode condition, ConditionNode trueValue, ConditionNode falseValue) {
        return new TernaryNode(condition, trueValue, falseValue);
    }

    /**
     * Create {@code github.event_name == '<eventName>'}.
     */
    public static ConditionNode eventTypeEquals(String eventName) {
        return equalTo(property(EVENT_NAME_PROPERTY), string(eventName));
    }

    /**
     * Create an n-ary OR. A single term is returned unwrapped.
     *
     * @throws IllegalArgumentException if no terms are given
     */
    public static ConditionNode disjunction(boolean multiline, ConditionNode... terms) {
        return disjunction(multiline, List.of(terms));
    }

    /**
     * Create an n-ary OR. A single term is returned unwrapped.
     *
     * @throws IllegalArgumentException if no terms are given
     */
    public static ConditionNode disjunction(boolean multiline, List<ConditionNode> terms) {
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("Disjunction requires at least one term");
        }
        if (terms.size() == 1) {
            return terms.get(0);
        }
        return new DisjunctionNode(terms, multiline);
    }
}
