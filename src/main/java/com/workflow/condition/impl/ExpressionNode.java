package com.workflow.condition.impl;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;

/**
 * Leaf node holding raw expression text, rendered verbatim.
 * The optional description is emitted as a comment line by multiline disjunctions.
 */
public class ExpressionNode implements ConditionNode {

    private final String expression;
    private final String description;

    public ExpressionNode(String expression) {
        this(expression, null);
    }

    public ExpressionNode(String expression, String description) {
        this.expression = expression;
        this.description = description;
    }

    public String getExpression() {
        return expression;
    }

    public String getDescription() {
        return description;
    }

    public boolean hasDescription() {
        return description != null && !description.isEmpty();
    }

    @Override
    public String render() {
        return expression;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.EXPRESSION;
    }

    @Override
    public String toString() {
        return "EXPR(" + expression + ")";
    }
}
