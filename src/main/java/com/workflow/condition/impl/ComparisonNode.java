package com.workflow.condition.impl;

import com.workflow.condition.ComparisonOperator;
import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;

/**
 * Binary comparison such as {@code github.event_name == 'issues'}.
 */
public class ComparisonNode implements ConditionNode {

    private final ConditionNode left;
    private final ComparisonOperator operator;
    private final ConditionNode right;

    public ComparisonNode(ConditionNode left, ComparisonOperator operator, ConditionNode right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public ConditionNode getLeft() {
        return left;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public ConditionNode getRight() {
        return right;
    }

    @Override
    public String render() {
        return left.render() + " " + operator.symbol() + " " + right.render();
    }

    @Override
    public ConditionType getType() {
        return ConditionType.COMPARISON;
    }

    @Override
    public String toString() {
        return operator + "(" + left + ", " + right + ")";
    }
}
