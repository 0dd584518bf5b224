package com.workflow.condition.impl;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;

/**
 * Logical AND of two conditions, rendered as {@code (L) && (R)}.
 */
public class AndNode implements ConditionNode {

    private final ConditionNode left;
    private final ConditionNode right;

    public AndNode(ConditionNode left, ConditionNode right) {
        this.left = left;
        this.right = right;
    }

    public ConditionNode getLeft() {
        return left;
    }

    public ConditionNode getRight() {
        return right;
    }

    @Override
    public String render() {
        return "(" + left.render() + ") && (" + right.render() + ")";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.AND;
    }

    @Override
    public String toString() {
        return "AND(" + left + ", " + right + ")";
    }
}
