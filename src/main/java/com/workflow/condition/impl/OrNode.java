package com.workflow.condition.impl;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;

/**
 * Logical OR of two conditions, rendered as {@code (L) || (R)}.
 */
public class OrNode implements ConditionNode {

    private final ConditionNode left;
    private final ConditionNode right;

    public OrNode(ConditionNode left, ConditionNode right) {
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
        return "(" + left.render() + ") || (" + right.render() + ")";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.OR;
    }

    @Override
    public String toString() {
        return "OR(" + left + ", " + right + ")";
    }
}
