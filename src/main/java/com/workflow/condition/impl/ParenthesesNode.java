package com.workflow.condition.impl;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;

/**
 * Explicit grouping of a condition, rendered as {@code (child)}.
 */
public class ParenthesesNode implements ConditionNode {

    private final ConditionNode child;

    public ParenthesesNode(ConditionNode child) {
        this.child = child;
    }

    public ConditionNode getChild() {
        return child;
    }

    @Override
    public String render() {
        return "(" + child.render() + ")";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.PARENTHESES;
    }

    @Override
    public String toString() {
        return "PAREN(" + child + ")";
    }
}
