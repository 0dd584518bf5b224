package com.workflow.condition.impl;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;

/**
 * Membership check rendered as {@code contains(array, value)}.
 */
public class ContainsNode implements ConditionNode {

    private final ConditionNode array;
    private final ConditionNode value;

    public ContainsNode(ConditionNode array, ConditionNode value) {
        this.array = array;
        this.value = value;
    }

    public ConditionNode getArray() {
        return array;
    }

    public ConditionNode getValue() {
        return value;
    }

    @Override
    public String render() {
        return "contains(" + array.render() + ", " + value.render() + ")";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.CONTAINS;
    }

    @Override
    public String toString() {
        return "CONTAINS(" + array + ", " + value + ")";
    }
}
