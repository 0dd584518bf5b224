package com.workflow.condition.impl;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;

public class BooleanLiteralNode implements ConditionNode {

    private final boolean value;

    public BooleanLiteralNode(boolean value) {
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String render() {
        return value ? "true" : "false";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.BOOLEAN_LITERAL;
    }

    @Override
    public String toString() {
        return "BOOLEAN(" + value + ")";
    }
}
