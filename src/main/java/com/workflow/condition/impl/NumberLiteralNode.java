package com.workflow.condition.impl;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;

/**
 * Numeric literal kept as its source text so no formatting is lost.
 */
public class NumberLiteralNode implements ConditionNode {

    private final String value;

    public NumberLiteralNode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String render() {
        return value;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.NUMBER_LITERAL;
    }

    @Override
    public String toString() {
        return "NUMBER(" + value + ")";
    }
}
