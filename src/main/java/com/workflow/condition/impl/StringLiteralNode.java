package com.workflow.condition.impl;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;

/**
 * Single-quoted string literal. The value is emitted as given, without escaping.
 */
public class StringLiteralNode implements ConditionNode {

    private final String value;

    public StringLiteralNode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String render() {
        return "'" + value + "'";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.STRING_LITERAL;
    }

    @Override
    public String toString() {
        return "STRING(" + value + ")";
    }
}
