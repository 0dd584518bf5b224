package com.workflow.condition.impl;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;

/**
 * Conditional value rendered as {@code condition ? trueValue : falseValue}.
 */
public class TernaryNode implements ConditionNode {

    private final ConditionNode condition;
    private final ConditionNode trueValue;
    private final ConditionNode falseValue;

    public TernaryNode(ConditionNode condition, ConditionNode trueValue, ConditionNode falseValue) {
        this.condition = condition;
        this.trueValue = trueValue;
        this.falseValue = falseValue;
    }

    public ConditionNode getCondition() {
        return condition;
    }

    public ConditionNode getTrueValue() {
        return trueValue;
    }

    public ConditionNode getFalseValue() {
        return falseValue;
    }

    @Override
    public String render() {
        return condition.render() + " ? " + trueValue.render() + " : " + falseValue.render();
    }

    @Override
    public ConditionType getType() {
        return ConditionType.TERNARY;
    }

    @Override
    public String toString() {
        return "TERNARY(" + condition + ", " + trueValue + ", " + falseValue + ")";
    }
}
