package com.workflow.condition.impl;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;

/**
 * Logical NOT of a condition.
 */
public class NotNode implements ConditionNode {

    private final ConditionNode child;

    public NotNode(ConditionNode child) {
        this.child = child;
    }

    public ConditionNode getChild() {
        return child;
    }

    /**
     * Renders {@code !(child)}, or {@code !child} for a bare function call.
     * The platform reads {@code !(cancelled())} ambiguously, so function calls are never wrapped.
     */
    @Override
    public String render() {
        if (child.getType() == ConditionType.FUNCTION_CALL) {
            return "!" + child.render();
        }
        return "!(" + child.render() + ")";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.NOT;
    }

    @Override
    public String toString() {
        return "NOT(" + child + ")";
    }
}
