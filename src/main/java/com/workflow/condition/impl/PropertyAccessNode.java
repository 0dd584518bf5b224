package com.workflow.condition.impl;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;

/**
 * Dotted property path such as {@code github.event.issue.body}. The path is opaque.
 */
public class PropertyAccessNode implements ConditionNode {

    private final String propertyPath;

    public PropertyAccessNode(String propertyPath) {
        this.propertyPath = propertyPath;
    }

    public String getPropertyPath() {
        return propertyPath;
    }

    @Override
    public String render() {
        return propertyPath;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.PROPERTY_ACCESS;
    }

    @Override
    public String toString() {
        return "PROPERTY(" + propertyPath + ")";
    }
}
