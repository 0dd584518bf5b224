package com.workflow.condition;

/**
 * A node in a condition expression tree.
 * <p>
 * Nodes are immutable and have no evaluation semantics; they only serialize back into
 * platform expression text.
 */
public interface ConditionNode {

    /**
     * Render this node, and its children, as expression text.
     *
     * @return Expression text; identical on every call
     */
    String render();

    /**
     * Get the node type.
     */
    ConditionType getType();
}
