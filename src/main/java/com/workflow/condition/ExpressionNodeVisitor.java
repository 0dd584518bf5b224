package com.workflow.condition;

import com.workflow.condition.impl.ExpressionNode;

/**
 * Callback invoked for each raw expression leaf of a condition tree.
 *
 * @param <E> Exception type the callback may throw to stop the walk
 */
@FunctionalInterface
public interface ExpressionNodeVisitor<E extends Exception> {

    void visit(ExpressionNode expression) throws E;
}
