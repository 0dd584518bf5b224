package com.workflow.condition;

import com.workflow.condition.impl.AndNode;
import com.workflow.condition.impl.DisjunctionNode;
import com.workflow.condition.impl.ExpressionNode;
import com.workflow.condition.impl.NotNode;
import com.workflow.condition.impl.OrNode;
import com.workflow.condition.impl.ParenthesesNode;

/**
 * Walks the logical structure of a condition tree and reports every raw expression leaf.
 * <p>
 * Recursion covers AND, OR, NOT, parentheses and disjunctions, left to right and depth first.
 * Comparisons, function calls and the other value nodes are atomic and are not entered.
 */
public final class ConditionTreeVisitor {

    private ConditionTreeVisitor() {
    }

    /**
     * Visit every expression leaf of the tree. The first exception thrown by the visitor
     * stops the walk and is propagated.
     *
     * @param node    Root node, may be null
     * @param visitor Callback for expression leaves
     */
    public static <E extends Exception> void visit(ConditionNode node, ExpressionNodeVisitor<E> visitor) throws E {
        if (node == null) {
            return;
        }

        switch (node.getType()) {
            case EXPRESSION -> visitor.visit((ExpressionNode) node);
            case AND -> {
                AndNode and = (AndNode) node;
                visit(and.getLeft(), visitor);
                visit(and.getRight(), visitor);
            }
            case OR -> {
                OrNode or = (OrNode) node;
                visit(or.getLeft(), visitor);
                visit(or.getRight(), visitor);
            }
            case NOT -> visit(((NotNode) node).getChild(), visitor);
            case PARENTHESES -> visit(((ParenthesesNode) node).getChild(), visitor);
            case DISJUNCTION -> {
                for (ConditionNode term : ((DisjunctionNode) node).getTerms()) {
                    visit(term, visitor);
                }
            }
            default -> {
                // Atomic from the visitor's point of view
            }
        }
    }
}
