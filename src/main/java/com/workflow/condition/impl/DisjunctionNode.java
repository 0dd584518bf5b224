package com.workflow.condition.impl;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * N-ary OR of conditions. Avoids deeply nested binary OR trees in generated output.
 * <p>
 * Single-line form: {@code T1 || T2 || T3}. Multiline form puts each term on its own line
 * with a trailing {@code ||} on all but the last, and a {@code # description} line before
 * any expression term carrying a description.
 */
public class DisjunctionNode implements ConditionNode {

    private static final Logger log = LoggerFactory.getLogger(DisjunctionNode.class);

    private final List<ConditionNode> terms;
    private final boolean multiline;

    public DisjunctionNode(List<ConditionNode> terms, boolean multiline) {
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("Disjunction requires at least one term");
        }
        this.terms = List.copyOf(terms);
        this.multiline = multiline;
    }

    public List<ConditionNode> getTerms() {
        return terms;
    }

    public boolean isMultiline() {
        return multiline;
    }

    @Override
    public String render() {
        if (terms.size() == 1) {
            return terms.get(0).render();
        }
        if (multiline) {
            return renderMultiline();
        }

        List<String> parts = new ArrayList<>(terms.size());
        for (ConditionNode term : terms) {
            parts.add(term.render());
        }
        return String.join(" || ", parts);
    }

    private String renderMultiline() {
        log.debug("Rendering multiline disjunction with {} terms", terms.size());

        List<String> lines = new ArrayList<>(terms.size());
        for (int i = 0; i < terms.size(); i++) {
            ConditionNode term = terms.get(i);
            StringBuilder line = new StringBuilder();

            if (term instanceof ExpressionNode expr && expr.hasDescription()) {
                line.append("# ").append(expr.getDescription()).append('\n');
            }

            line.append(term.render());
            if (i < terms.size() - 1) {
                line.append(" ||");
            }
            lines.add(line.toString());
        }
        return String.join("\n", lines);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.DISJUNCTION;
    }

    @Override
    public String toString() {
        return "DISJUNCTION(" + terms + ")";
    }
}
