package com.workflow.adapter.spring;

import com.workflow.command.CommentEventTable;
import com.workflow.render.ExpressionLineBreaker;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the condition compiler.
 */
@ConfigurationProperties(prefix = "condition-compiler")
public class ConditionCompilerProperties {

    /**
     * Whether the condition compiler is enabled.
     */
    private boolean enabled = true;

    /**
     * Longest line the line breaker leaves untouched.
     */
    private int maxLineLength = ExpressionLineBreaker.DEFAULT_MAX_LINE_LENGTH;

    /**
     * Line length after which the line breaker ends a line at the next logical operator.
     */
    private int breakThreshold = ExpressionLineBreaker.DEFAULT_BREAK_THRESHOLD;

    /**
     * Path to the comment event table.
     * Supports classpath: prefix for classpath resources.
     */
    private String eventTablePath = CommentEventTable.DEFAULT_PATH;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public void setMaxLineLength(int maxLineLength) {
        this.maxLineLength = maxLineLength;
    }

    public int getBreakThreshold() {
        return breakThreshold;
    }

    public void setBreakThreshold(int breakThreshold) {
        this.breakThreshold = breakThreshold;
    }

    public String getEventTablePath() {
        return eventTablePath;
    }

    public void setEventTablePath(String eventTablePath) {
        this.eventTablePath = eventTablePath;
    }
}
