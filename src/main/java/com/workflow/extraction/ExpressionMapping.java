package com.workflow.extraction;

/**
 * Mapping between a platform expression found in markdown and the environment variable
 * it is passed through.
 *
 * @param original Full original text including the {@code ${{ }}} wrapper
 * @param envVar   Environment variable name
 * @param content  Expression text without the wrapper
 */
public record ExpressionMapping(String original, String envVar, String content) {

    /**
     * Placeholder that replaces the expression in the markdown.
     */
    public String placeholder() {
        return "__" + envVar + "__";
    }
}
