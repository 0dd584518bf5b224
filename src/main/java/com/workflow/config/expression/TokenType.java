package com.workflow.config.expression;

/**
 * Token types for condition expression parsing.
 */
public enum TokenType {
    // Opaque text: property paths, comparisons, function calls
    LITERAL,

    // Logical operators
    AND,
    OR,
    NOT,

    // Delimiters
    LPAREN,
    RPAREN,

    // Special
    EOF
}
