package com.workflow.condition;

/**
 * Node types of a condition expression tree.
 */
public enum ConditionType {
    // Leaf text
    EXPRESSION,

    // Logical
    AND,
    OR,
    NOT,
    DISJUNCTION,
    PARENTHESES,

    // Comparison and calls
    COMPARISON,
    FUNCTION_CALL,
    CONTAINS,
    TERNARY,

    // Values
    PROPERTY_ACCESS,
    STRING_LITERAL,
    BOOLEAN_LITERAL,
    NUMBER_LITERAL
}
