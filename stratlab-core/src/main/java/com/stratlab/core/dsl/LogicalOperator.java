package com.stratlab.core.dsl;

/**
 * Logical operators joining conditions in a rules string.
 */
public enum LogicalOperator {
    AND,
    OR,
    NOT;

    /**
     * Case-insensitive keyword lookup.
     *
     * @return the operator, or null if the word is not a logical keyword
     */
    public static LogicalOperator fromKeyword(String word) {
        for (LogicalOperator op : values()) {
            if (op.name().equalsIgnoreCase(word)) {
                return op;
            }
        }
        return null;
    }
}
