package com.catalog.refgraph.query;

/** Operators a {@link Condition} can apply to a field. */
public enum QueryOperator {
    EQUAL("=="),
    NOT_EQUAL("!="),
    GREATER(">"),
    GREATER_OR_EQUAL(">="),
    LESS("<"),
    LESS_OR_EQUAL("<="),
    CONTAINS("contains"),
    NOT_CONTAINS("not contains"),
    STARTS_WITH("starts with"),
    ENDS_WITH("ends with"),
    REGEX("matches"),
    IS_NULL("is null"),
    IS_NOT_NULL("is not null");

    private final String symbol;

    QueryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** True for operators that ignore the comparison value. */
    public boolean isUnary() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }
}
