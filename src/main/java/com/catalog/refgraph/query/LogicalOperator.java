package com.catalog.refgraph.query;

/** How a {@link ConditionGroup} combines its enabled conditions. */
public enum LogicalOperator {
    AND,
    OR
}
