package com.catalog.refgraph.access;

/** Case-insensitive text test modes. */
public enum TextMatch {
    CONTAINS,
    NOT_CONTAINS,
    STARTS_WITH,
    ENDS_WITH
}
