package com.catalog.refgraph.api;

/** Immutable 2D vector field value. */
public record Vector2(float x, float y) {

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
