package com.catalog.refgraph.api;

/** Immutable 3D vector field value. */
public record Vector3(float x, float y, float z) {

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}
