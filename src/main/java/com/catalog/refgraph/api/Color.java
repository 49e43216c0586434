package com.catalog.refgraph.api;

/** Immutable RGBA color field value, components in [0, 1]. */
public record Color(float r, float g, float b, float a) {

    public static Color rgb(float r, float g, float b) {
        return new Color(r, g, b, 1f);
    }

    @Override
    public String toString() {
        return String.format("RGBA(%.3f, %.3f, %.3f, %.3f)", r, g, b, a);
    }
}
