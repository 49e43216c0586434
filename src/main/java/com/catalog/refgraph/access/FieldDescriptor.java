package com.catalog.refgraph.access;

import java.lang.reflect.Field;

import com.catalog.refgraph.api.ValueKind;

/**
 * Resolved, cached description of one queryable field.
 *
 * @param name            Field name as written in queries.
 * @param kind            Value kind derived from the declared type.
 * @param owningType      The class that declares the field (may be a supertype
 *                        of the record type it was resolved for).
 * @param declaredType    The declared Java type of the field.
 * @param typeDisplayName Short type label for display ({@code int},
 *                        {@code List<Item>}, ...).
 * @param field           The reflective handle used to read the value.
 */
public record FieldDescriptor(String name, ValueKind kind, Class<?> owningType, Class<?> declaredType,
        String typeDisplayName, Field field) {

    @Override
    public String toString() {
        return owningType.getSimpleName() + "." + name + " : " + typeDisplayName;
    }
}
