package com.catalog.refgraph.api;

import java.util.Collection;
import java.util.Map;

/**
 * The fixed set of value kinds a record field can hold.
 */
public enum ValueKind {
    NULL,
    INTEGER,
    FLOAT,
    BOOLEAN,
    STRING,
    VECTOR2,
    VECTOR3,
    COLOR,
    ENUM,
    RECORD_REF,
    OBJECT;

    /** True for kinds whose textual form is their payload. */
    public boolean isTextual() {
        return this == STRING;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    /**
     * Classifies a declared Java type. Used for field descriptors, where no
     * runtime value is available.
     */
    public static ValueKind ofType(Class<?> type) {
        if (type == null)
            return NULL;
        if (type == int.class || type == long.class || type == short.class || type == byte.class
                || type == Integer.class || type == Long.class || type == Short.class || type == Byte.class)
            return INTEGER;
        if (type == float.class || type == double.class || type == Float.class || type == Double.class)
            return FLOAT;
        if (type == boolean.class || type == Boolean.class)
            return BOOLEAN;
        if (type == String.class || type == char.class || type == Character.class)
            return STRING;
        if (type == Vector2.class)
            return VECTOR2;
        if (type == Vector3.class)
            return VECTOR3;
        if (type == Color.class)
            return COLOR;
        if (type.isEnum())
            return ENUM;
        if (DataRecord.class.isAssignableFrom(type))
            return RECORD_REF;
        return OBJECT;
    }

    /** True if the declared type may hold further records (arrays, collections, maps). */
    public static boolean isContainer(Class<?> type) {
        return type.isArray() || Collection.class.isAssignableFrom(type) || Map.class.isAssignableFrom(type);
    }
}
