package com.catalog.refgraph.api;

import java.util.Objects;

/**
 * Tagged-variant wrapper around a field value.
 *
 * <p>
 * Every value read from a record is classified into exactly one
 * {@link ValueKind}. Numeric payloads are normalized ({@code long} for
 * integers, {@code double} for floats) so comparison code can switch on the
 * kind instead of probing the boxed Java type.
 */
public final class FieldValue {
    public static final FieldValue NULL = new FieldValue(ValueKind.NULL, null, 0L, 0.0);

    private final ValueKind kind;
    private final Object raw;
    private final long longValue;
    private final double doubleValue;

    private FieldValue(ValueKind kind, Object raw, long longValue, double doubleValue) {
        this.kind = kind;
        this.raw = raw;
        this.longValue = longValue;
        this.doubleValue = doubleValue;
    }

    /** Classifies an arbitrary runtime value. */
    public static FieldValue of(Object value) {
        if (value == null)
            return NULL;
        if (value instanceof FieldValue fv)
            return fv;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte)
            return ofLong(((Number) value).longValue(), value);
        if (value instanceof Float f)
            // Widen through the decimal form so 0.1f compares equal to a typed-in 0.1
            return ofDouble(Double.parseDouble(Float.toString(f)), value);
        if (value instanceof Double d)
            return ofDouble(d, value);
        if (value instanceof Boolean b)
            return new FieldValue(ValueKind.BOOLEAN, b, b ? 1L : 0L, b ? 1.0 : 0.0);
        if (value instanceof String s)
            return new FieldValue(ValueKind.STRING, s, 0L, 0.0);
        if (value instanceof Character c)
            return new FieldValue(ValueKind.STRING, String.valueOf(c), 0L, 0.0);
        if (value instanceof Vector2)
            return new FieldValue(ValueKind.VECTOR2, value, 0L, 0.0);
        if (value instanceof Vector3)
            return new FieldValue(ValueKind.VECTOR3, value, 0L, 0.0);
        if (value instanceof Color)
            return new FieldValue(ValueKind.COLOR, value, 0L, 0.0);
        if (value instanceof Enum<?> e)
            return new FieldValue(ValueKind.ENUM, e, e.ordinal(), e.ordinal());
        if (value instanceof DataRecord)
            return new FieldValue(ValueKind.RECORD_REF, value, 0L, 0.0);
        return new FieldValue(ValueKind.OBJECT, value, 0L, 0.0);
    }

    public static FieldValue ofLong(long value) {
        return ofLong(value, value);
    }

    public static FieldValue ofDouble(double value) {
        return ofDouble(value, value);
    }

    private static FieldValue ofLong(long value, Object raw) {
        return new FieldValue(ValueKind.INTEGER, raw, value, value);
    }

    private static FieldValue ofDouble(double value, Object raw) {
        return new FieldValue(ValueKind.FLOAT, raw, (long) value, value);
    }

    public ValueKind kind() {
        return kind;
    }

    public boolean isNull() {
        return kind == ValueKind.NULL;
    }

    /** The original Java object, or null. */
    public Object raw() {
        return raw;
    }

    public long longValue() {
        return longValue;
    }

    public double doubleValue() {
        return doubleValue;
    }

    public boolean booleanValue() {
        return longValue != 0L;
    }

    /** Ordinal for ENUM values. */
    public int ordinal() {
        return (int) longValue;
    }

    /**
     * Textual form used by text operators and by the cross-kind fallback
     * comparison. Null for {@link #NULL}.
     */
    public String text() {
        switch (kind) {
            case NULL:
                return null;
            case FLOAT:
                if (raw instanceof Float f)
                    return stripIntegralSuffix(Float.toString(f));
                return stripIntegralSuffix(Double.toString(doubleValue));
            case ENUM:
                return ((Enum<?>) raw).name();
            case BOOLEAN:
                return booleanValue() ? "True" : "False";
            default:
                return String.valueOf(raw);
        }
    }

    private static String stripIntegralSuffix(String s) {
        return s.endsWith(".0") ? s.substring(0, s.length() - 2) : s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FieldValue other))
            return false;
        if (kind != other.kind)
            return false;
        // Numbers compare by normalized payload, not by boxed type
        switch (kind) {
            case INTEGER:
                return longValue == other.longValue;
            case FLOAT:
                return Double.compare(doubleValue, other.doubleValue) == 0;
            default:
                return Objects.equals(raw, other.raw);
        }
    }

    @Override
    public int hashCode() {
        switch (kind) {
            case INTEGER:
                return Objects.hash(kind, longValue);
            case FLOAT:
                return Objects.hash(kind, doubleValue);
            default:
                return Objects.hash(kind, raw);
        }
    }

    @Override
    public String toString() {
        return kind + ":" + text();
    }
}
