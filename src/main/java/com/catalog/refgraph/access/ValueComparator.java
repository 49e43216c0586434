package com.catalog.refgraph.access;

import com.catalog.refgraph.api.FieldValue;
import com.catalog.refgraph.api.ValueKind;

/**
 * Ordering and text matching across heterogeneous field values.
 *
 * <h3>Ordering rules</h3>
 * <ol>
 * <li>Two nulls are equal; null sorts before any non-null value.</li>
 * <li>Same kind: native ordering (numeric, ordinal, lexicographic).</li>
 * <li>Different kinds: the right operand is coerced into the left operand's
 * kind ({@code "50"} becomes {@code 50} when compared against an integer
 * field).</li>
 * <li>Anything else: case-insensitive comparison of both textual forms.</li>
 * </ol>
 *
 * <p>
 * The text fallback is intentionally permissive so that typed-in query values
 * work against any field. It is not a numeric comparison: a string field
 * holding {@code "10"} sorts before the value {@code 9}.
 */
public final class ValueComparator {

    private ValueComparator() {
    }

    /** Returns -1, 0 or 1. Null arguments are treated as {@link FieldValue#NULL}. */
    public static int compare(FieldValue a, FieldValue b) {
        if (a == null)
            a = FieldValue.NULL;
        if (b == null)
            b = FieldValue.NULL;
        if (a.isNull() && b.isNull())
            return 0;
        if (a.isNull())
            return -1;
        if (b.isNull())
            return 1;

        FieldValue right = a.kind() == b.kind() ? b : coerce(b, a);
        if (right != null) {
            Integer result = compareSameKind(a, right);
            if (result != null)
                return result;
        }
        return compareText(a, b);
    }

    /** Convenience for raw Java values. */
    public static int compare(Object a, Object b) {
        return compare(FieldValue.of(a), FieldValue.of(b));
    }

    /**
     * Case-insensitive substring, prefix or suffix test against the value's
     * textual form. A null value or null needle never matches, including for
     * {@link TextMatch#NOT_CONTAINS}.
     */
    public static boolean matchesText(FieldValue value, String needle, TextMatch mode) {
        if (value == null || value.isNull() || needle == null)
            return false;
        String text = value.text();
        if (text == null)
            return false;
        switch (mode) {
            case CONTAINS:
                return indexOfIgnoreCase(text, needle) >= 0;
            case NOT_CONTAINS:
                return indexOfIgnoreCase(text, needle) < 0;
            case STARTS_WITH:
                return text.regionMatches(true, 0, needle, 0, needle.length());
            case ENDS_WITH:
                return text.regionMatches(true, text.length() - needle.length(), needle, 0, needle.length());
            default:
                return false;
        }
    }

    static int indexOfIgnoreCase(String text, String needle) {
        int max = text.length() - needle.length();
        for (int i = 0; i <= max; i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length()))
                return i;
        }
        return -1;
    }

    private static int compareText(FieldValue a, FieldValue b) {
        return Integer.signum(a.text().compareToIgnoreCase(b.text()));
    }

    /** Native ordering for two values of the same kind, or null if the kind has none. */
    private static Integer compareSameKind(FieldValue a, FieldValue b) {
        switch (a.kind()) {
            case NULL:
                return 0;
            case INTEGER:
                return Long.compare(a.longValue(), b.longValue());
            case FLOAT:
                return Integer.signum(Double.compare(a.doubleValue(), b.doubleValue()));
            case BOOLEAN:
                return Boolean.compare(a.booleanValue(), b.booleanValue());
            case STRING:
                return Integer.signum(a.text().compareTo(b.text()));
            case ENUM:
                if (((Enum<?>) a.raw()).getDeclaringClass() != ((Enum<?>) b.raw()).getDeclaringClass())
                    return null;
                return Integer.compare(a.ordinal(), b.ordinal());
            case VECTOR2:
            case VECTOR3:
            case COLOR:
            case RECORD_REF:
                return a.raw().equals(b.raw()) ? 0 : null;
            case OBJECT:
                return compareObjects(a.raw(), b.raw());
            default:
                return null;
        }
    }

    @SuppressWarnings("unchecked")
    private static Integer compareObjects(Object a, Object b) {
        if (a.equals(b))
            return 0;
        if (a instanceof Comparable<?> && a.getClass() == b.getClass()) {
            try {
                return Integer.signum(((Comparable<Object>) a).compareTo(b));
            } catch (RuntimeException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Coerces {@code value} into the kind of {@code like}.
     *
     * @return The coerced value, or null if no conversion exists.
     */
    static FieldValue coerce(FieldValue value, FieldValue like) {
        ValueKind target = like.kind();
        ValueKind source = value.kind();
        switch (target) {
            case INTEGER:
                if (source == ValueKind.FLOAT)
                    return Double.isFinite(value.doubleValue())
                            ? FieldValue.ofLong((long) Math.rint(value.doubleValue()))
                            : null;
                if (source == ValueKind.BOOLEAN || source == ValueKind.ENUM)
                    return FieldValue.ofLong(value.longValue());
                if (source == ValueKind.STRING)
                    return parseLong(value.text());
                return null;
            case FLOAT:
                if (source == ValueKind.INTEGER || source == ValueKind.BOOLEAN || source == ValueKind.ENUM)
                    return FieldValue.ofDouble(value.doubleValue());
                if (source == ValueKind.STRING)
                    return parseDouble(value.text());
                return null;
            case BOOLEAN:
                if (source == ValueKind.INTEGER || source == ValueKind.FLOAT)
                    return FieldValue.of(value.doubleValue() != 0.0);
                if (source == ValueKind.STRING) {
                    String s = value.text().trim();
                    if (s.equalsIgnoreCase("true"))
                        return FieldValue.of(Boolean.TRUE);
                    if (s.equalsIgnoreCase("false"))
                        return FieldValue.of(Boolean.FALSE);
                }
                return null;
            case STRING:
                return FieldValue.of(value.text());
            case ENUM:
                return coerceEnum(value, (Enum<?>) like.raw());
            default:
                return null;
        }
    }

    private static FieldValue coerceEnum(FieldValue value, Enum<?> like) {
        Enum<?>[] constants = like.getDeclaringClass().getEnumConstants();
        if (value.kind() == ValueKind.INTEGER) {
            long ordinal = value.longValue();
            return ordinal >= 0 && ordinal < constants.length ? FieldValue.of(constants[(int) ordinal]) : null;
        }
        if (value.kind() == ValueKind.STRING) {
            String s = value.text().trim();
            for (Enum<?> constant : constants) {
                if (constant.name().equalsIgnoreCase(s))
                    return FieldValue.of(constant);
            }
        }
        return null;
    }

    private static FieldValue parseLong(String s) {
        try {
            return FieldValue.ofLong(Long.parseLong(s.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static FieldValue parseDouble(String s) {
        try {
            return FieldValue.ofDouble(Double.parseDouble(s.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
