package com.catalog.refgraph.source;

import java.lang.reflect.Array;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.catalog.refgraph.access.FieldAccessor;
import com.catalog.refgraph.access.FieldDescriptor;
import com.catalog.refgraph.api.DataRecord;
import com.catalog.refgraph.api.ReferenceExtractor;

/**
 * Finds the records a record points to by reading its fields.
 *
 * <p>
 * References are collected from fields holding a {@link DataRecord}, and from
 * arrays, collections, maps (keys and values) and nested plain objects held by
 * the record. Referenced records are not descended into, so the result is the
 * direct (non-transitive) reference set. Results keep field declaration order.
 */
public final class ReflectiveReferenceExtractor implements ReferenceExtractor {
    private static final int MAX_NESTING = 8;

    private final FieldAccessor accessor;

    public ReflectiveReferenceExtractor() {
        this(FieldAccessor.shared());
    }

    public ReflectiveReferenceExtractor(FieldAccessor accessor) {
        this.accessor = Objects.requireNonNull(accessor, "accessor");
    }

    @Override
    public Set<DataRecord> referencesOf(DataRecord record) {
        Set<DataRecord> out = new LinkedHashSet<>();
        if (record == null)
            return out;
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.add(record);
        collectFields(record, out, seen, 0);
        return out;
    }

    private void collectFields(Object owner, Set<DataRecord> out, Set<Object> seen, int depth) {
        for (FieldDescriptor d : accessor.queryableFields(owner.getClass()).values())
            collect(accessor.getValue(owner, d).raw(), out, seen, depth);
    }

    private void collect(Object value, Set<DataRecord> out, Set<Object> seen, int depth) {
        if (value == null || depth > MAX_NESTING)
            return;
        if (value instanceof DataRecord r) {
            out.add(r);
            return;
        }
        if (!seen.add(value))
            return;
        if (value instanceof Iterable<?> items) {
            for (Object item : items)
                collect(item, out, seen, depth + 1);
        } else if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                collect(e.getKey(), out, seen, depth + 1);
                collect(e.getValue(), out, seen, depth + 1);
            }
        } else if (value.getClass().isArray()) {
            if (value.getClass().getComponentType().isPrimitive())
                return;
            for (int i = 0, n = Array.getLength(value); i < n; i++)
                collect(Array.get(value, i), out, seen, depth + 1);
        } else if (isPlainObject(value)) {
            collectFields(value, out, seen, depth + 1);
        }
    }

    /** Nested value objects declared outside the JDK, not enums or records of the value model. */
    private static boolean isPlainObject(Object value) {
        Class<?> type = value.getClass();
        if (type.isEnum() || type.isPrimitive())
            return false;
        String pkg = type.getPackageName();
        return !pkg.startsWith("java.") && !pkg.startsWith("javax.") && !pkg.startsWith("jdk.")
                && !pkg.equals("com.catalog.refgraph.api");
    }
}
