package com.catalog.refgraph.access;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.util.Collections;
import java.util.EventListener;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

import com.catalog.refgraph.api.FieldValue;
import com.catalog.refgraph.api.ValueKind;

import lombok.extern.log4j.Log4j2;

/**
 * Reflective field resolution over arbitrary record types.
 *
 * <p>
 * A field name is resolved by walking the record class and then its superclass
 * chain up to {@link Object}; the first match at the most-derived level wins.
 * Descriptors (and misses) are cached per (type, name) for the lifetime of the
 * accessor. Call {@link #clearCache()} after a schema change, since class
 * reloading is not detected.
 *
 * <p>
 * Skipped fields: static, synthetic, names in the reserved list (host
 * bookkeeping), and fields typed as callbacks (functional interfaces,
 * {@link Runnable}, {@link Callable}, {@link EventListener}), which carry no
 * comparable value.
 *
 * <p>
 * Reads never throw. A value that cannot be read degrades to
 * {@link FieldValue#NULL}, so one bad field never aborts a batch evaluation.
 */
@Log4j2
public final class FieldAccessor {
    /** Bookkeeping names of the record base class and common tooling. */
    public static final Set<String> DEFAULT_RESERVED_NAMES = Set.of("identity", "serialVersionUID", "$jacocoData");

    private static final FieldAccessor SHARED = new FieldAccessor();

    private final Set<String> reservedNames;
    private final Map<Key, Optional<FieldDescriptor>> descriptors = new ConcurrentHashMap<>();
    private final Map<Class<?>, Map<String, FieldDescriptor>> typeFields = new ConcurrentHashMap<>();

    private record Key(Class<?> type, String name) {
    }

    public FieldAccessor() {
        this(DEFAULT_RESERVED_NAMES);
    }

    public FieldAccessor(Set<String> reservedNames) {
        this.reservedNames = Set.copyOf(reservedNames);
    }

    /** Process-wide accessor used when callers do not supply their own. */
    public static FieldAccessor shared() {
        return SHARED;
    }

    /**
     * Resolves a simple field name on a type.
     *
     * @return The descriptor, or null if the type (or any supertype) has no
     *         queryable field with that name.
     */
    public FieldDescriptor resolve(Class<?> type, String fieldName) {
        if (type == null || fieldName == null || fieldName.isEmpty())
            return null;
        return descriptors.computeIfAbsent(new Key(type, fieldName), k -> Optional.ofNullable(lookup(k.type, k.name)))
                .orElse(null);
    }

    /**
     * Reads a field value from a record instance.
     *
     * @return The value, or {@link FieldValue#NULL} if the field is null or could
     *         not be read.
     */
    public FieldValue getValue(Object target, FieldDescriptor descriptor) {
        return FieldValue.of(rawValue(target, descriptor));
    }

    /**
     * Reads a simple or dotted field path ({@code stats.hp}).
     *
     * <p>
     * Each segment is resolved on the runtime class of the previous value, or on
     * its declared type when that value is null. A null intermediate therefore
     * yields {@link FieldValue#NULL} as long as the remaining path exists.
     *
     * @return The value, or null if the path cannot be resolved.
     */
    public FieldValue read(Object target, String fieldPath) {
        if (target == null || fieldPath == null || fieldPath.isBlank())
            return null;

        Object current = target;
        Class<?> currentType = target.getClass();
        FieldValue value = null;
        for (String segment : fieldPath.split("\\.", -1)) {
            FieldDescriptor descriptor = resolve(currentType, segment);
            if (descriptor == null) {
                log.debug("Field '{}' not found on {}", segment, currentType.getName());
                return null;
            }
            Object raw = current == null ? null : rawValue(current, descriptor);
            value = FieldValue.of(raw);
            current = raw;
            currentType = raw != null ? raw.getClass() : descriptor.declaredType();
        }
        return value;
    }

    /**
     * Lists every queryable field of a type and its supertypes, most-derived
     * first. Shadowed supertype fields are omitted.
     */
    public Map<String, FieldDescriptor> queryableFields(Class<?> type) {
        if (type == null)
            return Map.of();
        return typeFields.computeIfAbsent(type, t -> {
            Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
            for (Class<?> c = t; c != null && c != Object.class; c = c.getSuperclass()) {
                for (Field f : c.getDeclaredFields()) {
                    if (isQueryable(f) && !fields.containsKey(f.getName()))
                        fields.put(f.getName(), describe(f, c));
                }
            }
            return Collections.unmodifiableMap(fields);
        });
    }

    /** Drops every cached descriptor. */
    public void clearCache() {
        descriptors.clear();
        typeFields.clear();
    }

    /** Number of cached (type, name) resolutions, including misses. */
    public int cachedResolutions() {
        return descriptors.size();
    }

    private FieldDescriptor lookup(Class<?> type, String fieldName) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            Field f;
            try {
                f = c.getDeclaredField(fieldName);
            } catch (NoSuchFieldException e) {
                continue;
            } catch (SecurityException e) {
                log.debug("Cannot inspect {} on {}: {}", fieldName, c.getName(), e.getMessage());
                return null;
            }
            if (isQueryable(f))
                return describe(f, c);
        }
        return null;
    }

    private Object rawValue(Object target, FieldDescriptor descriptor) {
        if (target == null || descriptor == null)
            return null;
        try {
            return descriptor.field().get(target);
        } catch (IllegalAccessException | RuntimeException e) {
            log.debug("Failed to read {} from {}: {}", descriptor, target.getClass().getName(), e.toString());
            return null;
        }
    }

    private boolean isQueryable(Field f) {
        int mod = f.getModifiers();
        if (Modifier.isStatic(mod) || f.isSynthetic())
            return false;
        if (reservedNames.contains(f.getName()))
            return false;
        return !isCallbackType(f.getType());
    }

    private static boolean isCallbackType(Class<?> type) {
        if (Runnable.class.isAssignableFrom(type) || Callable.class.isAssignableFrom(type)
                || EventListener.class.isAssignableFrom(type))
            return true;
        if (!type.isInterface())
            return false;
        return type.isAnnotationPresent(FunctionalInterface.class)
                || type.getPackageName().equals("java.util.function");
    }

    private static FieldDescriptor describe(Field f, Class<?> owner) {
        if (!f.trySetAccessible())
            log.debug("Field {}.{} is not accessible; reads will yield null", owner.getName(), f.getName());
        return new FieldDescriptor(f.getName(), ValueKind.ofType(f.getType()), owner, f.getType(),
                typeDisplayName(f), f);
    }

    static String typeDisplayName(Field f) {
        Class<?> t = f.getType();
        if (t == int.class || t == Integer.class)
            return "int";
        if (t == long.class || t == Long.class)
            return "long";
        if (t == float.class || t == Float.class)
            return "float";
        if (t == double.class || t == Double.class)
            return "double";
        if (t == boolean.class || t == Boolean.class)
            return "bool";
        if (t == String.class)
            return "string";
        if (List.class.isAssignableFrom(t) && f.getGenericType() instanceof ParameterizedType p
                && p.getActualTypeArguments()[0] instanceof Class<?> item)
            return "List<" + item.getSimpleName() + ">";
        if (t.isArray())
            return t.getComponentType().getSimpleName() + "[]";
        return t.getSimpleName();
    }
}
