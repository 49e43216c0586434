package com.catalog.refgraph.catalog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import com.catalog.refgraph.api.DataRecord;

/**
 * Immutable result of a catalog scan: records grouped by runtime type plus
 * the category tree built from them.
 */
public final class RecordCatalog {
    private final Map<Class<?>, List<DataRecord>> recordsByType;
    private final List<TypeNode> categoryTree;
    private final int totalRecordCount;
    private final Instant scanTimestamp;

    public RecordCatalog(Map<Class<?>, List<DataRecord>> recordsByType, List<TypeNode> categoryTree,
            Instant scanTimestamp) {
        Map<Class<?>, List<DataRecord>> copy = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<Class<?>, List<DataRecord>> e : recordsByType.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
            total += e.getValue().size();
        }
        this.recordsByType = Collections.unmodifiableMap(copy);
        this.categoryTree = List.copyOf(categoryTree);
        this.totalRecordCount = total;
        this.scanTimestamp = scanTimestamp;
    }

    public Map<Class<?>, List<DataRecord>> recordsByType() {
        return recordsByType;
    }

    public List<TypeNode> categoryTree() {
        return categoryTree;
    }

    public int totalRecordCount() {
        return totalRecordCount;
    }

    public int totalTypeCount() {
        return recordsByType.size();
    }

    public Instant scanTimestamp() {
        return scanTimestamp;
    }

    /** Records whose runtime type is exactly {@code type}; empty if none. */
    @SuppressWarnings("unchecked")
    public <T extends DataRecord> List<T> recordsOfType(Class<T> type) {
        return (List<T>) recordsByType.getOrDefault(type, List.of());
    }

    /** All records, grouped by type in scan order. */
    public List<DataRecord> allRecords() {
        List<DataRecord> all = new ArrayList<>(totalRecordCount);
        for (List<DataRecord> records : recordsByType.values())
            all.addAll(records);
        return all;
    }

    /** First record with exactly this name, or null. */
    public DataRecord findByName(String name) {
        for (List<DataRecord> records : recordsByType.values())
            for (DataRecord r : records)
                if (r.name() != null && r.name().equals(name))
                    return r;
        return null;
    }

    public List<DataRecord> find(Predicate<? super DataRecord> predicate) {
        List<DataRecord> result = new ArrayList<>();
        for (List<DataRecord> records : recordsByType.values())
            for (DataRecord r : records)
                if (predicate.test(r))
                    result.add(r);
        return result;
    }

    public Set<Class<?>> allTypes() {
        return recordsByType.keySet();
    }

    /** Types whose package name contains {@code pattern}, ignoring case. */
    public List<Class<?>> typesInPackage(String pattern) {
        String needle = pattern.toLowerCase(Locale.ROOT);
        List<Class<?>> result = new ArrayList<>();
        for (Class<?> type : recordsByType.keySet())
            if (type.getPackageName().toLowerCase(Locale.ROOT).contains(needle))
                result.add(type);
        return result;
    }

    /** Names of the top-level category folders. */
    public List<String> categories() {
        List<String> names = new ArrayList<>(categoryTree.size());
        for (TypeNode node : categoryTree)
            names.add(node.displayName());
        return names;
    }
}
