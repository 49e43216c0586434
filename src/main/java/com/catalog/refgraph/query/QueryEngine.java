package com.catalog.refgraph.query;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.catalog.refgraph.access.FieldAccessor;
import com.catalog.refgraph.access.FieldDescriptor;
import com.catalog.refgraph.api.DataRecord;
import com.catalog.refgraph.api.FieldValue;
import com.catalog.refgraph.catalog.RecordCatalog;

import lombok.extern.log4j.Log4j2;

/**
 * Ad-hoc predicate search over record fields.
 *
 * <p>
 * Queries are stable filters: matching records are returned in input order.
 * Cost is O(records x enabled conditions). Null entries in the input are
 * skipped.
 */
@Log4j2
public final class QueryEngine {
    private final FieldAccessor accessor;

    public QueryEngine() {
        this(FieldAccessor.shared());
    }

    public QueryEngine(FieldAccessor accessor) {
        this.accessor = Objects.requireNonNull(accessor, "accessor");
    }

    public FieldAccessor accessor() {
        return accessor;
    }

    /**
     * Filters {@code records} by {@code group}. A null or empty group matches
     * everything.
     */
    public <T extends DataRecord> List<T> query(ConditionGroup group, Iterable<T> records) {
        Objects.requireNonNull(records, "records");
        List<T> results = new ArrayList<>();
        for (T record : records) {
            if (record == null)
                continue;
            if (group == null || group.evaluate(record, accessor))
                results.add(record);
        }
        log.debug("Query [{}] matched {} record(s)", group, results.size());
        return results;
    }

    /** Single-condition shortcut. */
    public <T extends DataRecord> List<T> queryByField(String fieldName, QueryOperator operator, Object value,
            Iterable<T> records) {
        return query(ConditionGroup.and(Condition.of(fieldName, operator, value)), records);
    }

    /**
     * Substring search on {@link DataRecord#name()}. A null term matches nothing,
     * an empty term matches everything.
     */
    public <T extends DataRecord> List<T> searchByName(String term, boolean caseSensitive, Iterable<T> records) {
        Objects.requireNonNull(records, "records");
        List<T> results = new ArrayList<>();
        if (term == null)
            return results;
        String needle = caseSensitive ? term : term.toLowerCase();
        for (T record : records) {
            if (record == null || record.name() == null)
                continue;
            String name = caseSensitive ? record.name() : record.name().toLowerCase();
            if (name.contains(needle))
                results.add(record);
        }
        return results;
    }

    /**
     * Reads a field for display.
     *
     * @return The value, or null if the record has no such field.
     */
    public FieldValue fieldValue(DataRecord record, String fieldPath) {
        return accessor.read(record, fieldPath);
    }

    /** Queryable fields of a record type, keyed by name. */
    public Map<String, FieldDescriptor> queryableFields(Class<?> type) {
        return accessor.queryableFields(type);
    }

    /**
     * Queryable fields of every type in a scanned catalog, types ordered by
     * fully qualified name.
     */
    public Map<Class<?>, Map<String, FieldDescriptor>> queryableFields(RecordCatalog catalog) {
        Objects.requireNonNull(catalog, "catalog");
        List<Class<?>> types = new ArrayList<>(catalog.allTypes());
        types.sort(Comparator.comparing(Class::getName));
        Map<Class<?>, Map<String, FieldDescriptor>> result = new LinkedHashMap<>();
        for (Class<?> type : types)
            result.put(type, accessor.queryableFields(type));
        return result;
    }
}
