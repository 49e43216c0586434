package com.catalog.refgraph.analysis;

import com.catalog.refgraph.api.DataRecord;

/**
 * Per-record reference statistics.
 *
 * @param record          The record the statistics describe (may be null).
 * @param referenceCount  Number of records pointing at it.
 * @param dependencyCount Number of records it points at.
 * @param orphan          True when nothing points at it.
 */
public record DependencyStats(DataRecord record, int referenceCount, int dependencyCount, boolean orphan) {

    /** Statistics for a record that has no node in the graph. */
    public static DependencyStats absent(DataRecord record) {
        return new DependencyStats(record, 0, 0, true);
    }

    public String name() {
        return record != null && record.name() != null ? record.name() : "Null";
    }

    public String typeName() {
        return record != null ? record.getClass().getSimpleName() : "Unknown";
    }

    public String identity() {
        return record != null && record.identity() != null ? record.identity() : "";
    }
}
