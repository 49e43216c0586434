package com.catalog.refgraph.api;

/**
 * An externally owned data record observed by the catalog.
 *
 * <p>
 * The catalog never creates, persists or mutates records. It only reads their
 * identity, runtime type ({@link Object#getClass()}) and named fields.
 *
 * <p>
 * Identity must be stable for the duration of one graph build or query
 * evaluation, and must be derivable without mutating the record.
 */
public interface DataRecord {

    /**
     * Returns the stable unique key of this record (typically a path).
     *
     * @return The identity key, or null/blank if the record is not addressable.
     */
    String identity();

    /**
     * Returns the human-readable name of this record.
     */
    String name();
}
