package com.catalog.refgraph.api;

import java.util.Collection;

/**
 * External collaborator that owns the records being catalogued.
 */
public interface RecordSource {

    /** Returns every record currently known, in a stable order. */
    Collection<? extends DataRecord> listAllRecords();

    /**
     * Loads a record by identity.
     *
     * @return The record, or null if no record carries the identity.
     */
    DataRecord loadByIdentity(String identity);
}
