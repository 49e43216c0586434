package com.catalog.refgraph.api;

/**
 * Explicit change notification from a {@link RecordSource}.
 *
 * <p>
 * Owners register listeners themselves; nothing subscribes implicitly.
 */
@FunctionalInterface
public interface RecordSourceListener {

    /** Called after the set of records (or their references) changed. */
    void onRecordsChanged(RecordSource source);
}
