package com.catalog.refgraph.source;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import com.catalog.refgraph.api.DataRecord;
import com.catalog.refgraph.api.RecordSource;
import com.catalog.refgraph.api.RecordSourceListener;

/**
 * Insertion-ordered, observable record source.
 *
 * <p>
 * Records are keyed by identity; adding a record with an identity that is
 * already present replaces the earlier one in place. Every mutation notifies
 * the registered listeners after the change is applied.
 */
public final class InMemoryRecordSource implements RecordSource {
    private final Map<String, DataRecord> records = new LinkedHashMap<>();
    private final List<RecordSourceListener> listeners = new CopyOnWriteArrayList<>();

    public InMemoryRecordSource() {
    }

    public InMemoryRecordSource(Collection<? extends DataRecord> initial) {
        for (DataRecord r : initial)
            put(r);
    }

    @Override
    public synchronized List<DataRecord> listAllRecords() {
        return List.copyOf(records.values());
    }

    @Override
    public synchronized DataRecord loadByIdentity(String identity) {
        return identity == null ? null : records.get(identity);
    }

    public void add(DataRecord record) {
        synchronized (this) {
            put(record);
        }
        fireChanged();
    }

    public void addAll(Collection<? extends DataRecord> batch) {
        synchronized (this) {
            for (DataRecord r : batch)
                put(r);
        }
        fireChanged();
    }

    /** @return true if a record with the identity was removed. */
    public boolean remove(String identity) {
        boolean removed;
        synchronized (this) {
            removed = records.remove(identity) != null;
        }
        if (removed)
            fireChanged();
        return removed;
    }

    public boolean remove(DataRecord record) {
        return record != null && remove(record.identity());
    }

    public void clear() {
        synchronized (this) {
            records.clear();
        }
        fireChanged();
    }

    public synchronized int size() {
        return records.size();
    }

    public void addListener(RecordSourceListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(RecordSourceListener listener) {
        listeners.remove(listener);
    }

    /** Signals an in-place edit of a record's fields or references. */
    public void fireChanged() {
        for (RecordSourceListener l : listeners)
            l.onRecordsChanged(this);
    }

    private void put(DataRecord record) {
        Objects.requireNonNull(record, "record");
        String identity = record.identity();
        if (identity == null || identity.isBlank())
            throw new IllegalArgumentException("Record has no identity: " + record);
        records.put(identity, record);
    }
}
