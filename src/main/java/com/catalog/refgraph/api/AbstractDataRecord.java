package com.catalog.refgraph.api;

import java.util.Objects;

/**
 * Convenience base class for catalogued records.
 *
 * <p>
 * The {@code identity} field is host bookkeeping and is excluded from field
 * queries by the default reserved-name list. The {@code name} field is
 * queryable like any field declared by a subclass.
 */
public abstract class AbstractDataRecord implements DataRecord {
    private final String identity;
    protected String name;

    protected AbstractDataRecord(String identity, String name) {
        this.identity = identity;
        this.name = name;
    }

    @Override
    public final String identity() {
        return identity;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return Objects.equals(identity, ((AbstractDataRecord) o).identity);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(identity);
    }

    @Override
    public String toString() {
        return name + " (" + getClass().getSimpleName() + ")";
    }
}
