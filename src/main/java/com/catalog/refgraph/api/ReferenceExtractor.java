package com.catalog.refgraph.api;

import java.util.Set;

/**
 * External collaborator that reports which records a record points to.
 *
 * <p>
 * Implementations return the direct (non-transitive) references only. They may
 * throw; the graph builder treats a failure as "no outgoing references" for
 * that record and continues with the rest of the build.
 */
@FunctionalInterface
public interface ReferenceExtractor {

    Set<DataRecord> referencesOf(DataRecord record);
}
