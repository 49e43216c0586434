package com.catalog.refgraph.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.catalog.refgraph.api.BuildListener;
import com.catalog.refgraph.api.DataRecord;
import com.catalog.refgraph.api.ReferenceExtractor;

import lombok.extern.log4j.Log4j2;

/**
 * Builds a {@link DependencyGraph} from a full record set.
 *
 * <p>
 * A build is always total: every record gets a node first, then the reference
 * extractor is asked for each record's direct references and one edge is added
 * per referenced record. Self-references are dropped. Referenced records that
 * are not part of the input set still get a node.
 *
 * <p>
 * Failures are isolated per record. Any exception thrown while a record's
 * references are extracted and resolved leaves that record without outgoing
 * edges, and the listener is told. A record whose identity cannot be read gets
 * no node either. A single build-level warning summarizes the failures.
 *
 * <p>
 * Builds run synchronously on the calling thread and the returned graph is
 * sealed.
 */
@Log4j2
public final class GraphBuilder {
    private long generation;
    private BuildListener listener;

    public void setListener(BuildListener listener) {
        this.listener = listener;
    }

    /** Generation number of the most recent build (0 before the first build). */
    public synchronized long lastGeneration() {
        return generation;
    }

    /**
     * Builds a new graph generation.
     *
     * @throws NullPointerException if {@code records} or {@code extractor} is
     *                              null.
     */
    public DependencyGraph build(Collection<? extends DataRecord> records, ReferenceExtractor extractor) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(extractor, "extractor");

        final long gen;
        synchronized (this) {
            gen = ++generation;
        }
        final BuildListener l = this.listener;
        final long start = System.nanoTime();
        if (l != null)
            l.onBuildStart(gen, records.size());

        DependencyGraph graph = new DependencyGraph(gen);
        Set<DataRecord> broken = Collections.newSetFromMap(new IdentityHashMap<>());
        int skipped = 0;
        int failures = 0;

        // 1. One node per addressable record
        for (DataRecord record : records) {
            if (record == null)
                continue;
            try {
                if (!hasIdentity(record)) {
                    skipped++;
                    continue;
                }
                graph.addNode(record);
            } catch (RuntimeException e) {
                broken.add(record);
                failures++;
                reportFailure(l, gen, record, e);
            }
        }

        // 2. Edges from each record to its direct references
        for (DataRecord record : records) {
            if (record == null || broken.contains(record))
                continue;
            try {
                if (!hasIdentity(record))
                    continue;
                GraphNode from = graph.getNode(record);
                List<GraphNode> targets = resolveReferences(graph, record, extractor.referencesOf(record));
                for (GraphNode to : targets)
                    graph.addEdge(from, to);
            } catch (RuntimeException e) {
                failures++;
                reportFailure(l, gen, record, e);
            }
        }

        graph.seal();
        long elapsed = System.nanoTime() - start;

        if (skipped > 0)
            log.warn("Skipped {} record(s) without identity while building generation {}", skipped, gen);
        if (failures > 0)
            log.warn("{} record(s) failed while building generation {}; they contribute no edges", failures, gen);
        log.info("Built dependency graph generation {}: {} nodes, {} edges in {} ms", gen, graph.nodeCount(),
                graph.edgeCount(), elapsed / 1_000_000);

        if (l != null)
            l.onBuildEnd(gen, graph.nodeCount(), graph.edgeCount(), failures, elapsed);
        return graph;
    }

    /**
     * Resolves every usable reference to a node before any edge is added, so a
     * failure part way through leaves the record without outgoing edges.
     */
    private static List<GraphNode> resolveReferences(DependencyGraph graph, DataRecord record,
            Set<DataRecord> references) {
        if (references == null)
            return List.of();
        String self = record.identity();
        List<GraphNode> targets = new ArrayList<>(references.size());
        for (DataRecord dependency : references) {
            if (dependency == null || !hasIdentity(dependency))
                continue;
            if (dependency.identity().equals(self))
                continue;
            targets.add(graph.addNode(dependency));
        }
        return targets;
    }

    private static void reportFailure(BuildListener l, long gen, DataRecord record, RuntimeException e) {
        log.debug("Skipping edges of {}: {}", describe(record), e.toString());
        if (l != null)
            l.onExtractionError(gen, record, e);
    }

    /** Label for log output that never calls back into the record. */
    private static String describe(DataRecord record) {
        return record.getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(record));
    }

    private static boolean hasIdentity(DataRecord record) {
        String identity = record.identity();
        return identity != null && !identity.isBlank();
    }
}
