package com.catalog.refgraph.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.catalog.refgraph.api.DataRecord;
import com.catalog.refgraph.graph.DependencyGraph;
import com.catalog.refgraph.graph.GraphCache;
import com.catalog.refgraph.graph.GraphNode;
import com.catalog.refgraph.graph.GraphStats;
import com.catalog.refgraph.graph.PathFinder;

/**
 * Reference-graph queries over the cached dependency graph.
 *
 * <p>
 * Every call reads through {@link GraphCache#getCachedGraph()}, so results
 * reflect the record source as of the last build. Absent records never cause
 * errors: they yield empty lists or all-zero statistics.
 */
public final class DependencyAnalyzer {
    private final GraphCache cache;
    private final Set<String> orphanExemptTypeSuffixes;

    public DependencyAnalyzer(GraphCache cache) {
        this(cache, Set.of());
    }

    /**
     * @param orphanExemptTypeSuffixes Simple type-name suffixes (for example
     *                                 {@code Database}) of top-level container
     *                                 types that are expected to be
     *                                 unreferenced.
     */
    public DependencyAnalyzer(GraphCache cache, Set<String> orphanExemptTypeSuffixes) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.orphanExemptTypeSuffixes = Set.copyOf(orphanExemptTypeSuffixes);
    }

    public DependencyGraph graph() {
        return cache.getCachedGraph();
    }

    /**
     * Records nobody references, excluding records whose exact runtime type is
     * in {@code excludedTypes}.
     */
    public List<DataRecord> findOrphans(Set<Class<?>> excludedTypes) {
        List<DataRecord> orphans = new ArrayList<>();
        for (GraphNode node : graph().orphanNodes()) {
            DataRecord record = node.record();
            if (record == null)
                continue;
            if (excludedTypes == null || !excludedTypes.contains(record.getClass()))
                orphans.add(record);
        }
        return orphans;
    }

    public List<DataRecord> findOrphans() {
        return findOrphans(Set.of());
    }

    /** Orphans whose type name does not end with one of the exempt suffixes. */
    public List<DataRecord> findOrphansExcludingExempt() {
        List<DataRecord> orphans = new ArrayList<>();
        for (DataRecord record : findOrphans()) {
            if (!isExemptType(record.getClass()))
                orphans.add(record);
        }
        return orphans;
    }

    public boolean isExemptType(Class<?> type) {
        String name = type.getSimpleName();
        for (String suffix : orphanExemptTypeSuffixes)
            if (name.endsWith(suffix))
                return true;
        return false;
    }

    public List<GraphNode> findMostReferenced(int topN) {
        return graph().mostReferenced(topN);
    }

    public List<GraphNode> findMostDependencies(int topN) {
        return graph().mostDependencies(topN);
    }

    /** Records that point at {@code record}. */
    public List<DataRecord> referencersOf(DataRecord record) {
        return records(graph().dependentsOf(record));
    }

    /** Records {@code record} points at. */
    public List<DataRecord> dependenciesOf(DataRecord record) {
        return records(graph().dependenciesOf(record));
    }

    /**
     * Shortest chain of references from {@code from} to {@code to}.
     *
     * @return The records along the path, or an empty list if there is none.
     */
    public List<DataRecord> shortestPath(DataRecord from, DataRecord to) {
        return records(PathFinder.shortestPath(graph(), from, to));
    }

    /** Statistics for one record; all-zero and orphan when it is not in the graph. */
    public DependencyStats statsFor(DataRecord record) {
        GraphNode node = graph().getNode(record);
        if (node == null)
            return DependencyStats.absent(record);
        return new DependencyStats(record, node.referenceCount(), node.dependencyCount(), node.isOrphan());
    }

    public GraphStats graphStats() {
        return graph().stats();
    }

    private static List<DataRecord> records(List<GraphNode> nodes) {
        List<DataRecord> result = new ArrayList<>(nodes.size());
        for (GraphNode n : nodes)
            if (n.record() != null)
                result.add(n.record());
        return result;
    }
}
