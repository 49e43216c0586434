package com.catalog.refgraph.graph;

/**
 * Whole-graph statistics snapshot.
 *
 * @param nodeCount           Number of nodes.
 * @param edgeCount           Number of dependency edges.
 * @param orphanCount         Nodes with no dependents.
 * @param averageDependencies Mean out-degree (0 for an empty graph).
 */
public record GraphStats(int nodeCount, int edgeCount, int orphanCount, double averageDependencies) {

    /** Orphans as a percentage of all nodes (0 for an empty graph). */
    public double orphanPercentage() {
        return nodeCount > 0 ? orphanCount * 100.0 / nodeCount : 0.0;
    }
}
