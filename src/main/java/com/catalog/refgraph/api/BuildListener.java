package com.catalog.refgraph.api;

/**
 * Observability hook for dependency graph builds.
 *
 * <p>
 * Callbacks run synchronously on the building thread and must stay cheap.
 */
public interface BuildListener {

    /**
     * Called before the first node is added.
     *
     * @param generation The generation number the new graph will carry.
     * @param recordCount Number of records handed to the builder.
     */
    void onBuildStart(long generation, int recordCount);

    /**
     * Called when a record failed during the build. The record contributes no
     * outgoing edges, and has no node if its identity could not be read.
     */
    void onExtractionError(long generation, DataRecord record, Throwable error);

    /**
     * Called once the graph is complete and sealed.
     *
     * @param nodeCount Nodes in the finished graph.
     * @param edgeCount Dependency edges in the finished graph.
     * @param failures Number of records whose extraction failed.
     * @param durationNanos Wall time of the build.
     */
    void onBuildEnd(long generation, int nodeCount, int edgeCount, int failures, long durationNanos);
}
