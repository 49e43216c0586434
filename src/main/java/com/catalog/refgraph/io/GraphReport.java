package com.catalog.refgraph.io;

import java.util.ArrayList;
import java.util.List;

import com.catalog.refgraph.graph.DependencyGraph;
import com.catalog.refgraph.graph.GraphNode;
import com.catalog.refgraph.graph.GraphStats;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO summary of a dependency graph, serialized by {@link GraphReportWriter}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GraphReport {
    private long generation;
    private int nodeCount, edgeCount, orphanCount;
    private double averageDependencies, orphanPercentage;
    private List<NodeEntry> mostReferenced;
    private List<NodeEntry> mostDependencies;
    private List<NodeEntry> orphans;

    /** One node line of the report. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class NodeEntry {
        private String identity, name, type;
        private int referenceCount, dependencyCount;

        static NodeEntry of(GraphNode node) {
            NodeEntry e = new NodeEntry();
            e.setIdentity(node.identity());
            if (node.record() != null) {
                e.setName(node.record().name());
                e.setType(node.record().getClass().getSimpleName());
            }
            e.setReferenceCount(node.referenceCount());
            e.setDependencyCount(node.dependencyCount());
            return e;
        }
    }

    /**
     * Summarizes a graph.
     *
     * @param topN Length of the most-referenced and most-dependencies lists.
     */
    public static GraphReport of(DependencyGraph graph, int topN) {
        GraphStats stats = graph.stats();
        GraphReport report = new GraphReport();
        report.setGeneration(graph.generation());
        report.setNodeCount(stats.nodeCount());
        report.setEdgeCount(stats.edgeCount());
        report.setOrphanCount(stats.orphanCount());
        report.setAverageDependencies(stats.averageDependencies());
        report.setOrphanPercentage(stats.orphanPercentage());
        report.setMostReferenced(entries(graph.mostReferenced(topN)));
        report.setMostDependencies(entries(graph.mostDependencies(topN)));
        report.setOrphans(entries(graph.orphanNodes()));
        return report;
    }

    private static List<NodeEntry> entries(List<GraphNode> nodes) {
        List<NodeEntry> list = new ArrayList<>(nodes.size());
        for (GraphNode n : nodes)
            list.add(NodeEntry.of(n));
        return list;
    }
}
