package com.catalog.refgraph.util;

import java.util.List;

import com.catalog.refgraph.graph.DependencyGraph;
import com.catalog.refgraph.graph.GraphNode;
import com.catalog.refgraph.graph.GraphStats;

/**
 * Diagnostic utility for inspecting a dependency graph.
 *
 * <p>
 * Produces human-readable text for a single node, the whole graph, or a
 * Mermaid diagram. Intended for debugging sessions and error logs; it
 * allocates freely and walks every edge.
 */
public final class GraphExplain {
    private final DependencyGraph graph;

    public GraphExplain(DependencyGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps one node with its neighbors.
     *
     * @return The description, or a "not found" line for an unknown identity.
     */
    public String explainNode(String identity) {
        GraphNode node = graph.node(identity);
        if (node == null)
            return "Node not found: " + identity + '\n';
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.displayName()).append('\n')
                .append("  Identity: ").append(node.identity()).append('\n')
                .append("  Index: ").append(node.index()).append('\n')
                .append("  Type: ").append(node.record().getClass().getSimpleName()).append('\n')
                .append("  Orphan: ").append(node.isOrphan()).append('\n');
        appendNames(sb.append("  Dependencies (").append(node.dependencyCount()).append("): "), node.dependencies());
        appendNames(sb.append("  Dependents (").append(node.referenceCount()).append("): "), node.dependents());
        return sb.toString();
    }

    /** One-line summary of node, edge and orphan counts. */
    public String summary() {
        GraphStats s = graph.stats();
        return String.format("Generation: %d, Nodes: %d, Edges: %d, Orphans: %d (%.1f%%), Avg dependencies: %.2f",
                graph.generation(), s.nodeCount(), s.edgeCount(), s.orphanCount(), s.orphanPercentage(),
                s.averageDependencies());
    }

    /**
     * Dumps the whole graph, one node per line with its outgoing edges.
     */
    public String dumpGraph() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.nodeCount()).append(" nodes, ").append(graph.edgeCount())
                .append(" edges):\n");
        for (GraphNode node : graph.nodes()) {
            sb.append("  [").append(node.index()).append("] ").append(node.displayName());
            if (node.isOrphan())
                sb.append(" (ORPHAN)");
            List<GraphNode> deps = node.dependencies();
            if (!deps.isEmpty()) {
                sb.append(" -> ");
                for (int j = 0; j < deps.size(); j++) {
                    sb.append(deps.get(j).displayName());
                    if (j < deps.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart. Nodes are declared first in insertion
     * order, then every edge from dependent to dependency.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");
        for (GraphNode node : graph.nodes()) {
            sb.append("  ").append(sanitize(node.identity())).append("[\"")
                    .append(escape(node.displayName())).append("\"]");
            if (node.isOrphan())
                sb.append(":::orphan");
            sb.append(";\n");
        }
        for (GraphNode node : graph.nodes()) {
            String from = sanitize(node.identity());
            for (GraphNode dep : node.dependencies())
                sb.append("  ").append(from).append(" --> ").append(sanitize(dep.identity())).append(";\n");
        }
        return sb.toString();
    }

    private static void appendNames(StringBuilder sb, List<GraphNode> nodes) {
        for (int i = 0; i < nodes.size(); i++) {
            sb.append(nodes.get(i).displayName());
            if (i < nodes.size() - 1)
                sb.append(", ");
        }
        sb.append('\n');
    }

    static String sanitize(String id) {
        return "n_" + id.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
