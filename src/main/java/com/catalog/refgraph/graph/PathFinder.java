package com.catalog.refgraph.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.catalog.refgraph.api.DataRecord;

/**
 * Breadth-first shortest path along dependency edges.
 *
 * <p>
 * The frontier is expanded in edge insertion order and each node is visited at
 * most once, so the result is the first-discovered path with the minimum
 * number of edges and cycles cannot cause non-termination.
 */
public final class PathFinder {

    private PathFinder() {
    }

    /**
     * Finds the shortest dependency path from {@code from} to {@code to}.
     *
     * @return The nodes along the path, starting with {@code from} and ending
     *         with {@code to}; {@code [from]} when both are the same record; an
     *         empty list when either endpoint is absent or {@code to} is
     *         unreachable.
     */
    public static List<GraphNode> shortestPath(DependencyGraph graph, DataRecord from, DataRecord to) {
        GraphNode start = graph.getNode(from);
        GraphNode target = graph.getNode(to);
        if (start == null || target == null)
            return List.of();
        if (start.index() == target.index())
            return List.of(start);

        int n = graph.nodeCount();
        int[] parent = new int[n];
        Arrays.fill(parent, -1);
        boolean[] visited = new boolean[n];
        int[] queue = new int[n];
        int head = 0, tail = 0;

        queue[tail++] = start.index();
        visited[start.index()] = true;

        while (head < tail) {
            int current = queue[head++];
            if (current == target.index())
                return reconstruct(graph, parent, start.index(), current);
            for (int next : graph.dependencyIndices(current)) {
                if (!visited[next]) {
                    visited[next] = true;
                    parent[next] = current;
                    queue[tail++] = next;
                }
            }
        }
        return List.of();
    }

    private static List<GraphNode> reconstruct(DependencyGraph graph, int[] parent, int start, int end) {
        List<GraphNode> path = new ArrayList<>();
        for (int i = end; i != -1; i = i == start ? -1 : parent[i])
            path.add(graph.node(i));
        Collections.reverse(path);
        return path;
    }
}
