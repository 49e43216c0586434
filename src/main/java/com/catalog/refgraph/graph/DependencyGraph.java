package com.catalog.refgraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.catalog.refgraph.api.DataRecord;

/**
 * Directed graph of record-to-record references.
 *
 * <h3>Layout</h3>
 * Nodes are stored in a dense arena ({@code nodes}) indexed by insertion order.
 * An identity map resolves a record key to its index in O(1). Edges are kept
 * as per-index adjacency lists of neighbor indices, in insertion order, in both
 * directions:
 * <ul>
 * <li><b>out:</b> dependencies, the records a node points to.</li>
 * <li><b>in:</b> dependents, the records that point to a node.</li>
 * </ul>
 * Every edge is inserted into both lists at once, so there is never a
 * one-directional edge. A set of packed (from, to) keys makes insertion
 * idempotent.
 *
 * <h3>Lifecycle</h3>
 * A graph is created empty, populated by one build pass, then {@link #seal()
 * sealed} and handed to readers. Mutating a sealed graph throws. Graphs are
 * never updated incrementally; a change in the record set means a new graph.
 *
 * <p>
 * Self-loops are accepted by {@link #addDependency} but callers are expected
 * to filter them; {@link GraphBuilder} does.
 */
public final class DependencyGraph {
    private static final Comparator<GraphNode> BY_IDENTITY = Comparator.comparing(GraphNode::identity);

    private final long generation;
    private final List<GraphNode> nodes = new ArrayList<>();
    private final Map<String, Integer> identityToIndex = new HashMap<>();
    private final List<List<Integer>> out = new ArrayList<>();
    private final List<List<Integer>> in = new ArrayList<>();
    private final Set<Long> edgeKeys = new HashSet<>();
    private boolean sealed;

    public DependencyGraph() {
        this(0L);
    }

    public DependencyGraph(long generation) {
        this.generation = generation;
    }

    public long generation() {
        return generation;
    }

    // ── Mutation ───────────────────────────────────────────────────

    /**
     * Adds a node for the record, or returns the existing node with the same
     * identity.
     *
     * @throws IllegalArgumentException if the record has no identity.
     * @throws IllegalStateException    if the graph is sealed.
     */
    public GraphNode addNode(DataRecord record) {
        Objects.requireNonNull(record, "record");
        String identity = record.identity();
        if (identity == null || identity.isBlank())
            throw new IllegalArgumentException("Record has no identity: " + record);
        Integer existing = identityToIndex.get(identity);
        if (existing != null)
            return nodes.get(existing);

        requireMutable();
        int idx = nodes.size();
        GraphNode node = new GraphNode(this, idx, identity, record);
        nodes.add(node);
        identityToIndex.put(identity, idx);
        out.add(new ArrayList<>());
        in.add(new ArrayList<>());
        return node;
    }

    /**
     * Records that {@code from} depends on {@code to}. Both endpoints are added
     * as nodes if needed.
     *
     * @return true if a new edge was inserted, false if it already existed.
     */
    public boolean addDependency(DataRecord from, DataRecord to) {
        requireMutable();
        return addEdge(addNode(from), addNode(to));
    }

    /** Inserts the edge between two nodes already owned by this graph. */
    boolean addEdge(GraphNode from, GraphNode to) {
        requireMutable();
        int f = from.index();
        int t = to.index();
        if (!edgeKeys.add(edgeKey(f, t)))
            return false;
        out.get(f).add(t);
        in.get(t).add(f);
        return true;
    }

    /** Publishes the graph as an immutable snapshot. */
    public void seal() {
        this.sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void requireMutable() {
        if (sealed)
            throw new IllegalStateException("Dependency graph generation " + generation + " is sealed");
    }

    private static long edgeKey(int from, int to) {
        return ((long) from << 32) | (to & 0xFFFFFFFFL);
    }

    // ── Reads ──────────────────────────────────────────────────────

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeKeys.size();
    }

    /** All nodes in insertion order. */
    public List<GraphNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public GraphNode node(int index) {
        return nodes.get(index);
    }

    /** @return The node for the identity, or null if absent. */
    public GraphNode node(String identity) {
        Integer idx = identity == null ? null : identityToIndex.get(identity);
        return idx == null ? null : nodes.get(idx);
    }

    /** @return The node for the record's identity, or null if absent. */
    public GraphNode getNode(DataRecord record) {
        return record == null ? null : node(record.identity());
    }

    public boolean contains(DataRecord record) {
        return getNode(record) != null;
    }

    public List<GraphNode> dependenciesOf(DataRecord record) {
        return dependenciesOf(getNode(record));
    }

    public List<GraphNode> dependentsOf(DataRecord record) {
        return dependentsOf(getNode(record));
    }

    List<GraphNode> dependenciesOf(GraphNode node) {
        return node == null ? List.of() : resolve(out.get(node.index()));
    }

    List<GraphNode> dependentsOf(GraphNode node) {
        return node == null ? List.of() : resolve(in.get(node.index()));
    }

    private List<GraphNode> resolve(List<Integer> indices) {
        List<GraphNode> result = new ArrayList<>(indices.size());
        for (int i : indices)
            result.add(nodes.get(i));
        return result;
    }

    int outDegree(int index) {
        return out.get(index).size();
    }

    int inDegree(int index) {
        return in.get(index).size();
    }

    /** Dependency indices of a node, in insertion order. Read-only view. */
    List<Integer> dependencyIndices(int index) {
        return Collections.unmodifiableList(out.get(index));
    }

    /** Nodes with no dependents, in insertion order. */
    public List<GraphNode> orphanNodes() {
        List<GraphNode> result = new ArrayList<>();
        for (GraphNode n : nodes)
            if (in.get(n.index()).isEmpty())
                result.add(n);
        return result;
    }

    /**
     * Top {@code topN} nodes by dependent count, descending. Ties are broken by
     * identity, ascending.
     */
    public List<GraphNode> mostReferenced(int topN) {
        return top(topN, Comparator.comparingInt(GraphNode::referenceCount).reversed().thenComparing(BY_IDENTITY));
    }

    /**
     * Top {@code topN} nodes by dependency count, descending. Ties are broken by
     * identity, ascending.
     */
    public List<GraphNode> mostDependencies(int topN) {
        return top(topN, Comparator.comparingInt(GraphNode::dependencyCount).reversed().thenComparing(BY_IDENTITY));
    }

    private List<GraphNode> top(int topN, Comparator<GraphNode> order) {
        if (topN < 0)
            throw new IllegalArgumentException("topN must be >= 0: " + topN);
        return nodes.stream().sorted(order).limit(topN).toList();
    }

    public GraphStats stats() {
        int n = nodes.size();
        int orphans = 0;
        for (List<Integer> dependents : in)
            if (dependents.isEmpty())
                orphans++;
        int edges = edgeCount();
        return new GraphStats(n, edges, orphans, n > 0 ? (double) edges / n : 0.0);
    }
}
