package com.catalog.refgraph.graph;

import java.util.List;

import com.catalog.refgraph.api.DataRecord;

/**
 * A record's vertex in a {@link DependencyGraph}.
 *
 * <p>
 * Nodes are views onto the graph's arena: the edges themselves live in the
 * graph as index lists. Within one graph generation there is exactly one node
 * instance per identity. Equality is by identity key.
 */
public final class GraphNode {
    private final DependencyGraph graph;
    private final int index;
    private final String identity;
    private final DataRecord record;

    GraphNode(DependencyGraph graph, int index, String identity, DataRecord record) {
        this.graph = graph;
        this.index = index;
        this.identity = identity;
        this.record = record;
    }

    /** Position in the graph's arena (insertion order). */
    public int index() {
        return index;
    }

    public String identity() {
        return identity;
    }

    public DataRecord record() {
        return record;
    }

    /** Records this node points to (outgoing edges). */
    public List<GraphNode> dependencies() {
        return graph.dependenciesOf(this);
    }

    /** Records pointing to this node (incoming edges). */
    public List<GraphNode> dependents() {
        return graph.dependentsOf(this);
    }

    public int dependencyCount() {
        return graph.outDegree(index);
    }

    public int referenceCount() {
        return graph.inDegree(index);
    }

    public boolean isOrphan() {
        return referenceCount() == 0;
    }

    /** {@code name (Type)}, or the identity when the record has no name. */
    public String displayName() {
        if (record == null)
            return identity;
        String name = record.name() != null ? record.name() : identity;
        return name + " (" + record.getClass().getSimpleName() + ")";
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof GraphNode other && identity.equals(other.identity));
    }

    @Override
    public int hashCode() {
        return identity.hashCode();
    }

    @Override
    public String toString() {
        return identity;
    }
}
