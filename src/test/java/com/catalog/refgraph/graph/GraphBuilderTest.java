package com.catalog.refgraph.graph;

import java.util.AbstractSet;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import com.catalog.refgraph.api.DataRecord;
import com.catalog.refgraph.api.ReferenceExtractor;
import com.catalog.refgraph.fixtures.Item;
import com.catalog.refgraph.fixtures.Monster;
import com.catalog.refgraph.fixtures.RecordingBuildListener;
import com.catalog.refgraph.fixtures.SimpleRecord;
import com.catalog.refgraph.fixtures.UnreadableRecord;
import com.catalog.refgraph.source.ReflectiveReferenceExtractor;

import static org.junit.Assert.*;

public class GraphBuilderTest {
    private GraphBuilder builder;
    private RecordingBuildListener listener;
    private Item sword;
    private Item shield;
    private Monster knight;

    @Before
    public void setUp() {
        builder = new GraphBuilder();
        listener = new RecordingBuildListener();
        builder.setListener(listener);
        sword = new Item("i1", "Sword");
        shield = new Item("i2", "Shield");
        knight = new Monster("m1", "Knight", 100);
        knight.drop = sword;
        knight.inventory.add(shield);
        knight.inventory.add(sword);
    }

    @Test
    public void testBuildFromReflectiveExtractor() {
        DependencyGraph graph = builder.build(List.of(sword, shield, knight), new ReflectiveReferenceExtractor());
        assertTrue(graph.isSealed());
        assertEquals(3, graph.nodeCount());
        assertEquals(2, graph.edgeCount());
        assertEquals(2, graph.getNode(knight).dependencyCount());
        assertEquals(1, graph.getNode(sword).referenceCount());
        assertEquals(List.of(graph.getNode(knight)), graph.orphanNodes());
    }

    @Test
    public void testGenerationsIncrease() {
        assertEquals(0, builder.lastGeneration());
        DependencyGraph first = builder.build(List.of(sword), r -> Set.of());
        DependencyGraph second = builder.build(List.of(sword), r -> Set.of());
        assertEquals(1, first.generation());
        assertEquals(2, second.generation());
        assertEquals(2, builder.lastGeneration());
        assertEquals(List.of(1L, 2L), listener.started);
    }

    @Test
    public void testSelfReferenceDropped() {
        ReferenceExtractor selfish = r -> new LinkedHashSet<>(List.of(r, shield));
        DependencyGraph graph = builder.build(List.of(sword, shield), selfish);
        assertEquals(1, graph.edgeCount());
        assertEquals(1, graph.getNode(sword).dependencyCount());
        assertEquals(0, graph.getNode(shield).dependencyCount());
    }

    @Test
    public void testExtractionFailureIsolated() {
        ReferenceExtractor flaky = r -> {
            if (r == knight)
                throw new IllegalStateException("boom");
            return Set.of(shield);
        };
        DependencyGraph graph = builder.build(List.of(sword, shield, knight), flaky);
        assertEquals(3, graph.nodeCount());
        assertTrue(graph.contains(knight));
        assertEquals(0, graph.getNode(knight).dependencyCount());
        assertEquals(1, graph.getNode(sword).dependencyCount());

        assertEquals(List.of(knight), listener.failed);
        assertEquals(1, listener.lastFailures);
        assertEquals(3, listener.lastNodeCount);
        assertEquals(1, listener.lastEdgeCount);
    }

    @Test
    public void testUnreadableIdentityIsolated() {
        DataRecord broken = new UnreadableRecord("ghost");
        DependencyGraph graph = builder.build(List.of(sword, broken, shield), r -> Set.of(shield));
        assertEquals(2, graph.nodeCount());
        assertEquals(1, graph.edgeCount());
        assertEquals(1, graph.getNode(sword).dependencyCount());

        assertEquals(List.of(broken), listener.failed);
        assertEquals(1, listener.lastFailures);
    }

    @Test
    public void testFailingReferenceIterationAddsNoEdges() {
        ReferenceExtractor lazy = r -> {
            if (r != knight)
                return Set.of();
            return new AbstractSet<DataRecord>() {
                @Override
                public Iterator<DataRecord> iterator() {
                    return new Iterator<DataRecord>() {
                        private boolean served;

                        @Override
                        public boolean hasNext() {
                            return true;
                        }

                        @Override
                        public DataRecord next() {
                            if (served)
                                throw new IllegalStateException("lazy boom");
                            served = true;
                            return shield;
                        }
                    };
                }

                @Override
                public int size() {
                    return 2;
                }
            };
        };
        DependencyGraph graph = builder.build(List.of(sword, shield, knight), lazy);
        assertEquals(3, graph.nodeCount());
        assertEquals(0, graph.edgeCount());
        assertEquals(0, graph.getNode(knight).dependencyCount());
        assertEquals(0, graph.getNode(shield).referenceCount());
        assertEquals(List.of(knight), listener.failed);
        assertEquals(1, listener.lastFailures);
    }

    @Test
    public void testUnreadableReferenceAddsNoEdges() {
        DataRecord broken = new UnreadableRecord("ghost");
        ReferenceExtractor extractor = r -> {
            if (r != knight)
                return Set.of();
            return new LinkedHashSet<>(List.of(shield, broken, sword));
        };
        DependencyGraph graph = builder.build(List.of(sword, shield, knight), extractor);
        assertEquals(3, graph.nodeCount());
        assertEquals(0, graph.edgeCount());
        assertEquals(0, graph.getNode(knight).dependencyCount());
        assertEquals(List.of(knight), listener.failed);
        assertEquals(1, listener.lastFailures);
    }

    @Test
    public void testReferencesOutsideInputGetNodes() {
        DependencyGraph graph = builder.build(List.of(knight), new ReflectiveReferenceExtractor());
        assertEquals(3, graph.nodeCount());
        assertTrue(graph.contains(sword));
        assertTrue(graph.contains(shield));
    }

    @Test
    public void testRecordsWithoutIdentitySkipped() {
        DataRecord anonymous = new SimpleRecord(null, "nobody");
        DataRecord blank = new SimpleRecord("", "blank");
        ReferenceExtractor pointsAtAnonymous = r -> Set.of(anonymous);
        DependencyGraph graph = builder.build(Arrays.asList(sword, null, anonymous, blank), pointsAtAnonymous);
        assertEquals(1, graph.nodeCount());
        assertEquals(0, graph.edgeCount());
    }

    @Test
    public void testNullExtractorResultMeansNoEdges() {
        DependencyGraph graph = builder.build(List.of(sword, shield), r -> null);
        assertEquals(2, graph.nodeCount());
        assertEquals(0, graph.edgeCount());
    }

    @Test(expected = NullPointerException.class)
    public void testNullRecordsRejected() {
        builder.build(null, r -> Set.of());
    }

    @Test(expected = NullPointerException.class)
    public void testNullExtractorRejected() {
        builder.build(List.of(sword), null);
    }
}
