package com.catalog.refgraph;

import java.time.Duration;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.catalog.refgraph.api.DataRecord;
import com.catalog.refgraph.catalog.RecordCatalog;
import com.catalog.refgraph.config.CatalogConfig;
import com.catalog.refgraph.fixtures.Item;
import com.catalog.refgraph.fixtures.ItemDatabase;
import com.catalog.refgraph.fixtures.Monster;
import com.catalog.refgraph.fixtures.MutableClock;
import com.catalog.refgraph.fixtures.RecordingBuildListener;
import com.catalog.refgraph.graph.DependencyGraph;
import com.catalog.refgraph.io.GraphReport;
import com.catalog.refgraph.query.Condition;
import com.catalog.refgraph.query.ConditionGroup;
import com.catalog.refgraph.query.QueryOperator;
import com.catalog.refgraph.source.InMemoryRecordSource;

import static org.junit.Assert.*;

public class RefGraphTest {
    private MutableClock clock;
    private InMemoryRecordSource source;
    private RefGraph refGraph;
    private Item sword, unused;
    private Monster goblin, dragon;
    private ItemDatabase database;

    @Before
    public void setUp() {
        clock = new MutableClock();
        sword = new Item("i1", "Sword");
        unused = new Item("i2", "Forgotten Ring");
        goblin = new Monster("m1", "Goblin", 10);
        goblin.drop = sword;
        dragon = new Monster("m2", "Dragon", 200);
        database = new ItemDatabase("db", "All Items", sword);
        source = new InMemoryRecordSource(List.of(sword, unused, goblin, dragon, database));
        refGraph = new RefGraph(source, CatalogConfig.defaults(), null, clock);
    }

    @Test
    public void testQueryThroughFacade() {
        List<DataRecord> bigOnes = refGraph.query(
                ConditionGroup.and(Condition.of("hp", QueryOperator.GREATER, 50)));
        assertEquals(List.of(dragon), bigOnes);
    }

    @Test
    public void testUnusedRecordsExcludingExemptContainers() {
        List<DataRecord> orphans = refGraph.analyzer().findOrphansExcludingExempt();
        assertEquals(List.of(unused, goblin, dragon), orphans);
    }

    @Test
    public void testSourceChangesInvalidateGraph() {
        DependencyGraph first = refGraph.graph();
        assertSame(first, refGraph.graph());

        dragon.drop = unused;
        source.fireChanged();
        DependencyGraph second = refGraph.graph();
        assertNotSame(first, second);
        assertFalse(second.getNode(unused).isOrphan());
    }

    @Test
    public void testCacheExpiresWithConfiguredWindow() {
        DependencyGraph first = refGraph.graph();
        clock.advance(Duration.ofSeconds(31));
        assertNotSame(first, refGraph.graph());
    }

    @Test
    public void testBuildListener() {
        RecordingBuildListener listener = new RecordingBuildListener();
        refGraph.setBuildListener(listener);
        refGraph.invalidate();
        refGraph.graph();
        assertEquals(1, listener.started.size());
        assertEquals(5, listener.lastNodeCount);
        assertEquals(2, listener.lastEdgeCount);
    }

    @Test
    public void testCatalogAndReport() {
        RecordCatalog catalog = refGraph.scanCatalog();
        assertEquals(5, catalog.totalRecordCount());

        GraphReport report = refGraph.report();
        assertEquals(5, report.getNodeCount());
        assertEquals("i1", report.getMostReferenced().get(0).getIdentity());
        assertTrue(refGraph.explain().explainNode("i1").contains("Dependents (2)"));
    }

    @Test
    public void testConfigDrivesCollaborators() {
        CatalogConfig config = CatalogConfig.fromClasspath("strict-ref-graph.json");
        RefGraph strict = new RefGraph(source, config, null, clock);
        assertEquals(Duration.ZERO, strict.cache().validity());
        assertNull(strict.accessor().resolve(Monster.class, "identity"));
        assertNull(strict.accessor().resolve(Monster.class, "secret"));
        assertNotNull(refGraph.queryEngine());
        assertTrue(strict.analyzer().isExemptType(ItemDatabase.class));
        assertFalse(strict.analyzer().isExemptType(CatalogConfig.class));
        assertSame(strict.accessor(), strict.queryEngine().accessor());
    }

    @Test
    public void testDefaultConstructorLoadsBundledConfig() {
        RefGraph defaults = new RefGraph(source);
        assertEquals(Duration.ofSeconds(30), defaults.cache().validity());
        assertSame(source, defaults.source());
    }
}
