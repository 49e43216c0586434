package com.catalog.refgraph;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.catalog.refgraph.access.FieldAccessor;
import com.catalog.refgraph.analysis.DependencyAnalyzer;
import com.catalog.refgraph.api.BuildListener;
import com.catalog.refgraph.api.DataRecord;
import com.catalog.refgraph.api.RecordSource;
import com.catalog.refgraph.api.ReferenceExtractor;
import com.catalog.refgraph.catalog.CatalogScanner;
import com.catalog.refgraph.catalog.RecordCatalog;
import com.catalog.refgraph.config.CatalogConfig;
import com.catalog.refgraph.graph.DependencyGraph;
import com.catalog.refgraph.graph.GraphBuilder;
import com.catalog.refgraph.graph.GraphCache;
import com.catalog.refgraph.io.GraphReport;
import com.catalog.refgraph.io.GraphReportWriter;
import com.catalog.refgraph.query.ConditionGroup;
import com.catalog.refgraph.query.QueryEngine;
import com.catalog.refgraph.source.InMemoryRecordSource;
import com.catalog.refgraph.source.ReflectiveReferenceExtractor;
import com.catalog.refgraph.util.GraphExplain;

import lombok.extern.log4j.Log4j2;

/**
 * Entry point wiring a record source to the query engine, the dependency
 * graph cache, the analyzer and the catalog scanner.
 *
 * <p>
 * All collaborators are built from one {@link CatalogConfig}:
 * <ul>
 * <li>the {@link FieldAccessor} with the configured reserved field names,</li>
 * <li>the {@link GraphCache} with the configured validity window,</li>
 * <li>the {@link DependencyAnalyzer} with the orphan-exempt type suffixes,</li>
 * <li>the {@link CatalogScanner} with the excluded package prefixes.</li>
 * </ul>
 * When the source is an {@link InMemoryRecordSource} the cache is registered
 * as its change listener, so edits invalidate the graph.
 *
 * <pre>{@code
 * InMemoryRecordSource source = new InMemoryRecordSource(records);
 * RefGraph refGraph = new RefGraph(source);
 * List<DataRecord> unused = refGraph.analyzer().findOrphansExcludingExempt();
 * }</pre>
 */
@Log4j2
public final class RefGraph {
    private final RecordSource source;
    private final CatalogConfig config;
    private final FieldAccessor accessor;
    private final ReferenceExtractor extractor;
    private final GraphBuilder builder;
    private final GraphCache cache;
    private final DependencyAnalyzer analyzer;
    private final QueryEngine queryEngine;
    private final CatalogScanner scanner;

    /** Wires the source with the configuration found on the classpath. */
    public RefGraph(RecordSource source) {
        this(source, CatalogConfig.load());
    }

    public RefGraph(RecordSource source, CatalogConfig config) {
        this(source, config, null, Clock.systemUTC());
    }

    /**
     * @param extractor Reference extractor, or null for a
     *                  {@link ReflectiveReferenceExtractor} over this graph's
     *                  field accessor.
     * @param clock     Clock driving cache expiry and catalog timestamps.
     */
    public RefGraph(RecordSource source, CatalogConfig config, ReferenceExtractor extractor, Clock clock) {
        this.source = Objects.requireNonNull(source, "source");
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
        this.accessor = new FieldAccessor(config.reservedFieldNameSet());
        this.extractor = extractor != null ? extractor : new ReflectiveReferenceExtractor(accessor);
        this.builder = new GraphBuilder();
        this.cache = new GraphCache(source, this.extractor, builder, config.cacheValidity(), clock);
        this.analyzer = new DependencyAnalyzer(cache, config.orphanExemptTypeSuffixSet());
        this.queryEngine = new QueryEngine(accessor);
        this.scanner = new CatalogScanner(config.excludedPackagePrefixSet(), clock);

        if (source instanceof InMemoryRecordSource observable)
            observable.addListener(cache);
        log.debug("RefGraph wired: validity={}, reserved={}, excludedPackages={}", config.cacheValidity(),
                config.getReservedFieldNames(), config.getExcludedPackagePrefixes());
    }

    public RecordSource source() {
        return source;
    }

    public CatalogConfig config() {
        return config;
    }

    public FieldAccessor accessor() {
        return accessor;
    }

    public ReferenceExtractor extractor() {
        return extractor;
    }

    public GraphCache cache() {
        return cache;
    }

    public DependencyAnalyzer analyzer() {
        return analyzer;
    }

    public QueryEngine queryEngine() {
        return queryEngine;
    }

    public CatalogScanner scanner() {
        return scanner;
    }

    /** Attaches a listener to every graph build. Pass null to detach. */
    public void setBuildListener(BuildListener listener) {
        builder.setListener(listener);
    }

    /** Current graph, rebuilding it if the cached one expired. */
    public DependencyGraph graph() {
        return cache.getCachedGraph();
    }

    public void invalidate() {
        cache.invalidateCache();
    }

    /** Runs the group over every record in the source. */
    public List<DataRecord> query(ConditionGroup group) {
        return queryEngine.query(group, new ArrayList<DataRecord>(source.listAllRecords()));
    }

    public RecordCatalog scanCatalog() {
        return scanner.scan(source);
    }

    /** Report over the current graph using the configured top-N length. */
    public GraphReport report() {
        return GraphReport.of(graph(), config.getDefaultTopN());
    }

    public void writeReport(Path path) throws IOException {
        new GraphReportWriter().write(report(), path);
    }

    public GraphExplain explain() {
        return new GraphExplain(graph());
    }
}
