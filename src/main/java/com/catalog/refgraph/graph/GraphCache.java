package com.catalog.refgraph.graph;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.catalog.refgraph.api.DataRecord;
import com.catalog.refgraph.api.RecordSource;
import com.catalog.refgraph.api.RecordSourceListener;
import com.catalog.refgraph.api.ReferenceExtractor;

import lombok.extern.log4j.Log4j2;

/**
 * Owns the most recently built {@link DependencyGraph} and decides when to
 * rebuild it.
 *
 * <p>
 * A cached graph is served while it is younger than the validity window.
 * After that, or after {@link #invalidateCache()}, the next read rebuilds
 * synchronously from the record source. The cache cannot detect changes to
 * the records on its own: whoever mutates the record set must invalidate it,
 * either directly or by registering this cache as a
 * {@link RecordSourceListener} on an observable source.
 *
 * <p>
 * Check-and-rebuild is guarded by the cache monitor, so concurrent readers see
 * either the previous sealed graph or the new one, never a graph under
 * construction.
 */
@Log4j2
public final class GraphCache implements RecordSourceListener {
    public static final Duration DEFAULT_VALIDITY = Duration.ofSeconds(30);

    private final RecordSource source;
    private final ReferenceExtractor extractor;
    private final GraphBuilder builder;
    private final Duration validity;
    private final Clock clock;

    private DependencyGraph cached;
    private Instant builtAt;

    public GraphCache(RecordSource source, ReferenceExtractor extractor) {
        this(source, extractor, new GraphBuilder(), DEFAULT_VALIDITY, Clock.systemUTC());
    }

    public GraphCache(RecordSource source, ReferenceExtractor extractor, GraphBuilder builder, Duration validity,
            Clock clock) {
        this.source = Objects.requireNonNull(source, "source");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.validity = Objects.requireNonNull(validity, "validity");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (validity.isNegative())
            throw new IllegalArgumentException("Cache validity must not be negative: " + validity);
    }

    /** Returns the cached graph, rebuilding it first if it is missing or expired. */
    public synchronized DependencyGraph getCachedGraph() {
        if (isValid()) {
            log.debug("Serving cached dependency graph generation {}", cached.generation());
            return cached;
        }
        return rebuild();
    }

    /** Unconditionally rebuilds from the record source and caches the result. */
    public synchronized DependencyGraph rebuild() {
        List<DataRecord> records = new ArrayList<>(
                Objects.requireNonNull(source.listAllRecords(), "source returned no record set"));
        DependencyGraph graph = builder.build(records, extractor);
        this.cached = graph;
        this.builtAt = clock.instant();
        return graph;
    }

    /** Drops the cached graph; the next read rebuilds. */
    public synchronized void invalidateCache() {
        if (cached != null)
            log.debug("Invalidating dependency graph generation {}", cached.generation());
        this.cached = null;
        this.builtAt = null;
    }

    /** True if a cached graph exists and is still within the validity window. */
    public synchronized boolean isValid() {
        if (cached == null)
            return false;
        return Duration.between(builtAt, clock.instant()).compareTo(validity) < 0;
    }

    /** The cached graph without triggering a build; may be null or expired. */
    public synchronized DependencyGraph peek() {
        return cached;
    }

    public Duration validity() {
        return validity;
    }

    public GraphBuilder builder() {
        return builder;
    }

    @Override
    public void onRecordsChanged(RecordSource changed) {
        invalidateCache();
        log.info("Record source changed; dependency graph cache invalidated");
    }
}
