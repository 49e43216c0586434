package com.catalog.refgraph.catalog;

import java.lang.reflect.Modifier;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.catalog.refgraph.api.DataRecord;
import com.catalog.refgraph.api.RecordSource;

import lombok.extern.log4j.Log4j2;

/**
 * Discovers the records of a {@link RecordSource} and groups them by type.
 *
 * <p>
 * Types in excluded package prefixes (host framework types) and private or
 * protected member types are ignored.
 */
@Log4j2
public final class CatalogScanner {
    private final Set<String> excludedPackagePrefixes;
    private final Clock clock;

    public CatalogScanner() {
        this(Set.of(), Clock.systemUTC());
    }

    public CatalogScanner(Set<String> excludedPackagePrefixes, Clock clock) {
        this.excludedPackagePrefixes = Set.copyOf(excludedPackagePrefixes);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RecordCatalog scan(RecordSource source) {
        Objects.requireNonNull(source, "source");
        Map<Class<?>, List<DataRecord>> byType = new LinkedHashMap<>();
        int excluded = 0;
        for (DataRecord record : source.listAllRecords()) {
            if (record == null)
                continue;
            Class<?> type = record.getClass();
            if (isExcludedType(type)) {
                excluded++;
                continue;
            }
            byType.computeIfAbsent(type, t -> new ArrayList<>()).add(record);
        }

        RecordCatalog catalog = new RecordCatalog(byType, TypeNode.buildCategoryTree(byType), clock.instant());
        log.info("Catalog scan found {} record(s) of {} type(s), {} excluded", catalog.totalRecordCount(),
                catalog.totalTypeCount(), excluded);
        return catalog;
    }

    public boolean isExcludedType(Class<?> type) {
        if (type == null)
            return true;
        String pkg = type.getPackageName().toLowerCase(Locale.ROOT);
        for (String prefix : excludedPackagePrefixes)
            if (!prefix.isEmpty() && pkg.startsWith(prefix.toLowerCase(Locale.ROOT)))
                return true;
        if (type.isMemberClass()) {
            int mod = type.getModifiers();
            return Modifier.isPrivate(mod) || Modifier.isProtected(mod);
        }
        return false;
    }
}
