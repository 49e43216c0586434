package com.catalog.refgraph.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.catalog.refgraph.access.FieldAccessor;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Tunables for the catalog, graph cache and analyzer.
 *
 * <p>
 * Loaded from JSON; unknown keys are ignored and missing keys keep their
 * defaults.
 *
 * <pre>
 * {
 *   "cacheValiditySeconds": 30,
 *   "reservedFieldNames": ["identity", "serialVersionUID"],
 *   "excludedPackagePrefixes": ["com.host.internal"],
 *   "orphanExemptTypeSuffixes": ["Database", "Manager", "Config"],
 *   "defaultTopN": 10
 * }
 * </pre>
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CatalogConfig {
    public static final String DEFAULT_RESOURCE = "ref-graph.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private long cacheValiditySeconds = 30;
    private List<String> reservedFieldNames = List.copyOf(FieldAccessor.DEFAULT_RESERVED_NAMES);
    private List<String> excludedPackagePrefixes = List.of();
    private List<String> orphanExemptTypeSuffixes = List.of("Database", "Manager", "Config");
    private int defaultTopN = 10;

    public static CatalogConfig defaults() {
        return new CatalogConfig();
    }

    public static CatalogConfig fromJson(String json) {
        try {
            return MAPPER.readValue(json, CatalogConfig.class);
        } catch (IOException e) {
            throw new CatalogConfigException("Invalid catalog configuration", e);
        }
    }

    public static CatalogConfig fromFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, CatalogConfig.class);
        } catch (IOException e) {
            throw new CatalogConfigException("Failed to load catalog configuration from " + path, e);
        }
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns the
     * defaults when the resource is absent.
     */
    public static CatalogConfig load() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static CatalogConfig fromClasspath(String resource) {
        InputStream in = CatalogConfig.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.debug("No {} on classpath, using defaults", resource);
            return defaults();
        }
        try (in) {
            return MAPPER.readValue(in, CatalogConfig.class);
        } catch (IOException e) {
            throw new CatalogConfigException("Failed to load catalog configuration resource " + resource, e);
        }
    }

    public Duration cacheValidity() {
        return Duration.ofSeconds(cacheValiditySeconds);
    }

    public Set<String> reservedFieldNameSet() {
        return toSet(reservedFieldNames);
    }

    public Set<String> excludedPackagePrefixSet() {
        return toSet(excludedPackagePrefixes);
    }

    public Set<String> orphanExemptTypeSuffixSet() {
        return toSet(orphanExemptTypeSuffixes);
    }

    // A JSON null leaves the list null.
    private static Set<String> toSet(List<String> values) {
        return values == null ? new LinkedHashSet<>() : new LinkedHashSet<>(values);
    }
}
