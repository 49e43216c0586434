package com.catalog.refgraph.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import lombok.extern.log4j.Log4j2;

/**
 * Writes and reads {@link GraphReport}s as JSON.
 */
@Log4j2
public final class GraphReportWriter {
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(GraphReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize graph report", e);
        }
    }

    public void write(GraphReport report, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        mapper.writeValue(path.toFile(), report);
        log.info("Graph report (generation {}) saved to {}", report.getGeneration(), path);
    }

    public GraphReport read(Path path) throws IOException {
        return mapper.readValue(path.toFile(), GraphReport.class);
    }
}
