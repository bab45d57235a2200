package com.example.crosswalk.service;

import com.example.crosswalk.model.Catalog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Serializes a catalog as OSCAL JSON, wrapped in a top-level {@code catalog} object.
 */
@Service
public class CatalogWriter {

    private static final Logger log = LoggerFactory.getLogger(CatalogWriter.class);

    private final ObjectMapper objectMapper;

    public CatalogWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(Catalog catalog) {
        try {
            return objectMapper.writeValueAsString(Map.of("catalog", catalog));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize catalog: " + e.getMessage(), e);
        }
    }

    public Path write(Catalog catalog, Path output) {
        try {
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            objectMapper.writeValue(output.toFile(), Map.of("catalog", catalog));
            log.info("Catalog written to {}", output);
            return output;
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing catalog %s: %s".formatted(output, e.getMessage()), e);
        }
    }
}
