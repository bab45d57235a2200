package com.example.crosswalk.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the ids known to an OSCAL catalog JSON file: every object that carries both an
 * {@code id} and a {@code title} (groups and controls, not parts).
 */
@Service
public class CatalogIdLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogIdLoader.class);

    private final ObjectMapper objectMapper;

    public CatalogIdLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param catalogPath configured catalog path
     * @throws MissingInputException if the catalog file does not exist
     */
    public Set<String> load(String catalogPath) {
        Path file = MissingInputException.requireFile(catalogPath, "catalog");
        log.info("Loading control ids from {}", file);
        try {
            Set<String> ids = collectIds(objectMapper.readTree(file.toFile()));
            log.info("Found {} ids in catalog {}", ids.size(), file.getFileName());
            return ids;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read catalog %s: %s".formatted(file, e.getMessage()), e);
        }
    }

    public Set<String> collectIds(JsonNode root) {
        Set<String> ids = new LinkedHashSet<>();
        collect(root, ids);
        return ids;
    }

    private static void collect(JsonNode node, Set<String> ids) {
        if (node.isObject()) {
            if (node.hasNonNull("id") && node.hasNonNull("title")) {
                ids.add(node.get("id").asText());
            }
            node.elements().forEachRemaining(child -> collect(child, ids));
        } else if (node.isArray()) {
            node.forEach(child -> collect(child, ids));
        }
    }
}
