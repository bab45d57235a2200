package com.example.crosswalk.service;

import com.example.crosswalk.config.CrosswalkConfig;
import com.example.crosswalk.model.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogWriterTest {

    private final ObjectMapper objectMapper = new CrosswalkConfig().objectMapper();
    private final CatalogWriter writer = new CatalogWriter(objectMapper);

    @TempDir
    Path tempDir;

    private static Catalog sampleCatalog() {
        Control control = new Control("gv.oc-01", "GV.OC-01", List.of(
                ControlPart.statement("gv.oc-01", "The organizational mission is understood"),
                ControlPart.example("gv.oc-01", "Ex1: Share the mission")));
        CategoryGroup category = new CategoryGroup("gv.oc", "Organizational Context (GV.OC)", List.of(control));
        FunctionGroup function = new FunctionGroup("gv", "GOVERN (GV)", List.of(category));
        return new Catalog("8f1e0b8e-1111-4222-8333-444455556666",
                new CatalogMetadata("NIST CSF v2.0", Instant.parse("2025-03-01T10:15:30.123Z"), "2.0", "1.1.2"),
                List.of(function));
    }

    @Test
    void toJson_shouldUseOscalFieldNames() throws Exception {
        // Act
        JsonNode root = objectMapper.readTree(writer.toJson(sampleCatalog()));

        // Assert
        JsonNode catalog = root.get("catalog");
        assertThat(catalog.get("uuid").asText()).isEqualTo("8f1e0b8e-1111-4222-8333-444455556666");
        assertThat(catalog.at("/metadata/last-modified").asText()).isEqualTo("2025-03-01T10:15:30.123Z");
        assertThat(catalog.at("/metadata/oscal-version").asText()).isEqualTo("1.1.2");

        JsonNode function = catalog.at("/groups/0");
        assertThat(function.get("class").asText()).isEqualTo("function");
        assertThat(function.at("/groups/0/class").asText()).isEqualTo("category");
        assertThat(function.at("/groups/0/controls/0/parts/0/name").asText()).isEqualTo("statement");
        assertThat(function.at("/groups/0/controls/0/parts/1/id").asText()).isEqualTo("gv.oc-01_eg");
        assertThat(catalog.has("controls")).isFalse();
        assertThat(catalog.has("nodeIds")).isFalse();
    }

    @Test
    void write_shouldProduceFileReadableByIdLoader() {
        // Arrange
        Path output = tempDir.resolve("catalogs/NIST_CSF_v2.0/catalog.json");

        // Act
        writer.write(sampleCatalog(), output);

        // Assert
        assertThat(new CatalogIdLoader(objectMapper).load(output.toString()))
                .containsExactly("gv", "gv.oc", "gv.oc-01");
    }
}
