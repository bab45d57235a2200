package com.example.crosswalk.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogIdLoaderTest {

    private static final String CATALOG = """
            {
              "catalog": {
                "uuid": "0b7c3c5e-0000-4000-8000-000000000000",
                "metadata": { "title": "SP 800-53 rev5" },
                "groups": [
                  {
                    "id": "ac",
                    "class": "family",
                    "title": "Access Control",
                    "controls": [
                      {
                        "id": "ac-1",
                        "title": "Policy and Procedures",
                        "parts": [ { "id": "ac-1_smt", "name": "statement", "prose": "..." } ],
                        "controls": [ { "id": "ac-2.1", "title": "Automated Account Management" } ]
                      }
                    ]
                  }
                ]
              }
            }
            """;

    @TempDir
    Path tempDir;

    private final CatalogIdLoader loader = new CatalogIdLoader(new ObjectMapper());

    @Test
    void load_shouldCollectIdsOfTitledNodes() throws Exception {
        // Arrange
        Path catalog = tempDir.resolve("catalog.json");
        Files.writeString(catalog, CATALOG);

        // Act
        Set<String> ids = loader.load(catalog.toString());

        // Assert
        assertThat(ids).containsExactly("ac", "ac-1", "ac-2.1");
    }

    @Test
    void load_shouldThrowMissingInput_whenFileAbsent() {
        String missing = tempDir.resolve("nope.json").toString();

        assertThatThrownBy(() -> loader.load(missing))
                .isInstanceOf(MissingInputException.class)
                .hasMessageContaining("nope.json");
    }

    @Test
    void load_shouldThrowMissingInput_whenPathBlank() {
        assertThatThrownBy(() -> loader.load(" "))
                .isInstanceOf(MissingInputException.class);
    }
}
