package com.example.crosswalk.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * OSCAL catalog metadata block.
 */
@JsonPropertyOrder({"title", "last-modified", "version", "oscal-version"})
public record CatalogMetadata(
        String title,
        @JsonProperty("last-modified") Instant lastModified,
        String version,
        @JsonProperty("oscal-version") String oscalVersion
) {}
