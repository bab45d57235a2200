package com.example.crosswalk.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.stream.Stream;

/**
 * Hierarchical control catalog: functions, categories, controls.
 */
@JsonPropertyOrder({"uuid", "metadata", "groups"})
public record Catalog(String uuid, CatalogMetadata metadata, List<FunctionGroup> groups) {

    /** All controls in document order. */
    @JsonIgnore
    public List<Control> controls() {
        return groups.stream()
                .flatMap(f -> f.categories().stream())
                .flatMap(c -> c.controls().stream())
                .toList();
    }

    /** Ids of every node (functions, categories and controls) in document order. */
    @JsonIgnore
    public List<String> nodeIds() {
        return groups.stream()
                .flatMap(f -> Stream.concat(Stream.of(f.id()),
                        f.categories().stream().flatMap(c -> Stream.concat(Stream.of(c.id()),
                                c.controls().stream().map(Control::id)))))
                .toList();
    }
}
