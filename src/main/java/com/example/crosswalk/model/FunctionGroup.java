package com.example.crosswalk.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Top catalog level (a CSF function such as {@code GOVERN (GV)}).
 */
@JsonPropertyOrder({"id", "class", "title", "groups"})
public record FunctionGroup(String id, String title,
                            @JsonProperty("groups") List<CategoryGroup> categories) {

    @JsonProperty("class")
    public String groupClass() {
        return "function";
    }
}
