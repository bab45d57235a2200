package com.example.crosswalk.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Second catalog level. The control list is filled while the catalog is being built.
 */
@JsonPropertyOrder({"id", "class", "title", "controls"})
public record CategoryGroup(String id, String title, List<Control> controls) {

    @JsonProperty("class")
    public String groupClass() {
        return "category";
    }
}
