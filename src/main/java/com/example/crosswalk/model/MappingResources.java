package com.example.crosswalk.model;

/**
 * References to the source and target catalogs of a mapping, written on every CSV row.
 */
public record MappingResources(String sourceResource, String targetResource) {
}
