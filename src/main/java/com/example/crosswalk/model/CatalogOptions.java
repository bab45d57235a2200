package com.example.crosswalk.model;

/**
 * Catalog-level settings for a build.
 *
 * @param title        catalog title
 * @param version      framework version
 * @param oscalVersion OSCAL version written in the metadata
 * @param groupIdStyle id style for functions and categories; controls always use {@code DOTTED_HIERARCHY}
 */
public record CatalogOptions(String title, String version, String oscalVersion, NotationKind groupIdStyle) {

    public CatalogOptions {
        if (groupIdStyle == null) groupIdStyle = NotationKind.DOTTED_HIERARCHY;
        if (groupIdStyle != NotationKind.DOTTED_HIERARCHY && groupIdStyle != NotationKind.TITLE_SLUG) {
            throw new IllegalArgumentException("Unsupported group id style: " + groupIdStyle);
        }
    }
}
