package com.example.crosswalk.model;

import java.util.List;

/**
 * Output of a catalog build: the tree plus the rows that were dropped along the way.
 */
public record CatalogBuildResult(Catalog catalog, List<DroppedRow> droppedRows) {

    public int droppedCount() {
        return droppedRows.size();
    }
}
