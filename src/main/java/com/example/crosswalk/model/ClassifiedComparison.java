package com.example.crosswalk.model;

/**
 * A comparison row together with its classification.
 */
public record ClassifiedComparison(ComparisonRow row, RelationshipKind relationship) {

    public CrosswalkRow toCrosswalkRow() {
        return new CrosswalkRow(row.sourceId(), row.priorSortKey(), relationship);
    }
}
