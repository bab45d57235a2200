package com.example.crosswalk.model;

import java.util.List;
import java.util.stream.Stream;

/**
 * Partitioned crosswalk output plus its validation side channel.
 *
 * @param mapped           one record per source control with at least one target
 * @param sourceGaps       source controls with no counterpart, sorted by id
 * @param targetGaps       target controls referenced by no mapping (only when requested)
 * @param unmatchedTargets target ids absent from the target catalog; still present in {@code mapped}
 * @param reviewRequired   source ids classified {@code withdrawn-error}
 * @param skippedRows      rows skipped as withdrawn, target-less, category-level or without a source id
 */
public record CrosswalkResult(
        List<MappingRecord> mapped,
        List<MappingRecord> sourceGaps,
        List<MappingRecord> targetGaps,
        List<String> unmatchedTargets,
        List<String> reviewRequired,
        int skippedRows
) {
    public CrosswalkResult {
        mapped = List.copyOf(mapped);
        sourceGaps = List.copyOf(sourceGaps);
        targetGaps = List.copyOf(targetGaps);
        unmatchedTargets = List.copyOf(unmatchedTargets);
        reviewRequired = List.copyOf(reviewRequired);
    }

    /** Mapped records first, then source gaps, then target gaps. */
    public List<MappingRecord> allRecords() {
        return Stream.of(mapped, sourceGaps, targetGaps)
                .flatMap(List::stream)
                .toList();
    }
}
