package com.example.crosswalk.model;

import java.util.List;
import java.util.Map;

/**
 * Complete result of a revision comparison.
 *
 * @param classified    every comparison row with its relationship, in worksheet order
 * @param byRowIndex    relationship per 0-based worksheet row index, for the annotated workbook
 * @param crosswalk     the partitioned crosswalk
 * @param summary       statistics for the markdown summary
 */
public record RevisionComparisonResult(
        List<ClassifiedComparison> classified,
        Map<Integer, RelationshipKind> byRowIndex,
        CrosswalkResult crosswalk,
        ComparisonSummary summary
) {}
