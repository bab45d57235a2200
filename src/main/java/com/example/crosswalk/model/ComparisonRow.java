package com.example.crosswalk.model;

/**
 * One control of the revision comparison workbook.
 *
 * @param sourceId        control id in the current revision, e.g. {@code AC-2(1)}
 * @param title           control title
 * @param changedElements free-text list of changed elements, one per line
 * @param changeDetails   free-text change description
 * @param priorSortKey    prior revision sort key, e.g. {@code AC-02-01}; null for new controls
 */
public record ComparisonRow(
        String sourceId,
        String title,
        String changedElements,
        String changeDetails,
        String priorSortKey
) {}
