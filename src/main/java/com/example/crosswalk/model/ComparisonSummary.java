package com.example.crosswalk.model;

import java.util.Map;

/**
 * Statistics of a revision comparison run, rendered into the markdown summary.
 *
 * @param title          document title
 * @param totalRows      number of classified rows
 * @param distribution   row count per relationship, in label order
 * @param mapped         mapping records written to the CSV
 * @param sourceGaps     source gap records written to the CSV
 * @param newControls    rows classified {@code no-relationship}
 * @param restored       rows classified {@code restored-in-target}
 * @param excluded       withdrawn rows left out of the CSV
 * @param reviewRequired rows classified {@code withdrawn-error}
 */
public record ComparisonSummary(
        String title,
        int totalRows,
        Map<RelationshipKind, Long> distribution,
        int mapped,
        int sourceGaps,
        long newControls,
        long restored,
        long excluded,
        int reviewRequired
) {
    public int csvRows() {
        return mapped + sourceGaps;
    }
}
