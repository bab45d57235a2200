package com.example.crosswalk.model;

import java.util.List;

/**
 * One crosswalk entry. An empty target list marks a source gap, an empty source id a target gap;
 * gap records carry no relationship, confidence or coverage.
 *
 * @param sourceId     canonical source control id
 * @param targetIds    deduplicated canonical target ids, in first-seen order
 * @param relationship relationship, null for gaps
 * @param confidence   confidence score, e.g. {@code 100%}
 * @param coverage     coverage percentage, usually empty
 */
public record MappingRecord(
        String sourceId,
        List<String> targetIds,
        RelationshipKind relationship,
        String confidence,
        String coverage
) {
    public MappingRecord {
        targetIds = targetIds != null ? List.copyOf(targetIds) : List.of();
        if (sourceId == null) sourceId = "";
        if (confidence == null) confidence = "";
        if (coverage == null) coverage = "";
    }

    public static MappingRecord sourceGap(String sourceId) {
        return new MappingRecord(sourceId, List.of(), null, "", "");
    }

    public static MappingRecord targetGap(String targetId) {
        return new MappingRecord("", List.of(targetId), null, "", "");
    }

    public boolean isGap() {
        return sourceId.isEmpty() || targetIds.isEmpty();
    }

    /** Space-separated target list, as OSCAL mapping CSVs expect. */
    public String targetIdList() {
        return String.join(" ", targetIds);
    }

    public String relationshipLabel() {
        return relationship != null ? relationship.label() : "";
    }
}
