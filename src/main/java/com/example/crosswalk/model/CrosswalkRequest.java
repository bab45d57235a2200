package com.example.crosswalk.model;

import java.util.List;
import java.util.Set;

/**
 * Everything the crosswalk builder needs for one source/target framework pair.
 *
 * @param rows                raw mapping rows in worksheet order
 * @param sourceNotation      notation of the source ids
 * @param targetNotation      notation of the target ids
 * @param targetCatalogIds    ids known to the target catalog; null skips target validation
 * @param sourceCatalogIds    ids known to the source catalog; null skips catalog-based source gaps
 * @param defaultRelationship relationship for groups without a classification
 * @param confidence          confidence score written on mapped records
 * @param includeTargetGaps   whether unreferenced target controls are reported as target gaps
 */
public record CrosswalkRequest(
        List<CrosswalkRow> rows,
        NotationKind sourceNotation,
        NotationKind targetNotation,
        Set<String> targetCatalogIds,
        Set<String> sourceCatalogIds,
        RelationshipKind defaultRelationship,
        String confidence,
        boolean includeTargetGaps
) {
    public CrosswalkRequest {
        rows = List.copyOf(rows);
        if (defaultRelationship == null) defaultRelationship = RelationshipKind.SUPERSET_OF;
        if (confidence == null) confidence = "100%";
    }
}
