package com.example.crosswalk.service;

import com.example.crosswalk.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Assembles crosswalk mapping records from raw per-row mappings.
 * <p>
 * Steps:
 * <ol>
 *   <li>Withdrawn rows are left out; {@code withdrawn-error} rows are reported for manual review</li>
 *   <li>New and restored controls become source gaps</li>
 *   <li>Remaining rows with a target are canonicalized and grouped by source id; targets are
 *       deduplicated in first-seen order</li>
 *   <li>Target ids missing from the target catalog are kept but reported</li>
 *   <li>Source catalog controls with no mapping become source gaps, unless step 1 excluded them</li>
 *   <li>Optionally, target catalog controls referenced by no mapping become target gaps</li>
 * </ol>
 * Category-level ids (no trailing number) never take part in mappings.
 */
@Service
public class CrosswalkBuilder {

    private static final Logger log = LoggerFactory.getLogger(CrosswalkBuilder.class);

    /** Number of unmatched target ids listed in the log. */
    private static final int MAX_LOGGED_UNMATCHED = 10;

    private final ControlIdCanonicalizer canonicalizer;

    public CrosswalkBuilder(ControlIdCanonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    public CrosswalkResult build(CrosswalkRequest request) {
        log.info("CrosswalkBuilder: {} rows ({} → {})",
                request.rows().size(), request.sourceNotation(), request.targetNotation());

        Map<String, Group> groups = new LinkedHashMap<>();
        Set<String> gapIds = new LinkedHashSet<>();
        Set<String> excluded = new HashSet<>();
        List<String> reviewRequired = new ArrayList<>();
        int skipped = 0;

        for (CrosswalkRow row : request.rows()) {
            String sourceId = canonicalizer.canonicalize(row.sourceRaw(), request.sourceNotation());
            RelationshipKind kind = row.classification();

            if (sourceId.isEmpty()) {
                skipped++;
                continue;
            }
            if (kind != null && kind.isWithdrawal()) {
                if (kind == RelationshipKind.WITHDRAWN_ERROR) {
                    log.warn("CrosswalkBuilder: {} has an unexpected withdrawn combination, needs manual review",
                            sourceId);
                    reviewRequired.add(sourceId);
                }
                excluded.add(sourceId);
                skipped++;
                continue;
            }
            if (kind != null && kind.isSourceGap()) {
                gapIds.add(sourceId);
                continue;
            }

            String targetId = canonicalizer.canonicalize(row.targetRaw(), request.targetNotation());
            if (targetId.isEmpty()) {
                skipped++;
                continue;
            }
            if (!canonicalizer.isControlLevel(sourceId)) {
                log.debug("CrosswalkBuilder: skipping category-level source {}", sourceId);
                skipped++;
                continue;
            }

            Group group = groups.computeIfAbsent(sourceId, id -> new Group());
            group.targets.add(targetId);
            if (group.relationship == null) {
                group.relationship = kind;
            }
        }

        List<MappingRecord> mapped = groups.entrySet().stream()
                .map(e -> new MappingRecord(
                        e.getKey(),
                        List.copyOf(e.getValue().targets),
                        e.getValue().relationship != null ? e.getValue().relationship : request.defaultRelationship(),
                        request.confidence(),
                        ""))
                .toList();

        List<String> unmatched = validateTargets(mapped, request.targetCatalogIds());

        if (request.sourceCatalogIds() != null) {
            request.sourceCatalogIds().stream()
                    .filter(canonicalizer::isControlLevel)
                    .filter(id -> !groups.containsKey(id))
                    .filter(id -> !excluded.contains(id))
                    .forEach(gapIds::add);
        }
        List<MappingRecord> sourceGaps = gapIds.stream()
                .filter(id -> !groups.containsKey(id))
                .sorted()
                .map(MappingRecord::sourceGap)
                .toList();

        List<MappingRecord> targetGaps = request.includeTargetGaps()
                ? targetGaps(mapped, request.targetCatalogIds())
                : List.of();

        log.info("CrosswalkBuilder: {} mapped, {} source gaps, {} target gaps, {} unmatched targets, "
                        + "{} for review, {} rows skipped",
                mapped.size(), sourceGaps.size(), targetGaps.size(), unmatched.size(),
                reviewRequired.size(), skipped);

        return new CrosswalkResult(mapped, sourceGaps, targetGaps, unmatched, reviewRequired, skipped);
    }

    // ═══════════════════════════════════════════════════
    // Internal helpers
    // ═══════════════════════════════════════════════════

    private List<String> validateTargets(List<MappingRecord> mapped, Set<String> targetCatalogIds) {
        if (targetCatalogIds == null) {
            return List.of();
        }
        List<String> unmatched = mapped.stream()
                .flatMap(r -> r.targetIds().stream())
                .distinct()
                .filter(id -> !targetCatalogIds.contains(id))
                .toList();

        if (unmatched.isEmpty()) {
            log.info("CrosswalkBuilder: all target control ids validated against the target catalog");
            return unmatched;
        }

        log.warn("CrosswalkBuilder: {} target control id(s) not found in the target catalog; "
                + "they stay in the mapping but need review", unmatched.size());
        unmatched.stream()
                .sorted()
                .limit(MAX_LOGGED_UNMATCHED)
                .forEach(id -> log.warn("  - {}", id));
        if (unmatched.size() > MAX_LOGGED_UNMATCHED) {
            log.warn("  ... and {} more", unmatched.size() - MAX_LOGGED_UNMATCHED);
        }
        return unmatched;
    }

    private List<MappingRecord> targetGaps(List<MappingRecord> mapped, Set<String> targetCatalogIds) {
        if (targetCatalogIds == null) {
            log.warn("CrosswalkBuilder: target gaps requested without a target catalog, none reported");
            return List.of();
        }
        Set<String> referenced = new HashSet<>();
        mapped.forEach(r -> referenced.addAll(r.targetIds()));

        return targetCatalogIds.stream()
                .filter(canonicalizer::isControlLevel)
                .filter(id -> !referenced.contains(id))
                .sorted()
                .map(MappingRecord::targetGap)
                .toList();
    }

    /** Per-source accumulation of targets and the first classification seen. */
    private static final class Group {
        private final Set<String> targets = new LinkedHashSet<>();
        private RelationshipKind relationship;
    }
}
