package com.example.crosswalk.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Relationship between a control in one framework revision and its counterpart in another.
 * <p>
 * The first six values are OSCAL set relationships. The withdrawal values describe the
 * control lifecycle across revisions and take precedence over substantive change analysis.
 */
public enum RelationshipKind {
    EQUAL_TO("equal-to", "No changes at all between the two revisions"),
    EQUIVALENT_TO("equivalent-to", "Cosmetic or discussion-only changes; same substance"),
    SUPERSET_OF("superset-of", "The source revision added requirements"),
    SUBSET_OF("subset-of", "The source revision removed requirements"),
    INTERSECTS_WITH("intersects-with", "Overlapping changes in both directions"),
    NO_RELATIONSHIP("no-relationship", "New control; no counterpart in the prior revision"),
    WITHDRAWN("withdrawn", "Withdrawn in both revisions"),
    WITHDRAWN_IN_SOURCE_ONLY("withdrawn-in-source-only", "Previously withdrawn in the prior revision, absent from the current one"),
    RESTORED_IN_TARGET("restored-in-target", "Withdrawn in the prior revision, restored in the current one"),
    WITHDRAWN_IN_TARGET_ONLY("withdrawn-in-target-only", "Active in the prior revision, withdrawn in the current one"),
    WITHDRAWN_ERROR("withdrawn-error", "Unexpected withdrawal combination; needs manual review");

    private final String label;
    private final String definition;

    RelationshipKind(String label, String definition) {
        this.label = label;
        this.definition = definition;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String definition() {
        return definition;
    }

    /** Withdrawal states never produce a mapping row. */
    public boolean isWithdrawal() {
        return this == WITHDRAWN || this == WITHDRAWN_IN_SOURCE_ONLY
                || this == WITHDRAWN_IN_TARGET_ONLY || this == WITHDRAWN_ERROR;
    }

    /** Controls that exist in the source revision without a counterpart in the target. */
    public boolean isSourceGap() {
        return this == NO_RELATIONSHIP || this == RESTORED_IN_TARGET;
    }

    public static Optional<RelationshipKind> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String normalized = label.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(kind -> kind.label.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
