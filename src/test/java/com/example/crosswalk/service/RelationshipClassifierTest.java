package com.example.crosswalk.service;

import com.example.crosswalk.model.ClassifiedComparison;
import com.example.crosswalk.model.ClassifierPhrases;
import com.example.crosswalk.model.ComparisonRow;
import com.example.crosswalk.model.RelationshipKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RelationshipClassifierTest {

    private final RelationshipClassifier classifier =
            new RelationshipClassifier(ClassifierPhrases.forRevisions("rev4", "rev5"));

    // --- lifecycle rules ---

    @Test
    void classify_shouldPreferRestored_overWithdrawnInTarget() {
        // Arrange
        RelationshipClassifier generic =
                new RelationshipClassifier(ClassifierPhrases.forRevisions("source", "target"));

        // Act
        RelationshipKind kind = generic.classify("withdrawn", "Withdrawn in source; restored in target");

        // Assert
        assertThat(kind).isEqualTo(RelationshipKind.RESTORED_IN_TARGET);
    }

    @Test
    void classify_shouldReturnWithdrawnInSourceOnly_whenPreviouslyWithdrawn() {
        assertThat(classifier.classify("withdrawn", "Previously withdrawn in Rev4"))
                .isEqualTo(RelationshipKind.WITHDRAWN_IN_SOURCE_ONLY);
    }

    @Test
    void classify_shouldReturnWithdrawn_whenWithdrawnInBoth() {
        assertThat(classifier.classify("Withdrawn", "Withdrawn in Rev4: incorporated into AC-2"))
                .isEqualTo(RelationshipKind.WITHDRAWN);
    }

    @Test
    void classify_shouldReturnWithdrawnInTargetOnly_whenOnlyMarkerPresent() {
        assertThat(classifier.classify("Withdrawn", "Incorporated into SI-4"))
                .isEqualTo(RelationshipKind.WITHDRAWN_IN_TARGET_ONLY);
    }

    @Test
    void classify_shouldFlagError_whenWithdrawnInSourceButStillActive() {
        assertThat(classifier.classify("Adds control text", "Withdrawn in Rev4"))
                .isEqualTo(RelationshipKind.WITHDRAWN_ERROR);
    }

    // --- substantive rules ---

    @Test
    void classify_shouldReturnNoRelationship_whenNewControl() {
        assertThat(classifier.classify("New base control", null)).isEqualTo(RelationshipKind.NO_RELATIONSHIP);
        assertThat(classifier.classify("New control enhancement", "")).isEqualTo(RelationshipKind.NO_RELATIONSHIP);
    }

    @Test
    void classify_shouldReturnEqualTo_whenNoChangeMarker() {
        assertThat(classifier.classify("N", null)).isEqualTo(RelationshipKind.EQUAL_TO);
        assertThat(classifier.classify("  n ", null)).isEqualTo(RelationshipKind.EQUAL_TO);
    }

    @Test
    void classify_shouldReturnEquivalentTo_whenOnlyNeutralLines() {
        assertThat(classifier.classify("Changes discussion\nChanges title", null))
                .isEqualTo(RelationshipKind.EQUIVALENT_TO);
        assertThat(classifier.classify("Adds discussion\r\nAdds to", null))
                .isEqualTo(RelationshipKind.EQUIVALENT_TO);
        assertThat(classifier.classify(null, null)).isEqualTo(RelationshipKind.EQUIVALENT_TO);
    }

    @Test
    void classify_shouldApplyDefaults_forAddsAndRemoves() {
        assertThat(classifier.classify("Adds control text", null)).isEqualTo(RelationshipKind.SUPERSET_OF);
        assertThat(classifier.classify("Removes parameter", null)).isEqualTo(RelationshipKind.SUBSET_OF);
        assertThat(classifier.classify("Adds control text\nRemoves parameter", null))
                .isEqualTo(RelationshipKind.INTERSECTS_WITH);
    }

    @Test
    void classify_shouldReturnIntersects_whenControlTextChanges() {
        assertThat(classifier.classify("Changes control text\nAdds parameter", null))
                .isEqualTo(RelationshipKind.INTERSECTS_WITH);
    }

    @Test
    void classify_shouldIgnoreNeutralLines_whenMixedWithAdds() {
        assertThat(classifier.classify("Changes discussion\nAdds parameter\nChanges title", null))
                .isEqualTo(RelationshipKind.SUPERSET_OF);
    }

    @Test
    void classify_shouldFallBackToIntersects_whenAmbiguous() {
        assertThat(classifier.classify("Restructures control", null)).isEqualTo(RelationshipKind.INTERSECTS_WITH);
    }

    @Test
    void classify_shouldNotTreatWordsStartingWithN_asNoChangeMarker() {
        // "n" is a neutral line only on its own or followed by punctuation
        assertThat(classifier.classify("n\nnotes added to control", null))
                .isEqualTo(RelationshipKind.INTERSECTS_WITH);
        assertThat(classifier.classify("n\nadds parameter", null))
                .isEqualTo(RelationshipKind.SUPERSET_OF);
    }

    @Test
    void classify_shouldTreatLine_asSubstantive_whenNeutralPhraseRunsIntoLongerWord() {
        assertThat(classifier.classify("Changes titles", null)).isEqualTo(RelationshipKind.INTERSECTS_WITH);
        assertThat(classifier.classify("No change to control text", null))
                .isEqualTo(RelationshipKind.INTERSECTS_WITH);
        assertThat(classifier.classify("Changes title: minor wording", null))
                .isEqualTo(RelationshipKind.EQUIVALENT_TO);
    }

    // --- batch helpers ---

    @Test
    void distribution_shouldCountPerRelationship() {
        // Arrange
        List<ComparisonRow> rows = List.of(
                new ComparisonRow("AC-1", "Policy", "N", null, "AC-01-00"),
                new ComparisonRow("AC-2", "Account Management", "Adds control text", null, "AC-02-00"),
                new ComparisonRow("AC-3", "Access Enforcement", "n", null, "AC-03-00"),
                new ComparisonRow("AC-2(11)", "Usage Conditions", "Withdrawn", "Withdrawn in Rev4", "AC-02-11")
        );

        // Act
        List<ClassifiedComparison> classified = classifier.classifyAll(rows);
        Map<RelationshipKind, Long> distribution = classifier.distribution(classified);

        // Assert
        assertThat(classified).extracting(ClassifiedComparison::relationship).containsExactly(
                RelationshipKind.EQUAL_TO, RelationshipKind.SUPERSET_OF,
                RelationshipKind.EQUAL_TO, RelationshipKind.WITHDRAWN);
        assertThat(distribution)
                .containsEntry(RelationshipKind.EQUAL_TO, 2L)
                .containsEntry(RelationshipKind.SUPERSET_OF, 1L)
                .containsEntry(RelationshipKind.WITHDRAWN, 1L)
                .hasSize(3);
        assertThat(distribution.keySet()).extracting(RelationshipKind::label)
                .containsExactly("equal-to", "superset-of", "withdrawn");
    }

    @Test
    void rules_shouldBeOrderedWithLifecycleFirstAndCatchAllLast() {
        List<RelationshipClassifier.ClassificationRule> rules = classifier.rules();

        assertThat(rules.get(0).result()).isEqualTo(RelationshipKind.RESTORED_IN_TARGET);
        assertThat(rules.get(rules.size() - 1).name()).isEqualTo("ambiguous");
        assertThat(rules).hasSize(13);
    }

    @Test
    void classify_shouldUseConfiguredPhrases() {
        // Arrange
        ClassifierPhrases custom = new ClassifierPhrases(
                "retired in v1", "previously retired in v1", "reinstated in v2",
                "retired", "unchanged",
                List.of("Extends"), List.of("Narrows"), List.of("Rewrites"),
                List.of("editorial"), List.of("Brand new"));
        RelationshipClassifier configured = new RelationshipClassifier(custom);

        // Act / Assert
        assertThat(configured.classify("Unchanged", null)).isEqualTo(RelationshipKind.EQUAL_TO);
        assertThat(configured.classify("Extends scope", null)).isEqualTo(RelationshipKind.SUPERSET_OF);
        assertThat(configured.classify("Editorial", null)).isEqualTo(RelationshipKind.EQUIVALENT_TO);
        assertThat(configured.classify("Retired", "Retired in v1")).isEqualTo(RelationshipKind.WITHDRAWN);
        assertThat(configured.classify("brand new control", null)).isEqualTo(RelationshipKind.NO_RELATIONSHIP);
    }
}
