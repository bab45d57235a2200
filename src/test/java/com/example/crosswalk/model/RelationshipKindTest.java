package com.example.crosswalk.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class RelationshipKindTest {

    @Test
    void fromLabel_shouldResolveLabels_ignoringCaseAndWhitespace() {
        assertThat(RelationshipKind.fromLabel(" Superset-Of ")).contains(RelationshipKind.SUPERSET_OF);
        assertThat(RelationshipKind.fromLabel("restored-in-target")).contains(RelationshipKind.RESTORED_IN_TARGET);
        assertThat(RelationshipKind.fromLabel("superset")).isEmpty();
        assertThat(RelationshipKind.fromLabel(null)).isEmpty();
    }

    @Test
    void lifecycleFlags_shouldPartitionKinds() {
        assertThat(Arrays.stream(RelationshipKind.values()).filter(RelationshipKind::isWithdrawal))
                .containsExactlyInAnyOrder(RelationshipKind.WITHDRAWN, RelationshipKind.WITHDRAWN_IN_SOURCE_ONLY,
                        RelationshipKind.WITHDRAWN_IN_TARGET_ONLY, RelationshipKind.WITHDRAWN_ERROR);
        assertThat(Arrays.stream(RelationshipKind.values()).filter(RelationshipKind::isSourceGap))
                .containsExactlyInAnyOrder(RelationshipKind.NO_RELATIONSHIP, RelationshipKind.RESTORED_IN_TARGET);
    }

    @Test
    void mappingRecord_shouldRenderGapsWithEmptyColumns() {
        MappingRecord gap = MappingRecord.sourceGap("pm-32");

        assertThat(gap.isGap()).isTrue();
        assertThat(gap.targetIdList()).isEmpty();
        assertThat(gap.relationshipLabel()).isEmpty();
        assertThat(MappingCsvRow.from(gap, new MappingResources("a", "b")))
                .isEqualTo(new MappingCsvRow("a", "b", "pm-32", "", "", "", ""));
    }
}
