package com.example.crosswalk.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A row of the OSCAL mapping CSV template consumed by {@code csv-to-oscal-mc}.
 */
@JsonPropertyOrder({
        "$$Source_Resource",
        "$$Target_Resource",
        "$$Map_Source_ID_Ref_list",
        "$$Map_Target_ID_Ref_list",
        "$$Map_Relationship",
        "$Map_Confidence_Score",
        "$Map_Coverage"
})
public record MappingCsvRow(
        @JsonProperty("$$Source_Resource") String sourceResource,
        @JsonProperty("$$Target_Resource") String targetResource,
        @JsonProperty("$$Map_Source_ID_Ref_list") String sourceIdList,
        @JsonProperty("$$Map_Target_ID_Ref_list") String targetIdList,
        @JsonProperty("$$Map_Relationship") String relationship,
        @JsonProperty("$Map_Confidence_Score") String confidenceScore,
        @JsonProperty("$Map_Coverage") String coverage
) {

    /** Metadata row placed right after the header; tooling reads it as column descriptions. */
    public static final MappingCsvRow DESCRIPTIONS = new MappingCsvRow(
            "A reference to a resource that has the source controls of a mapping.",
            "A reference to a resource that has the target controls of a mapping.",
            "A list of source reference IDs.",
            "A list of target reference IDs.",
            "The relationship type for the mapping entry.",
            "An estimation of the confidence that this mapping is correct and accurate expressed as percentage.",
            "An estimation of the percentage coverage of the targets by the sources."
    );

    public static MappingCsvRow from(MappingRecord record, MappingResources resources) {
        return new MappingCsvRow(
                resources.sourceResource(),
                resources.targetResource(),
                record.sourceId(),
                record.targetIdList(),
                record.relationshipLabel(),
                record.confidence(),
                record.coverage()
        );
    }
}
