package com.example.crosswalk.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A prose part of a control.
 *
 * @param id    part id, {@code <controlId>_smt} or {@code <controlId>_eg}
 * @param name  part kind
 * @param prose part text
 */
@JsonPropertyOrder({"id", "name", "prose"})
public record ControlPart(String id, PartName name, String prose) {

    public enum PartName {
        STATEMENT("statement", "_smt"),
        EXAMPLE("example", "_eg");

        private final String label;
        private final String idSuffix;

        PartName(String label, String idSuffix) {
            this.label = label;
            this.idSuffix = idSuffix;
        }

        @JsonValue
        public String label() {
            return label;
        }

        public String idSuffix() {
            return idSuffix;
        }
    }

    public static ControlPart statement(String controlId, String prose) {
        return new ControlPart(controlId + PartName.STATEMENT.idSuffix(), PartName.STATEMENT, prose);
    }

    public static ControlPart example(String controlId, String prose) {
        return new ControlPart(controlId + PartName.EXAMPLE.idSuffix(), PartName.EXAMPLE, prose);
    }
}
