package com.example.crosswalk.service;

import com.example.crosswalk.model.ComparisonSummary;
import com.example.crosswalk.model.RelationshipKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the markdown summary of a revision comparison: relationship distribution,
 * CSV mapping statistics and relationship definitions.
 */
@Service
public class ComparisonSummaryWriter {

    private static final Logger log = LoggerFactory.getLogger(ComparisonSummaryWriter.class);

    public String render(ComparisonSummary summary) {
        List<String> lines = new ArrayList<>(List.of(
                "# " + summary.title(),
                "",
                "## Overview",
                "",
                "Total controls analyzed: **%d**".formatted(summary.totalRows()),
                "",
                "## OSCAL Relationship Distribution",
                "",
                "| Relationship | Count | Percentage |",
                "|--------------|-------|------------|"
        ));

        for (Map.Entry<RelationshipKind, Long> entry : summary.distribution().entrySet()) {
            double pct = summary.totalRows() > 0 ? entry.getValue() * 100.0 / summary.totalRows() : 0.0;
            lines.add(String.format(Locale.ROOT, "| %s | %d | %.1f%% |", entry.getKey().label(), entry.getValue(), pct));
        }

        lines.addAll(List.of(
                "",
                "## CSV Mapping Statistics",
                "",
                "- **Mapped controls**: %d (controls with an active relationship)".formatted(summary.mapped()),
                "- **Source gaps**: %d (new or restored controls)".formatted(summary.sourceGaps()),
                "  - New controls (no-relationship): %d".formatted(summary.newControls()),
                "  - Restored controls (restored-in-target): %d".formatted(summary.restored()),
                "- **Excluded**: %d (withdrawn controls, not in the CSV)".formatted(summary.excluded()),
                "- **Manual review**: %d (withdrawn-error)".formatted(summary.reviewRequired()),
                "- **Total CSV rows**: %d".formatted(summary.csvRows()),
                "",
                "## Relationship Definitions",
                ""
        ));
        for (RelationshipKind kind : RelationshipKind.values()) {
            lines.add("- **%s**: %s".formatted(kind.label(), kind.definition()));
        }
        lines.addAll(List.of(
                "",
                "## Notes",
                "",
                "- Controls classified **restored-in-target** are written to the CSV as source gaps",
                "- Withdrawn controls are excluded from the CSV",
                ""
        ));
        return String.join("\n", lines);
    }

    public Path write(ComparisonSummary summary, Path output) {
        try {
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            Files.writeString(output, render(summary), StandardCharsets.UTF_8);
            log.info("Comparison summary written to {}", output);
            return output;
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing summary %s: %s".formatted(output, e.getMessage()), e);
        }
    }
}
