package com.example.crosswalk.orchestrator;

import com.example.crosswalk.config.CrosswalkProperties;
import com.example.crosswalk.model.*;
import com.example.crosswalk.service.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * SP 800-53 revision comparison (rev5 → rev4).
 * Pipeline:
 * 1. Comparison worksheet reading
 * 2. Relationship classification (RelationshipClassifier)
 * 3. Crosswalk assembly (CrosswalkBuilder)
 * 4. Summary statistics
 * In batch mode the annotated workbook, the markdown summary and the CSV are then written.
 */
@Service
public class RevisionComparisonPipeline {

    private static final Logger log = LoggerFactory.getLogger(RevisionComparisonPipeline.class);

    private final CrosswalkProperties properties;
    private final SpreadsheetReader spreadsheetReader;
    private final RelationshipClassifier classifier;
    private final CatalogIdLoader catalogIdLoader;
    private final CrosswalkBuilder crosswalkBuilder;
    private final RelationshipWorkbookWriter workbookWriter;
    private final ComparisonSummaryWriter summaryWriter;
    private final MappingCsvWriter csvWriter;

    public RevisionComparisonPipeline(CrosswalkProperties properties,
                                      SpreadsheetReader spreadsheetReader,
                                      RelationshipClassifier classifier,
                                      CatalogIdLoader catalogIdLoader,
                                      CrosswalkBuilder crosswalkBuilder,
                                      RelationshipWorkbookWriter workbookWriter,
                                      ComparisonSummaryWriter summaryWriter,
                                      MappingCsvWriter csvWriter) {
        this.properties = properties;
        this.spreadsheetReader = spreadsheetReader;
        this.classifier = classifier;
        this.catalogIdLoader = catalogIdLoader;
        this.crosswalkBuilder = crosswalkBuilder;
        this.workbookWriter = workbookWriter;
        this.summaryWriter = summaryWriter;
        this.csvWriter = csvWriter;
    }

    public RevisionComparisonResult analyze(byte[] workbook) {
        CrosswalkProperties.RevisionComparison task = properties.revisionComparison();

        // ── Step 1: Worksheet reading ──
        log.info("[1/4] Reading worksheet '{}'...", task.sheet());
        // Rows without a control id are still classified and annotated; the crosswalk skips them
        List<SheetRow> rows = spreadsheetReader.read(new ByteArrayInputStream(workbook),
                task.sheet(), 0, task.firstDataRow());

        // ── Step 2: Classification ──
        log.info("[2/4] Classifying {} controls...", rows.size());
        List<ComparisonRow> comparisonRows = rows.stream()
                .map(row -> toComparisonRow(row, task.columns()))
                .toList();
        List<ClassifiedComparison> classified = classifier.classifyAll(comparisonRows);

        Map<Integer, RelationshipKind> byRowIndex = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            byRowIndex.put(rows.get(i).rowIndex(), classified.get(i).relationship());
        }

        Map<RelationshipKind, Long> distribution = classifier.distribution(classified);
        log.info("[2/4] Relationship distribution:");
        distribution.forEach((kind, count) -> log.info("  {} {}", kind.label(), count));

        // ── Step 3: Crosswalk ──
        log.info("[3/4] Assembling crosswalk...");
        CrosswalkResult crosswalk = crosswalkBuilder.build(new CrosswalkRequest(
                classified.stream().map(ClassifiedComparison::toCrosswalkRow).toList(),
                NotationKind.DASH_ENHANCEMENT,
                NotationKind.TRIPLE_SEGMENT,
                optionalCatalog(task.targetCatalog()),
                optionalCatalog(task.sourceCatalog()),
                null,
                task.confidence(),
                false
        ));

        // ── Step 4: Summary ──
        ComparisonSummary summary = new ComparisonSummary(
                task.summaryTitle(),
                classified.size(),
                distribution,
                crosswalk.mapped().size(),
                crosswalk.sourceGaps().size(),
                count(distribution, RelationshipKind.NO_RELATIONSHIP),
                count(distribution, RelationshipKind.RESTORED_IN_TARGET),
                count(distribution, RelationshipKind.WITHDRAWN)
                        + count(distribution, RelationshipKind.WITHDRAWN_IN_SOURCE_ONLY)
                        + count(distribution, RelationshipKind.WITHDRAWN_IN_TARGET_ONLY),
                crosswalk.reviewRequired().size()
        );
        log.info("[4/4] {} mapped, {} source gaps, {} excluded as withdrawn, {} for manual review",
                summary.mapped(), summary.sourceGaps(), summary.excluded(), summary.reviewRequired());

        return new RevisionComparisonResult(classified, byRowIndex, crosswalk, summary);
    }

    /**
     * Copy of the original workbook with the colour-coded relationship column added.
     */
    public byte[] annotate(byte[] workbook, RevisionComparisonResult result) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        annotate(workbook, result, out);
        return out.toByteArray();
    }

    public MappingResources resources() {
        CrosswalkProperties.RevisionComparison task = properties.revisionComparison();
        return new MappingResources(task.sourceResource(), task.targetResource());
    }

    /**
     * Batch entry point: writes the annotated workbook, the summary and the crosswalk CSV.
     */
    public Path run() {
        CrosswalkProperties.RevisionComparison task = properties.revisionComparison();
        Path input = MissingInputException.requireFile(task.input(), "comparison workbook");

        log.info("═══════════════════════════════════════════════");
        log.info("Starting revision comparison for {}", input);
        log.info("═══════════════════════════════════════════════");

        byte[] workbook;
        try {
            workbook = Files.readAllBytes(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + input + ": " + e.getMessage(), e);
        }

        RevisionComparisonResult result = analyze(workbook);

        Path relationshipsOutput = Path.of(task.relationshipsOutput());
        try {
            if (relationshipsOutput.getParent() != null) {
                Files.createDirectories(relationshipsOutput.getParent());
            }
            try (OutputStream out = Files.newOutputStream(relationshipsOutput)) {
                annotate(workbook, result, out);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + relationshipsOutput + ": " + e.getMessage(), e);
        }

        Path summaryOutput = summaryWriter.write(result.summary(), Path.of(task.summaryOutput()));
        Path csvOutput = csvWriter.write(result.crosswalk(), resources(), Path.of(task.output()));

        log.info("═══════════════════════════════════════════════");
        log.info("Revision comparison completed: {} mapped, {} source gaps, {} total rows",
                result.summary().mapped(), result.summary().sourceGaps(), result.summary().csvRows());
        log.info("Generated files: {}, {}, {}", relationshipsOutput, summaryOutput, csvOutput);
        log.info("═══════════════════════════════════════════════");
        return csvOutput;
    }

    // ═══════════════════════════════════════════════════
    // Internal helpers
    // ═══════════════════════════════════════════════════

    private void annotate(byte[] workbook, RevisionComparisonResult result, OutputStream out) {
        CrosswalkProperties.RevisionComparison task = properties.revisionComparison();
        workbookWriter.annotate(new ByteArrayInputStream(workbook), task.sheet(), result.byRowIndex(),
                task.columnHeader(), task.columnSubHeader(), out);
    }

    private Set<String> optionalCatalog(String path) {
        return path == null || path.isBlank() ? null : catalogIdLoader.load(path);
    }

    private static ComparisonRow toComparisonRow(SheetRow row, CrosswalkProperties.ComparisonColumns columns) {
        return new ComparisonRow(
                row.cell(columns.sourceId()),
                row.cell(columns.title()),
                row.cell(columns.changedElements()),
                row.cell(columns.changeDetails()),
                row.cell(columns.sortAs())
        );
    }

    private static long count(Map<RelationshipKind, Long> distribution, RelationshipKind kind) {
        return distribution.getOrDefault(kind, 0L);
    }
}
