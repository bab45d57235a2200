package com.example.crosswalk.orchestrator;

import com.example.crosswalk.config.CrosswalkProperties;
import com.example.crosswalk.model.*;
import com.example.crosswalk.service.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Concept crosswalk between two frameworks (CSF 2.0 → SP 800-53 rev5).
 * Pipeline:
 * 1. Catalog id loading (target for validation, source for gap detection)
 * 2. Relationship worksheet reading
 * 3. Crosswalk assembly (CrosswalkBuilder)
 * 4. CSV output
 */
@Service
public class FrameworkMappingPipeline {

    private static final Logger log = LoggerFactory.getLogger(FrameworkMappingPipeline.class);

    private final CrosswalkProperties properties;
    private final SpreadsheetReader spreadsheetReader;
    private final CatalogIdLoader catalogIdLoader;
    private final CrosswalkBuilder crosswalkBuilder;
    private final MappingCsvWriter csvWriter;

    public FrameworkMappingPipeline(CrosswalkProperties properties,
                                    SpreadsheetReader spreadsheetReader,
                                    CatalogIdLoader catalogIdLoader,
                                    CrosswalkBuilder crosswalkBuilder,
                                    MappingCsvWriter csvWriter) {
        this.properties = properties;
        this.spreadsheetReader = spreadsheetReader;
        this.catalogIdLoader = catalogIdLoader;
        this.crosswalkBuilder = crosswalkBuilder;
        this.csvWriter = csvWriter;
    }

    public CrosswalkResult build(InputStream workbook) {
        CrosswalkProperties.FrameworkMapping task = properties.frameworkMapping();

        log.info("[1/3] Loading catalog ids...");
        Set<String> targetIds = catalogIdLoader.load(task.targetCatalog());
        Set<String> sourceIds = catalogIdLoader.load(task.sourceCatalog());

        log.info("[2/3] Reading worksheet '{}'...", task.sheet());
        List<SheetRow> rows = spreadsheetReader.read(workbook, task.sheet(), task.headerRow(), task.headerRow() + 1);
        List<CrosswalkRow> crosswalkRows = rows.stream()
                .map(row -> CrosswalkRow.unclassified(row.cell(task.sourceColumn()), row.cell(task.targetColumn())))
                .toList();

        log.info("[3/3] Assembling crosswalk from {} rows...", crosswalkRows.size());
        RelationshipKind relationship = RelationshipKind.fromLabel(task.defaultRelationship())
                .orElseThrow(() -> new IllegalStateException(
                        "Unknown default relationship: " + task.defaultRelationship()));

        return crosswalkBuilder.build(new CrosswalkRequest(
                crosswalkRows,
                NotationKind.DOTTED_HIERARCHY,
                NotationKind.DASH_ENHANCEMENT,
                targetIds,
                sourceIds,
                relationship,
                task.confidence(),
                task.includeTargetGaps()
        ));
    }

    public MappingResources resources() {
        CrosswalkProperties.FrameworkMapping task = properties.frameworkMapping();
        return new MappingResources(task.sourceResource(), task.targetResource());
    }

    /**
     * Batch entry point: reads the configured workbook and writes the configured CSV.
     */
    public Path run() {
        CrosswalkProperties.FrameworkMapping task = properties.frameworkMapping();
        Path input = MissingInputException.requireFile(task.input(), "crosswalk workbook");

        log.info("═══════════════════════════════════════════════");
        log.info("Generating framework crosswalk from {}", input);
        log.info("═══════════════════════════════════════════════");

        CrosswalkResult result;
        try (InputStream in = Files.newInputStream(input)) {
            result = build(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to open " + input + ": " + e.getMessage(), e);
        }

        Path output = csvWriter.write(result, resources(), Path.of(task.output()));
        log.info("Framework crosswalk completed: {} mapped, {} unmapped source controls, {} rows → {}",
                result.mapped().size(), result.sourceGaps().size(), result.allRecords().size(), output);
        return output;
    }
}
