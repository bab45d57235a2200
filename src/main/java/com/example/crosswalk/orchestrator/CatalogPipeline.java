package com.example.crosswalk.orchestrator;

import com.example.crosswalk.config.CrosswalkProperties;
import com.example.crosswalk.model.*;
import com.example.crosswalk.service.CatalogBuilder;
import com.example.crosswalk.service.CatalogWriter;
import com.example.crosswalk.service.MissingInputException;
import com.example.crosswalk.service.SpreadsheetReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CSF workbook → OSCAL catalog JSON.
 * Pipeline:
 * 1. Worksheet reading
 * 2. Hierarchy reconstruction (CatalogBuilder)
 * 3. JSON output
 */
@Service
public class CatalogPipeline {

    private static final Logger log = LoggerFactory.getLogger(CatalogPipeline.class);

    private final CrosswalkProperties properties;
    private final SpreadsheetReader spreadsheetReader;
    private final CatalogBuilder catalogBuilder;
    private final CatalogWriter catalogWriter;

    public CatalogPipeline(CrosswalkProperties properties,
                           SpreadsheetReader spreadsheetReader,
                           CatalogBuilder catalogBuilder,
                           CatalogWriter catalogWriter) {
        this.properties = properties;
        this.spreadsheetReader = spreadsheetReader;
        this.catalogBuilder = catalogBuilder;
        this.catalogWriter = catalogWriter;
    }

    public CatalogBuildResult build(InputStream workbook) {
        CrosswalkProperties.CatalogTask task = properties.catalog();

        log.info("[1/2] Reading worksheet '{}'...", task.sheet());
        List<SheetRow> rows = spreadsheetReader.read(workbook, task.sheet(), task.headerRow(), task.headerRow() + 1);

        log.info("[2/2] Building catalog from {} rows...", rows.size());
        List<ControlRow> controlRows = toControlRows(rows, task.columns());
        CatalogOptions options = new CatalogOptions(task.title(), task.version(), task.oscalVersion(), task.groupIdStyle());
        CatalogBuildResult result = catalogBuilder.build(controlRows, options);

        if (result.droppedCount() > 0) {
            log.warn("[2/2] {} row(s) dropped, see warnings above", result.droppedCount());
        }
        return result;
    }

    /**
     * Batch entry point: reads the configured workbook and writes the configured catalog file.
     */
    public Path run() {
        CrosswalkProperties.CatalogTask task = properties.catalog();
        Path input = MissingInputException.requireFile(task.input(), "CSF workbook");

        log.info("═══════════════════════════════════════════════");
        log.info("Generating catalog '{}' from {}", task.title(), input);
        log.info("═══════════════════════════════════════════════");

        CatalogBuildResult result;
        try (InputStream in = Files.newInputStream(input)) {
            result = build(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to open " + input + ": " + e.getMessage(), e);
        }

        Path output = catalogWriter.write(result.catalog(), Path.of(task.output()));
        log.info("Catalog generation completed: {} controls → {}", result.catalog().controls().size(), output);
        return output;
    }

    static List<ControlRow> toControlRows(List<SheetRow> rows, CrosswalkProperties.CatalogColumns columns) {
        return rows.stream()
                .map(row -> new ControlRow(
                        row.rowNumber(),
                        row.cell(columns.function()),
                        row.cell(columns.category()),
                        row.cell(columns.subcategory()),
                        columns.examples() != null ? row.cell(columns.examples()) : null))
                .toList();
    }
}
