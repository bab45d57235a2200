package com.example.crosswalk.service;

import com.example.crosswalk.model.CrosswalkResult;
import com.example.crosswalk.model.MappingCsvRow;
import com.example.crosswalk.model.MappingResources;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a crosswalk in the OSCAL mapping CSV template: header row, column description row,
 * mapped records, then gap records.
 */
@Service
public class MappingCsvWriter {

    private static final Logger log = LoggerFactory.getLogger(MappingCsvWriter.class);

    private final CsvMapper csvMapper;
    private final CsvSchema schema;

    public MappingCsvWriter(CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
        this.schema = csvMapper.schemaFor(MappingCsvRow.class).withHeader();
    }

    public List<MappingCsvRow> rows(CrosswalkResult result, MappingResources resources) {
        List<MappingCsvRow> rows = new ArrayList<>(result.allRecords().size() + 1);
        rows.add(MappingCsvRow.DESCRIPTIONS);
        result.allRecords().forEach(r -> rows.add(MappingCsvRow.from(r, resources)));
        return rows;
    }

    public String toCsv(CrosswalkResult result, MappingResources resources) {
        StringWriter out = new StringWriter();
        write(result, resources, out);
        return out.toString();
    }

    public Path write(CrosswalkResult result, MappingResources resources, Path output) {
        try {
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            try (Writer out = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                write(result, resources, out);
            }
            log.info("Crosswalk CSV written to {} ({} mapped, {} source gaps, {} target gaps)",
                    output, result.mapped().size(), result.sourceGaps().size(), result.targetGaps().size());
            return output;
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing crosswalk %s: %s".formatted(output, e.getMessage()), e);
        }
    }

    private void write(CrosswalkResult result, MappingResources resources, Writer out) {
        try {
            csvMapper.writer(schema)
                    .with(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                    .writeValue(out, rows(result, resources));
        } catch (IOException e) {
            throw new UncheckedIOException("Error serializing crosswalk: " + e.getMessage(), e);
        }
    }
}
