package com.example.crosswalk.controller;

import com.example.crosswalk.config.CrosswalkProperties;
import com.example.crosswalk.model.CatalogBuildResult;
import com.example.crosswalk.model.CrosswalkResult;
import com.example.crosswalk.model.RevisionComparisonResult;
import com.example.crosswalk.orchestrator.CatalogPipeline;
import com.example.crosswalk.orchestrator.FrameworkMappingPipeline;
import com.example.crosswalk.orchestrator.RevisionComparisonPipeline;
import com.example.crosswalk.service.CatalogWriter;
import com.example.crosswalk.service.MappingCsvWriter;
import com.example.crosswalk.service.MissingInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.InputStream;
import java.util.Map;

/**
 * REST controller for catalog and crosswalk generation from uploaded workbooks.
 */
@RestController
@RequestMapping("/api")
public class CrosswalkController {

    private static final Logger log = LoggerFactory.getLogger(CrosswalkController.class);

    static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");
    static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final CrosswalkProperties properties;
    private final CatalogPipeline catalogPipeline;
    private final FrameworkMappingPipeline frameworkMappingPipeline;
    private final RevisionComparisonPipeline revisionComparisonPipeline;
    private final CatalogWriter catalogWriter;
    private final MappingCsvWriter csvWriter;

    public CrosswalkController(CrosswalkProperties properties,
                               CatalogPipeline catalogPipeline,
                               FrameworkMappingPipeline frameworkMappingPipeline,
                               RevisionComparisonPipeline revisionComparisonPipeline,
                               CatalogWriter catalogWriter,
                               MappingCsvWriter csvWriter) {
        this.properties = properties;
        this.catalogPipeline = catalogPipeline;
        this.frameworkMappingPipeline = frameworkMappingPipeline;
        this.revisionComparisonPipeline = revisionComparisonPipeline;
        this.catalogWriter = catalogWriter;
        this.csvWriter = csvWriter;
    }

    /**
     * Builds an OSCAL catalog from a CSF workbook.
     *
     * <p>Endpoint: POST /api/catalog
     * <p>Content-Type: multipart/form-data
     * <p>Parameter: file (CSF 2.0 workbook)
     */
    @PostMapping(value = "/catalog", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> catalog(@RequestParam("file") MultipartFile file) {
        ResponseEntity<Map<String, String>> invalid = validate(file);
        if (invalid != null) {
            return invalid;
        }
        log.info("Received catalog request for '{}' ({} bytes)", file.getOriginalFilename(), file.getSize());

        try (InputStream in = file.getInputStream()) {
            CatalogBuildResult result = catalogPipeline.build(in);
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("X-Dropped-Rows", String.valueOf(result.droppedCount()))
                    .body(catalogWriter.toJson(result.catalog()));
        } catch (MissingInputException e) {
            return missingInput(file, e);
        } catch (Exception e) {
            return failure("Error during catalog generation", file, e);
        }
    }

    /**
     * Builds the CSF to SP 800-53 crosswalk CSV. Catalogs are taken from configuration.
     *
     * <p>Endpoint: POST /api/crosswalk/framework
     */
    @PostMapping(value = "/crosswalk/framework", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> frameworkCrosswalk(@RequestParam("file") MultipartFile file) {
        ResponseEntity<Map<String, String>> invalid = validate(file);
        if (invalid != null) {
            return invalid;
        }
        log.info("Received framework crosswalk request for '{}' ({} bytes)",
                file.getOriginalFilename(), file.getSize());

        try (InputStream in = file.getInputStream()) {
            CrosswalkResult result = frameworkMappingPipeline.build(in);
            return csv(result, csvWriter.toCsv(result, frameworkMappingPipeline.resources()), "csf-mapping.csv");
        } catch (MissingInputException e) {
            return missingInput(file, e);
        } catch (Exception e) {
            return failure("Error during crosswalk generation", file, e);
        }
    }

    /**
     * Builds the rev5 to rev4 crosswalk CSV from a revision comparison workbook.
     *
     * <p>Endpoint: POST /api/crosswalk/revision
     */
    @PostMapping(value = "/crosswalk/revision", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> revisionCrosswalk(@RequestParam("file") MultipartFile file) {
        ResponseEntity<Map<String, String>> invalid = validate(file);
        if (invalid != null) {
            return invalid;
        }
        log.info("Received revision crosswalk request for '{}' ({} bytes)",
                file.getOriginalFilename(), file.getSize());

        try {
            RevisionComparisonResult result = revisionComparisonPipeline.analyze(file.getBytes());
            CrosswalkResult crosswalk = result.crosswalk();
            return csv(crosswalk, csvWriter.toCsv(crosswalk, revisionComparisonPipeline.resources()),
                    "nist-mapping.csv");
        } catch (MissingInputException e) {
            return missingInput(file, e);
        } catch (Exception e) {
            return failure("Error during crosswalk generation", file, e);
        }
    }

    /**
     * Returns the comparison workbook with the colour-coded relationship column added.
     *
     * <p>Endpoint: POST /api/relationships
     */
    @PostMapping(value = "/relationships", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> relationships(@RequestParam("file") MultipartFile file) {
        ResponseEntity<Map<String, String>> invalid = validate(file);
        if (invalid != null) {
            return invalid;
        }
        log.info("Received relationship annotation request for '{}' ({} bytes)",
                file.getOriginalFilename(), file.getSize());

        try {
            byte[] workbook = file.getBytes();
            RevisionComparisonResult result = revisionComparisonPipeline.analyze(workbook);
            byte[] annotated = revisionComparisonPipeline.annotate(workbook, result);
            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"relationships.xlsx\"")
                    .header("X-Review-Required", String.valueOf(result.summary().reviewRequired()))
                    .contentType(XLSX)
                    .body(annotated);
        } catch (MissingInputException e) {
            return missingInput(file, e);
        } catch (Exception e) {
            return failure("Error during relationship annotation", file, e);
        }
    }

    /**
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "oscal-crosswalk"
        ));
    }

    // ═══════════════════════════════════════════════════
    // Internal helpers
    // ═══════════════════════════════════════════════════

    private ResponseEntity<Map<String, String>> validate(MultipartFile file) {
        if (file.isEmpty()) {
            return badRequest("Empty file. Please upload a valid XLSX workbook.");
        }
        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase().endsWith(".xlsx")) {
            return badRequest("Invalid format. Only XLSX workbooks accepted.");
        }
        long maxBytes = properties.upload().maxBytes();
        if (maxBytes > 0 && file.getSize() > maxBytes) {
            return badRequest("File too large. Maximum size: " + maxBytes / (1024 * 1024) + "MB.");
        }
        return null;
    }

    private ResponseEntity<String> csv(CrosswalkResult result, String body, String filename) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .header("X-Mapped-Count", String.valueOf(result.mapped().size()))
                .header("X-Source-Gap-Count", String.valueOf(result.sourceGaps().size()))
                .header("X-Unmatched-Target-Count", String.valueOf(result.unmatchedTargets().size()))
                .contentType(TEXT_CSV)
                .body(body);
    }

    private ResponseEntity<Map<String, String>> missingInput(MultipartFile file, MissingInputException e) {
        log.warn("Missing input while processing '{}': {}", file.getOriginalFilename(), e.getMessage());
        return ResponseEntity.badRequest()
                .body(Map.of("error", "Missing input", "message", e.getMessage()));
    }

    private ResponseEntity<Map<String, String>> failure(String error, MultipartFile file, Exception e) {
        log.error("{} for '{}'", error, file.getOriginalFilename(), e);
        return ResponseEntity.internalServerError()
                .body(Map.of(
                        "error", error,
                        "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
