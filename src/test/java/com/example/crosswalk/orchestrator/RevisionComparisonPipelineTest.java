package com.example.crosswalk.orchestrator;

import com.example.crosswalk.TestWorkbooks;
import com.example.crosswalk.config.CrosswalkProperties;
import com.example.crosswalk.model.*;
import com.example.crosswalk.service.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RevisionComparisonPipelineTest {

    @TempDir
    Path tempDir;

    private RevisionComparisonPipeline pipeline(String input, String targetCatalog) {
        CrosswalkProperties.RevisionComparison task = new CrosswalkProperties.RevisionComparison(
                input,
                TestWorkbooks.COMPARISON_SHEET,
                2,
                new CrosswalkProperties.ComparisonColumns(0, 1, 7, 8, 9),
                "",
                targetCatalog,
                "catalogs/NIST_SP-800-53_rev5/catalog.json",
                "catalogs/NIST_SP-800-53_rev4/catalog.json",
                tempDir.resolve("content/crosswalk.csv").toString(),
                tempDir.resolve("data/relationships.xlsx").toString(),
                tempDir.resolve("data/summary.md").toString(),
                "NIST SP 800-53 Rev 5 to Rev 4 Comparison Summary",
                "100%",
                "OSCAL Relationship\n(Rev5 → Rev4)",
                "OSCAL Mapping (Rev5→Rev4)");
        CrosswalkProperties properties = new CrosswalkProperties(null, null, task, null, null, null);
        ControlIdCanonicalizer canonicalizer = new ControlIdCanonicalizer();
        return new RevisionComparisonPipeline(
                properties,
                new SpreadsheetReader(),
                new RelationshipClassifier(ClassifierPhrases.forRevisions("rev4", "rev5")),
                new CatalogIdLoader(new ObjectMapper()),
                new CrosswalkBuilder(canonicalizer),
                new RelationshipWorkbookWriter(),
                new ComparisonSummaryWriter(),
                new MappingCsvWriter(new CsvMapper()));
    }

    @Test
    void analyze_shouldClassifyRowsAndPartitionCrosswalk() {
        // Act
        RevisionComparisonResult result = pipeline("", "").analyze(TestWorkbooks.revisionComparison());

        // Assert
        assertThat(result.classified()).extracting(ClassifiedComparison::relationship).containsExactly(
                RelationshipKind.EQUAL_TO,
                RelationshipKind.SUPERSET_OF,
                RelationshipKind.WITHDRAWN,
                RelationshipKind.WITHDRAWN_ERROR,
                RelationshipKind.NO_RELATIONSHIP,
                RelationshipKind.RESTORED_IN_TARGET);
        assertThat(result.byRowIndex()).containsKeys(2, 3, 4, 5, 6, 7).hasSize(6);

        CrosswalkResult crosswalk = result.crosswalk();
        assertThat(crosswalk.mapped()).extracting(MappingRecord::sourceId).containsExactly("ac-1", "ac-2.1");
        assertThat(crosswalk.mapped()).extracting(MappingRecord::targetIdList).containsExactly("ac-1", "ac-2.1");
        assertThat(crosswalk.sourceGaps()).extracting(MappingRecord::sourceId).containsExactly("pm-32", "sc-7.14");
        assertThat(crosswalk.reviewRequired()).containsExactly("ac-13");

        ComparisonSummary summary = result.summary();
        assertThat(summary.totalRows()).isEqualTo(6);
        assertThat(summary.mapped()).isEqualTo(2);
        assertThat(summary.sourceGaps()).isEqualTo(2);
        assertThat(summary.newControls()).isEqualTo(1);
        assertThat(summary.restored()).isEqualTo(1);
        assertThat(summary.excluded()).isEqualTo(1);
        assertThat(summary.reviewRequired()).isEqualTo(1);
    }

    @Test
    void analyze_shouldAnnotateRowsWithoutControlId_butLeaveThemOutOfCrosswalk() {
        // Arrange
        byte[] workbook = TestWorkbooks.workbook(TestWorkbooks.COMPARISON_SHEET, List.of(
                Arrays.asList("Control ID", "Control Name", null, null, null, null, null,
                        "Changed Elements", "Details of Changes", "Sort As"),
                Arrays.asList("(Rev5)", null, null, null, null, null, null, null, null, null),
                Arrays.asList("AC-1", "Policy and Procedures", null, null, null, null, null,
                        "N", null, "AC-01-00"),
                Arrays.asList(null, "Continuation", null, null, null, null, null,
                        "Adds control text", null, "AC-01-01")
        ));

        // Act
        RevisionComparisonResult result = pipeline("", "").analyze(workbook);

        // Assert
        assertThat(result.byRowIndex())
                .containsEntry(2, RelationshipKind.EQUAL_TO)
                .containsEntry(3, RelationshipKind.SUPERSET_OF);
        assertThat(result.crosswalk().mapped()).extracting(MappingRecord::sourceId).containsExactly("ac-1");
        assertThat(result.crosswalk().skippedRows()).isEqualTo(1);
        assertThat(result.summary().totalRows()).isEqualTo(2);
    }

    @Test
    void analyze_shouldAbort_whenConfiguredCatalogMissing() {
        String missing = tempDir.resolve("catalogs/rev4.json").toString();

        assertThatThrownBy(() -> pipeline("", missing).analyze(TestWorkbooks.revisionComparison()))
                .isInstanceOf(MissingInputException.class);
    }

    @Test
    void run_shouldWriteWorkbookSummaryAndCsv() throws Exception {
        // Arrange
        Path input = tempDir.resolve("comparison.xlsx");
        Files.write(input, TestWorkbooks.revisionComparison());

        // Act
        Path csv = pipeline(input.toString(), "").run();

        // Assert
        List<String> lines = Files.readAllLines(csv);
        assertThat(lines).hasSize(6);
        assertThat(lines.get(2)).contains("ac-1", "equal-to", "100%");

        assertThat(Files.readString(tempDir.resolve("data/summary.md")))
                .startsWith("# NIST SP 800-53 Rev 5 to Rev 4 Comparison Summary")
                .contains("| restored-in-target | 1 |");

        byte[] annotated = Files.readAllBytes(tempDir.resolve("data/relationships.xlsx"));
        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(annotated))) {
            XSSFRow row = workbook.getSheet(TestWorkbooks.COMPARISON_SHEET).getRow(7);
            assertThat(row.getCell(11).getStringCellValue()).isEqualTo("restored-in-target");
        }
    }

    @Test
    void run_shouldAbort_whenInputMissing() {
        String missing = tempDir.resolve("missing.xlsx").toString();

        assertThatThrownBy(() -> pipeline(missing, "").run())
                .isInstanceOf(MissingInputException.class)
                .hasMessageContaining("comparison workbook");
    }
}
