package com.example.crosswalk.config;

import com.example.crosswalk.model.ClassifierPhrases;
import com.example.crosswalk.model.NotationKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Configuration properties for catalog and crosswalk generation.
 */
@ConfigurationProperties(prefix = "crosswalk")
public record CrosswalkProperties(
        CatalogTask catalog,
        FrameworkMapping frameworkMapping,
        RevisionComparison revisionComparison,
        Classifier classifier,
        Batch batch,
        Upload upload
) {

    /**
     * CSF workbook to OSCAL catalog.
     *
     * @param input        path of the CSF workbook (e.g. data/csf2.xlsx)
     * @param sheet        worksheet name
     * @param headerRow    0-based index of the header row (the NIST title row comes first)
     * @param output       catalog JSON path
     * @param title        catalog title
     * @param version      catalog version
     * @param oscalVersion OSCAL version written in the metadata
     * @param groupIdStyle {@code DOTTED_HIERARCHY} (abbreviation ids) or {@code TITLE_SLUG}
     * @param columns      worksheet column names
     */
    public record CatalogTask(String input, String sheet, int headerRow, String output, String title,
                              String version, String oscalVersion, NotationKind groupIdStyle,
                              CatalogColumns columns) {}

    public record CatalogColumns(String function, String category, String subcategory, String examples) {}

    /**
     * Concept crosswalk between two frameworks (CSF 2.0 to SP 800-53 rev5).
     *
     * @param input               path of the crosswalk workbook
     * @param sheet               worksheet holding the relationships
     * @param headerRow           0-based index of the header row
     * @param sourceColumn        column with the focal document element
     * @param targetColumn        column with the reference document element
     * @param sourceCatalog       source catalog JSON, used for source gap detection
     * @param targetCatalog       target catalog JSON, used for id validation
     * @param sourceResource      source resource reference written to the CSV
     * @param targetResource      target resource reference written to the CSV
     * @param output              CSV path
     * @param defaultRelationship relationship written on every mapped row
     * @param confidence          confidence score written on every mapped row
     * @param includeTargetGaps   whether unreferenced target controls are emitted as target gaps
     */
    public record FrameworkMapping(String input, String sheet, int headerRow, String sourceColumn,
                                   String targetColumn, String sourceCatalog, String targetCatalog,
                                   String sourceResource, String targetResource, String output,
                                   String defaultRelationship, String confidence, boolean includeTargetGaps) {}

    /**
     * SP 800-53 revision comparison (rev5 to rev4).
     *
     * @param input               path of the comparison workbook
     * @param sheet               worksheet name
     * @param firstDataRow        0-based index of the first data row (after header and sub-header)
     * @param columns             0-based column positions
     * @param sourceCatalog       optional source catalog JSON; blank disables catalog-based gap detection
     * @param targetCatalog       optional target catalog JSON; blank disables target validation
     * @param sourceResource      source resource reference written to the CSV
     * @param targetResource      target resource reference written to the CSV
     * @param output              crosswalk CSV path
     * @param relationshipsOutput annotated workbook path
     * @param summaryOutput       markdown summary path
     * @param summaryTitle        heading of the markdown summary
     * @param confidence          confidence score written on every mapped row
     * @param columnHeader        header of the added relationship column
     * @param columnSubHeader     sub-header of the added relationship column
     */
    public record RevisionComparison(String input, String sheet, int firstDataRow, ComparisonColumns columns,
                                     String sourceCatalog, String targetCatalog,
                                     String sourceResource, String targetResource,
                                     String output, String relationshipsOutput, String summaryOutput,
                                     String summaryTitle, String confidence,
                                     String columnHeader, String columnSubHeader) {}

    public record ComparisonColumns(int sourceId, int title, int changedElements, int changeDetails, int sortAs) {}

    /**
     * Classifier phrase sets. Lifecycle phrases are derived from the revision names.
     */
    public record Classifier(String priorRevision, String currentRevision, String withdrawnMarker,
                             String noChangeMarker, List<String> adds, List<String> removes,
                             List<String> changesControl, List<String> neutral, List<String> newControl) {

        public ClassifierPhrases toPhrases() {
            ClassifierPhrases defaults = ClassifierPhrases.forRevisions(
                    orDefault(priorRevision, "rev4"), orDefault(currentRevision, "rev5"));
            return new ClassifierPhrases(
                    defaults.withdrawnInSource(),
                    defaults.previouslyWithdrawnInSource(),
                    defaults.restoredInTarget(),
                    orDefault(withdrawnMarker, defaults.withdrawnMarker()),
                    orDefault(noChangeMarker, defaults.noChangeMarker()),
                    orDefault(adds, defaults.adds()),
                    orDefault(removes, defaults.removes()),
                    orDefault(changesControl, defaults.changesControl()),
                    orDefault(neutral, defaults.neutral()),
                    orDefault(newControl, defaults.newControl())
            );
        }

        private static String orDefault(String value, String fallback) {
            return value != null && !value.isBlank() ? value : fallback;
        }

        private static List<String> orDefault(List<String> value, List<String> fallback) {
            return value != null && !value.isEmpty() ? value : fallback;
        }
    }

    /**
     * @param tasks tasks run at startup, in order: catalog, framework-mapping, revision-comparison
     */
    public record Batch(List<String> tasks) {}

    /**
     * @param maxBytes maximum accepted workbook upload size
     */
    public record Upload(long maxBytes) {}
}
