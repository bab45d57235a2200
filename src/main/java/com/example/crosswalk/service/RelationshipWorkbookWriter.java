package com.example.crosswalk.service;

import com.example.crosswalk.model.RelationshipKind;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.Map;

/**
 * Adds a colour-coded relationship column to the original comparison workbook, leaving the
 * existing content and formatting untouched. The column goes one blank column to the right of
 * the last used one; row 1 gets the header, row 2 the sub-header.
 */
@Service
public class RelationshipWorkbookWriter {

    private static final Logger log = LoggerFactory.getLogger(RelationshipWorkbookWriter.class);

    private static final String HEADER_FILL = "4472C4";
    private static final String SUB_HEADER_FILL = "8EA9C1";
    private static final String DEFAULT_FILL = "FFFFFF";
    private static final String FONT_NAME = "Arial";
    private static final int COLUMN_WIDTH_CHARS = 22;

    private static final Map<RelationshipKind, String> COLORS = new EnumMap<>(RelationshipKind.class);

    static {
        COLORS.put(RelationshipKind.EQUAL_TO, "C6EFCE");
        COLORS.put(RelationshipKind.EQUIVALENT_TO, "FFEB9C");
        COLORS.put(RelationshipKind.SUBSET_OF, "BDD7EE");
        COLORS.put(RelationshipKind.SUPERSET_OF, "FCE4D6");
        COLORS.put(RelationshipKind.INTERSECTS_WITH, "E2EFDA");
        COLORS.put(RelationshipKind.NO_RELATIONSHIP, "F2DCDB");
        COLORS.put(RelationshipKind.WITHDRAWN, "808080");
        COLORS.put(RelationshipKind.WITHDRAWN_IN_SOURCE_ONLY, "D9D9D9");
        COLORS.put(RelationshipKind.RESTORED_IN_TARGET, "E2CFDD");
        COLORS.put(RelationshipKind.WITHDRAWN_IN_TARGET_ONLY, "C9C9C9");
        COLORS.put(RelationshipKind.WITHDRAWN_ERROR, "FF0000");
    }

    /**
     * @param original      the original workbook (.xlsx); not closed by this method
     * @param sheetName     worksheet to annotate
     * @param relationships relationship per 0-based worksheet row index
     * @param header        text of the header cell (row 1)
     * @param subHeader     text of the sub-header cell (row 2)
     * @param out           destination of the annotated workbook
     * @return 0-based index of the added column
     */
    public int annotate(InputStream original, String sheetName, Map<Integer, RelationshipKind> relationships,
                        String header, String subHeader, OutputStream out) {
        try (XSSFWorkbook workbook = new XSSFWorkbook(original)) {
            XSSFSheet sheet = workbook.getSheet(sheetName);
            if (sheet == null) {
                throw new MissingInputException("Worksheet '%s' not found in workbook".formatted(sheetName));
            }

            int column = lastUsedColumnCount(sheet) + 1;

            XSSFCellStyle headerStyle = style(workbook, HEADER_FILL, true, 10, true);
            headerStyle.getFont().setColor(new XSSFColor(rgb("FFFFFF"), null));
            put(sheet, 0, column, header, headerStyle);
            put(sheet, 1, column, subHeader, style(workbook, SUB_HEADER_FILL, true, 9, false));

            Map<RelationshipKind, XSSFCellStyle> styles = new EnumMap<>(RelationshipKind.class);
            relationships.forEach((rowIndex, kind) -> {
                XSSFCellStyle cellStyle = styles.computeIfAbsent(kind,
                        k -> style(workbook, colorOf(k), false, 9, false));
                put(sheet, rowIndex, column, kind.label(), cellStyle);
            });

            sheet.setColumnWidth(column, COLUMN_WIDTH_CHARS * 256);
            workbook.write(out);

            log.info("RelationshipWorkbookWriter: {} rows annotated in column {} of '{}'",
                    relationships.size(), column + 1, sheetName);
            return column;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write relationship workbook: " + e.getMessage(), e);
        }
    }

    static String colorOf(RelationshipKind kind) {
        return COLORS.getOrDefault(kind, DEFAULT_FILL);
    }

    // ═══════════════════════════════════════════════════
    // Internal helpers
    // ═══════════════════════════════════════════════════

    private static int lastUsedColumnCount(XSSFSheet sheet) {
        int max = 0;
        for (Row row : sheet) {
            max = Math.max(max, row.getLastCellNum());
        }
        return max;
    }

    private static void put(XSSFSheet sheet, int rowIndex, int column, String value, CellStyle style) {
        XSSFRow row = sheet.getRow(rowIndex);
        if (row == null) {
            row = sheet.createRow(rowIndex);
        }
        XSSFCell cell = row.createCell(column);
        cell.setCellValue(value);
        cell.setCellStyle(style);
    }

    private static XSSFCellStyle style(XSSFWorkbook workbook, String fillHex, boolean bold, int size, boolean wrap) {
        XSSFFont font = workbook.createFont();
        font.setFontName(FONT_NAME);
        font.setFontHeightInPoints((short) size);
        font.setBold(bold);

        XSSFCellStyle style = workbook.createCellStyle();
        style.setFont(font);
        style.setFillForegroundColor(new XSSFColor(rgb(fillHex), null));
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        style.setWrapText(wrap);
        return style;
    }

    private static byte[] rgb(String hex) {
        return HexFormat.of().parseHex(hex);
    }
}
