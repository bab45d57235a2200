package com.example.crosswalk.service;

import com.example.crosswalk.model.SheetRow;
import org.apache.poi.ss.usermodel.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Reads a worksheet into text rows. Merged cells keep their value in the top-left cell only,
 * which is exactly the sparse layout the catalog builder expects.
 */
@Service
public class SpreadsheetReader {

    private static final Logger log = LoggerFactory.getLogger(SpreadsheetReader.class);

    /**
     * Reads every non-blank row from {@code firstDataRow} on.
     *
     * @param in           workbook content (.xlsx or .xls); not closed by this method
     * @param sheetName    worksheet name
     * @param headerRow    0-based index of the row holding column names
     * @param firstDataRow 0-based index of the first data row
     * @throws MissingInputException if the worksheet does not exist
     */
    public List<SheetRow> read(InputStream in, String sheetName, int headerRow, int firstDataRow) {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = workbook.getSheet(sheetName);
            if (sheet == null) {
                throw new MissingInputException("Worksheet '%s' not found in workbook".formatted(sheetName));
            }

            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            List<String> headers = cells(sheet.getRow(headerRow), formatter, evaluator).stream()
                    .map(SheetRow::normalizeHeader)
                    .toList();

            List<SheetRow> rows = new ArrayList<>();
            for (int r = firstDataRow; r <= sheet.getLastRowNum(); r++) {
                List<String> values = cells(sheet.getRow(r), formatter, evaluator);
                if (values.stream().allMatch(Objects::isNull)) {
                    continue;
                }
                Map<String, String> byHeader = new LinkedHashMap<>();
                for (int c = 0; c < headers.size(); c++) {
                    if (!headers.get(c).isEmpty()) {
                        byHeader.put(headers.get(c), c < values.size() ? values.get(c) : null);
                    }
                }
                rows.add(new SheetRow(r, Collections.unmodifiableMap(byHeader),
                        Collections.unmodifiableList(values)));
            }

            log.info("SpreadsheetReader: {} rows read from '{}' ({} columns)", rows.size(), sheetName, headers.size());
            return rows;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read workbook: " + e.getMessage(), e);
        }
    }

    private static List<String> cells(Row row, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (row == null || row.getLastCellNum() < 0) {
            return List.of();
        }
        List<String> values = new ArrayList<>(row.getLastCellNum());
        for (int c = 0; c < row.getLastCellNum(); c++) {
            Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            String text = cell != null ? formatter.formatCellValue(cell, evaluator) : null;
            values.add(text == null || text.isBlank() ? null : text);
        }
        return values;
    }
}
