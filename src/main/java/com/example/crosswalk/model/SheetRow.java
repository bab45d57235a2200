package com.example.crosswalk.model;

import java.util.List;
import java.util.Map;

/**
 * One worksheet row as text. Blank cells are null.
 *
 * @param rowIndex 0-based worksheet row index
 * @param byHeader cells keyed by whitespace-normalized header text
 * @param values   cells by 0-based column position
 */
public record SheetRow(int rowIndex, Map<String, String> byHeader, List<String> values) {

    public String cell(String header) {
        return byHeader.get(normalizeHeader(header));
    }

    public String cell(int column) {
        return column >= 0 && column < values.size() ? values.get(column) : null;
    }

    /** 1-based row number, as shown by spreadsheet applications. */
    public int rowNumber() {
        return rowIndex + 1;
    }

    /** Collapses whitespace runs (including the line breaks NIST puts in headers) to one space. */
    public static String normalizeHeader(String header) {
        return header == null ? "" : header.replaceAll("\\s+", " ").trim();
    }
}
