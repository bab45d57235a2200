package com.example.crosswalk.model;

/**
 * One row of a sparse catalog worksheet. A non-null cell opens a new node at that level;
 * a null cell means "still inside the most recent node of that level".
 *
 * @param rowNumber   1-based worksheet row, for diagnostics
 * @param function    Function cell, e.g. {@code GOVERN (GV): ...}
 * @param category    Category cell, e.g. {@code Organizational Context (GV.OC): ...}
 * @param subcategory Subcategory cell, e.g. {@code GV.OC-01: The organizational mission ...}
 * @param examples    Implementation Examples cell
 */
public record ControlRow(int rowNumber, String function, String category, String subcategory, String examples) {

    public static ControlRow of(String function, String category, String subcategory) {
        return new ControlRow(0, function, category, subcategory, null);
    }
}
