package com.example.crosswalk.model;

/**
 * A catalog row that could not be attached to the tree.
 *
 * @param rowNumber worksheet row number (0 when unknown)
 * @param level     "category" or "subcategory"
 * @param text      the cell text that was dropped
 * @param reason    why it was dropped
 */
public record DroppedRow(int rowNumber, String level, String text, String reason) {
}
