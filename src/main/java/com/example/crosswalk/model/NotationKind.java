package com.example.crosswalk.model;

/**
 * Native control-identifier notations found in NIST spreadsheets.
 * Each value is dispatched to its own canonicalization rule.
 */
public enum NotationKind {

    /** CSF function/category/subcategory text, e.g. {@code GOVERN (GV)} or {@code GV.OC-01}. */
    DOTTED_HIERARCHY,

    /** Whole group title slugified into hyphen-joined tokens, e.g. {@code organizational-context-gv-oc}. */
    TITLE_SLUG,

    /** SP 800-53 family-number with optional parenthesized enhancement, e.g. {@code AC-2(1)}. */
    DASH_ENHANCEMENT,

    /** SP 800-53 sort key with a {@code 00} enhancement meaning "base control", e.g. {@code AC-02-01}. */
    TRIPLE_SEGMENT
}
