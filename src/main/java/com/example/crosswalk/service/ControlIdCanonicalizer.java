package com.example.crosswalk.service;

import com.example.crosswalk.model.NotationKind;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Maps each framework's native control-identifier notation to one canonical form:
 * lowercase, {@code .} as hierarchy separator, {@code -} as enumeration separator,
 * enhancements joined with {@code .} (e.g. {@code ac-2.1}).
 * <p>
 * Canonicalization is total: malformed input is lowercased and trimmed rather than rejected,
 * and null or blank input yields the empty string, which callers treat as "no identifier".
 * Every notation is idempotent: canonicalizing a canonical id returns it unchanged.
 */
@Service
public class ControlIdCanonicalizer {

    /** Leaf controls end in {@code -<digits>}, optionally followed by an enhancement. */
    private static final Pattern CONTROL_LEVEL = Pattern.compile(".+-\\d+(\\.\\d+)?$");

    private static final Pattern SLUG_SEPARATORS = Pattern.compile("[\\s.()]+");
    private static final Pattern REPEATED_HYPHENS = Pattern.compile("-{2,}");

    public String canonicalize(String raw, NotationKind notation) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        return switch (notation) {
            case DOTTED_HIERARCHY -> dottedHierarchy(raw);
            case TITLE_SLUG -> titleSlug(raw);
            case DASH_ENHANCEMENT -> dashEnhancement(raw);
            case TRIPLE_SEGMENT -> tripleSegment(raw);
        };
    }

    /**
     * Whether a canonical id names a leaf control ({@code gv.oc-01}, {@code ac-2.1}) rather than
     * a function, category or family ({@code gv}, {@code gv.oc}, {@code ac}).
     */
    public boolean isControlLevel(String canonicalId) {
        return canonicalId != null && CONTROL_LEVEL.matcher(canonicalId).matches();
    }

    // ═══════════════════════════════════════════════════
    // Notation rules
    // ═══════════════════════════════════════════════════

    /**
     * {@code GOVERN (GV): ...} → {@code gv}; {@code GV.OC-01: ...} → {@code gv.oc-01}.
     */
    private String dottedHierarchy(String raw) {
        String text = beforeColon(raw).toLowerCase().trim();

        int open = text.indexOf('(');
        int close = open >= 0 ? text.indexOf(')', open + 1) : -1;
        if (open >= 0 && close > open) {
            return text.substring(open + 1, close).trim();
        }
        return text;
    }

    /**
     * {@code Organizational Context (GV.OC): ...} → {@code organizational-context-gv-oc}.
     */
    private String titleSlug(String raw) {
        String text = beforeColon(raw).toLowerCase().trim().replace(",", "");
        text = SLUG_SEPARATORS.matcher(text).replaceAll("-");
        text = REPEATED_HYPHENS.matcher(text).replaceAll("-");
        return trimHyphens(text);
    }

    /**
     * {@code AC-01} → {@code ac-1}; {@code AC-2(1)} → {@code ac-2.1}; {@code AC-02(03),} → {@code ac-2.3}.
     */
    private String dashEnhancement(String raw) {
        String id = stripTrailingCommas(raw.trim().toLowerCase());

        int dash = id.indexOf('-');
        if (dash < 0) {
            return id;
        }
        String family = id.substring(0, dash);
        String remainder = id.substring(dash + 1);

        int paren = remainder.indexOf('(');
        if (paren >= 0) {
            String base = remainder.substring(0, paren).trim();
            String enhancement = remainder.substring(paren + 1).replace(")", "").trim();
            return family + "-" + stripLeadingZeros(base) + "." + stripLeadingZeros(enhancement);
        }
        return family + "-" + stripLeadingZeros(remainder);
    }

    /**
     * {@code AC-01-00} → {@code ac-1}; {@code AC-02-01} → {@code ac-2.1}.
     */
    private String tripleSegment(String raw) {
        String id = raw.trim().toLowerCase();

        String[] segments = id.split("-", -1);
        if (segments.length != 3) {
            return id;
        }
        String family = segments[0];
        String base = stripLeadingZeros(segments[1]);
        String enhancement = segments[2];

        if ("00".equals(enhancement)) {
            return family + "-" + base;
        }
        return family + "-" + base + "." + stripLeadingZeros(enhancement);
    }

    // ═══════════════════════════════════════════════════
    // Internal helpers
    // ═══════════════════════════════════════════════════

    private static String beforeColon(String text) {
        int colon = text.indexOf(':');
        return colon >= 0 ? text.substring(0, colon) : text;
    }

    /** Numeric tokens lose their leading zeros ({@code 01} → {@code 1}, {@code 00} → {@code 0}); others are kept. */
    private static String stripLeadingZeros(String token) {
        if (token.isEmpty() || !token.chars().allMatch(Character::isDigit)) {
            return token;
        }
        int start = 0;
        while (start < token.length() - 1 && token.charAt(start) == '0') {
            start++;
        }
        return token.substring(start);
    }

    private static String stripTrailingCommas(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == ',') {
            end--;
        }
        return text.substring(0, end).trim();
    }

    private static String trimHyphens(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '-') start++;
        while (end > start && text.charAt(end - 1) == '-') end--;
        return text.substring(start, end);
    }
}
