package com.example.crosswalk.service;

import com.example.crosswalk.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Classifies a comparison row's free-text change signals into a {@link RelationshipKind}.
 * <p>
 * Rules are evaluated in strict precedence order and the first match wins:
 * <ol>
 *   <li>withdrawn in source and restored in target → restored-in-target</li>
 *   <li>previously withdrawn in source → withdrawn-in-source-only</li>
 *   <li>withdrawn in source and changed elements "withdrawn" → withdrawn</li>
 *   <li>changed elements "withdrawn" → withdrawn-in-target-only</li>
 *   <li>withdrawn in source, nothing above → withdrawn-error (manual review)</li>
 *   <li>new control phrase → no-relationship</li>
 *   <li>no-change marker → equal-to</li>
 *   <li>only neutral lines → equivalent-to</li>
 *   <li>changes control/parameter, adds and removes, adds only, removes only, otherwise intersects-with</li>
 * </ol>
 * Lifecycle rules come first because withdrawal overrides any substantive change analysis.
 * Phrase sets come from {@link ClassifierPhrases}, so they can grow without touching the rules.
 */
@Service
public class RelationshipClassifier {

    private static final Logger log = LoggerFactory.getLogger(RelationshipClassifier.class);

    private static final Comparator<RelationshipKind> BY_LABEL = Comparator.comparing(RelationshipKind::label);

    private final ClassifierPhrases phrases;
    private final List<ClassificationRule> rules;

    public RelationshipClassifier(ClassifierPhrases phrases) {
        this.phrases = phrases;
        this.rules = buildRules(phrases);
    }

    /**
     * A single precedence step: when {@code applies} holds, the row gets {@code result}.
     */
    public record ClassificationRule(String name, Predicate<ChangeSignals> applies, RelationshipKind result) {}

    /**
     * Normalized inputs of one row.
     *
     * @param changedElements   lowercased, trimmed changed-elements text
     * @param changeDetails     lowercased, trimmed change-details text
     * @param substantiveLines  changed-elements lines left after discarding neutral ones
     */
    public record ChangeSignals(String changedElements, String changeDetails, List<String> substantiveLines) {

        boolean detailsContain(String phrase) {
            return !phrase.isEmpty() && changeDetails.contains(phrase);
        }

        boolean anyLineContains(List<String> candidates) {
            return substantiveLines.stream()
                    .anyMatch(line -> candidates.stream().anyMatch(line::contains));
        }
    }

    public RelationshipKind classify(String changedElements, String changeDetails) {
        ChangeSignals signals = signals(changedElements, changeDetails);
        for (ClassificationRule rule : rules) {
            if (rule.applies().test(signals)) {
                log.debug("RelationshipClassifier: rule '{}' → {}", rule.name(), rule.result());
                return rule.result();
            }
        }
        // The last rule always matches; kept for totality.
        return RelationshipKind.INTERSECTS_WITH;
    }

    public RelationshipKind classify(ComparisonRow row) {
        return classify(row.changedElements(), row.changeDetails());
    }

    public List<ClassifiedComparison> classifyAll(List<ComparisonRow> rows) {
        List<ClassifiedComparison> classified = rows.stream()
                .map(row -> new ClassifiedComparison(row, classify(row)))
                .toList();

        long errors = classified.stream()
                .filter(c -> c.relationship() == RelationshipKind.WITHDRAWN_ERROR)
                .count();
        if (errors > 0) {
            log.warn("RelationshipClassifier: {} row(s) with an unexpected withdrawn combination need manual review",
                    errors);
        }
        return classified;
    }

    /**
     * Row count per relationship, ordered by label.
     */
    public Map<RelationshipKind, Long> distribution(List<ClassifiedComparison> classified) {
        return classified.stream()
                .collect(Collectors.groupingBy(ClassifiedComparison::relationship,
                        () -> new TreeMap<>(BY_LABEL), Collectors.counting()));
    }

    /** Rules in precedence order. */
    public List<ClassificationRule> rules() {
        return rules;
    }

    ChangeSignals signals(String changedElements, String changeDetails) {
        String ce = normalize(changedElements);
        String cd = normalize(changeDetails);
        List<String> substantive = Arrays.stream(ce.split("\n"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .filter(line -> !isNeutral(line))
                .toList();
        return new ChangeSignals(ce, cd, substantive);
    }

    // ═══════════════════════════════════════════════════
    // Rule table
    // ═══════════════════════════════════════════════════

    private static List<ClassificationRule> buildRules(ClassifierPhrases p) {
        Predicate<ChangeSignals> withdrawnInSource = s -> s.detailsContain(p.withdrawnInSource());
        Predicate<ChangeSignals> restoredInTarget = s -> s.detailsContain(p.restoredInTarget());
        Predicate<ChangeSignals> withdrawnInTarget = s -> s.changedElements().equals(p.withdrawnMarker());
        Predicate<ChangeSignals> adds = s -> s.anyLineContains(p.adds());
        Predicate<ChangeSignals> removes = s -> s.anyLineContains(p.removes());

        return List.of(
                new ClassificationRule("restored in target",
                        withdrawnInSource.and(restoredInTarget), RelationshipKind.RESTORED_IN_TARGET),
                new ClassificationRule("previously withdrawn in source",
                        s -> s.detailsContain(p.previouslyWithdrawnInSource()), RelationshipKind.WITHDRAWN_IN_SOURCE_ONLY),
                new ClassificationRule("withdrawn in both",
                        withdrawnInSource.and(withdrawnInTarget), RelationshipKind.WITHDRAWN),
                new ClassificationRule("withdrawn in target",
                        withdrawnInTarget, RelationshipKind.WITHDRAWN_IN_TARGET_ONLY),
                new ClassificationRule("unexpected withdrawn combination",
                        withdrawnInSource, RelationshipKind.WITHDRAWN_ERROR),
                new ClassificationRule("new control",
                        s -> p.newControl().stream().anyMatch(s.changedElements()::contains), RelationshipKind.NO_RELATIONSHIP),
                new ClassificationRule("no change",
                        s -> s.changedElements().equals(p.noChangeMarker()), RelationshipKind.EQUAL_TO),
                new ClassificationRule("neutral changes only",
                        s -> s.substantiveLines().isEmpty(), RelationshipKind.EQUIVALENT_TO),
                new ClassificationRule("changes control",
                        s -> s.anyLineContains(p.changesControl()), RelationshipKind.INTERSECTS_WITH),
                new ClassificationRule("adds and removes",
                        adds.and(removes), RelationshipKind.INTERSECTS_WITH),
                new ClassificationRule("adds only",
                        adds, RelationshipKind.SUPERSET_OF),
                new ClassificationRule("removes only",
                        removes, RelationshipKind.SUBSET_OF),
                new ClassificationRule("ambiguous",
                        s -> true, RelationshipKind.INTERSECTS_WITH)
        );
    }

    /**
     * A line is neutral when it is a neutral phrase, or starts with one followed by a non-alphanumeric
     * character. The boundary keeps the single-letter no-change marker from swallowing other lines.
     */
    private boolean isNeutral(String line) {
        for (String phrase : phrases.neutral()) {
            if (line.equals(phrase)) {
                return true;
            }
            if (line.startsWith(phrase) && !Character.isLetterOrDigit(line.charAt(phrase.length()))) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String text) {
        return text == null ? "" : text.replace("\r\n", "\n").trim().toLowerCase();
    }
}
