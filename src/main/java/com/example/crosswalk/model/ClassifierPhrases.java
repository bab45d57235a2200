package com.example.crosswalk.model;

import java.util.List;

/**
 * Phrase sets driving the relationship classifier. All phrases are matched against
 * lowercased text, so they are stored lowercase.
 *
 * @param withdrawnInSource           change-details phrase: control withdrawn in the prior revision
 * @param previouslyWithdrawnInSource change-details phrase: control already withdrawn before the prior revision
 * @param restoredInTarget            change-details phrase: control restored in the current revision
 * @param withdrawnMarker             exact changed-elements value for a control withdrawn in the current revision
 * @param noChangeMarker              exact changed-elements value for an unchanged control
 * @param adds                        requirement-adding phrases
 * @param removes                     requirement-removing phrases
 * @param changesControl              phrases signalling a rewritten control or parameter
 * @param neutral                     line prefixes that do not change control substance
 * @param newControl                  phrases marking a control new in the current revision
 */
public record ClassifierPhrases(
        String withdrawnInSource,
        String previouslyWithdrawnInSource,
        String restoredInTarget,
        String withdrawnMarker,
        String noChangeMarker,
        List<String> adds,
        List<String> removes,
        List<String> changesControl,
        List<String> neutral,
        List<String> newControl
) {
    public static final List<String> DEFAULT_ADDS = List.of("adds control text", "adds parameter");
    public static final List<String> DEFAULT_REMOVES = List.of("removes parameter", "removes control text");
    public static final List<String> DEFAULT_CHANGES_CONTROL = List.of("changes control text", "changes parameter");
    public static final List<String> DEFAULT_NEUTRAL =
            List.of("changes discussion", "adds discussion", "changes title", "adds to", "n");
    public static final List<String> DEFAULT_NEW_CONTROL = List.of("new base control", "new control enhancement");

    public ClassifierPhrases {
        withdrawnInSource = lower(withdrawnInSource);
        previouslyWithdrawnInSource = lower(previouslyWithdrawnInSource);
        restoredInTarget = lower(restoredInTarget);
        withdrawnMarker = lower(withdrawnMarker);
        noChangeMarker = lower(noChangeMarker);
        adds = lower(adds);
        removes = lower(removes);
        changesControl = lower(changesControl);
        neutral = lower(neutral);
        newControl = lower(newControl);
    }

    /**
     * Default phrase sets with lifecycle phrases naming the given revisions,
     * e.g. {@code forRevisions("rev4", "rev5")} yields "withdrawn in rev4" and "restored in rev5".
     */
    public static ClassifierPhrases forRevisions(String priorRevision, String currentRevision) {
        return new ClassifierPhrases(
                "withdrawn in " + priorRevision,
                "previously withdrawn in " + priorRevision,
                "restored in " + currentRevision,
                "withdrawn",
                "n",
                DEFAULT_ADDS,
                DEFAULT_REMOVES,
                DEFAULT_CHANGES_CONTROL,
                DEFAULT_NEUTRAL,
                DEFAULT_NEW_CONTROL
        );
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase();
    }

    private static List<String> lower(List<String> values) {
        if (values == null) return List.of();
        return values.stream()
                .map(ClassifierPhrases::lower)
                .filter(v -> !v.isEmpty())
                .toList();
    }
}
