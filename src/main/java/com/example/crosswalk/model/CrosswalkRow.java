package com.example.crosswalk.model;

/**
 * A raw mapping row before canonicalization.
 *
 * @param sourceRaw      source control id as written in the worksheet
 * @param targetRaw      target control id as written in the worksheet (null if none)
 * @param classification relationship, when the row went through the classifier
 */
public record CrosswalkRow(String sourceRaw, String targetRaw, RelationshipKind classification) {

    public static CrosswalkRow unclassified(String sourceRaw, String targetRaw) {
        return new CrosswalkRow(sourceRaw, targetRaw, null);
    }
}
