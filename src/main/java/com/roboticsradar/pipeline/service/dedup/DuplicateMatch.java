package com.roboticsradar.pipeline.service.dedup;

/** Which check of the cascade matched, against which existing item. */
public class DuplicateMatch {
    public enum Kind { URL, TITLE, CONTENT, NONE }

    private static final DuplicateMatch NO_MATCH = new DuplicateMatch(Kind.NONE, null, 0.0);

    private final Kind kind;
    private final String matchedItemId;
    private final double similarity;

    public DuplicateMatch(Kind kind, String matchedItemId, double similarity) {
        this.kind = kind;
        this.matchedItemId = matchedItemId;
        this.similarity = similarity;
    }

    public static DuplicateMatch none() {
        return NO_MATCH;
    }

    public boolean isDuplicate() {
        return kind != Kind.NONE;
    }

    public Kind getKind() { return kind; }
    public String getMatchedItemId() { return matchedItemId; }
    public double getSimilarity() { return similarity; }

    @Override
    public String toString() {
        return isDuplicate() ? kind + " of " + matchedItemId + " (" + String.format("%.3f", similarity) + ")" : "NONE";
    }
}
