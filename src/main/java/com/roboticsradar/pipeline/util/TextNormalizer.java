package com.roboticsradar.pipeline.util;

import java.util.Locale;

/**
 * Text clean-up shared by the quality filter, the extractor and the deduplicator.
 *
 * <p>Normalization converts non-breaking spaces, collapses repeated whitespace and trims.
 * {@link #forComparison(String)} additionally lower-cases, which is the form every similarity
 * check runs on.
 */
public final class TextNormalizer {
    private TextNormalizer() {}

    /**
     * Returns the input with non-breaking spaces converted, whitespace collapsed and trimmed.
     * A null input yields an empty string.
     */
    public static String collapse(String input) {
        if (input == null) return "";
        String s = input.replace('\u00A0', ' ');
        s = s.replaceAll("\\s+", " ").trim();
        return s;
    }

    /** Lower-cased, whitespace-collapsed form used for similarity comparisons. */
    public static String forComparison(String input) {
        return collapse(input).toLowerCase(Locale.ROOT);
    }

    /**
     * Cleans a headline for display: collapses whitespace and strips leading/trailing
     * separator garbage such as standalone dashes, pipes or colons.
     *
     * <p>If the result becomes empty, returns the collapsed original as a fallback.
     */
    public static String sanitizeTitle(String input) {
        if (input == null) return "";
        String s = collapse(input);
        String original = s;
        // two passes for mixed separator runs like ": |"
        for (int i = 0; i < 2; i++) {
            s = s.replaceAll("^(?:[\\s]*[\\-–—|:;·•]+[\\s]*)+", "");
            s = s.replaceAll("(?:[\\s]*[\\-–—|:;·•]+[\\s]*)+$", "");
        }
        s = s.trim();
        return s.isEmpty() ? original : s;
    }

    /** Joins a title and a body the way items expose their analysable {@code text}. */
    public static String joinTitleAndBody(String title, String body) {
        String t = collapse(title);
        String b = collapse(body);
        if (t.isEmpty()) return b;
        if (b.isEmpty()) return t;
        return t + "\n\n" + b;
    }
}
