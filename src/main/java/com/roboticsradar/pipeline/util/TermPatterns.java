package com.roboticsradar.pipeline.util;

import java.util.Locale;
import java.util.regex.Pattern;

/** Whole-word, case-insensitive patterns for configured vocabulary terms. */
public final class TermPatterns {
    private TermPatterns() {}

    /**
     * Matches {@code term} only when it is not glued to letters or digits on either side,
     * so {@code "ros"} matches "ROS 2" but not "across". Inner whitespace matches any run of whitespace.
     */
    public static Pattern wholeWord(String term) {
        String t = TextNormalizer.collapse(term).toLowerCase(Locale.ROOT);
        StringBuilder body = new StringBuilder();
        String[] parts = t.split(" ");
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) body.append("\\s+");
            body.append(Pattern.quote(parts[i]));
        }
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + body + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
