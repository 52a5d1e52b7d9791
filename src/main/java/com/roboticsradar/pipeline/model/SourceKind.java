package com.roboticsradar.pipeline.model;

import java.util.Locale;

/**
 * Kind of external source an adapter understands. The lower-case {@link #key()} is what
 * configuration (source bonus tables, source definitions) and stored item ids use.
 */
public enum SourceKind {
    RSS,
    REDDIT,
    HACKERNEWS,
    GITHUB;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a configured kind, accepting any case and the {@code hacker-news} / {@code hacker_news} spellings.
     *
     * @throws IllegalArgumentException when the value names no known kind
     */
    public static SourceKind fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("source kind is empty");
        }
        String k = value.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (SourceKind kind : values()) {
            if (kind.name().equals(k)) return kind;
        }
        throw new IllegalArgumentException("unknown source kind: " + value);
    }
}
