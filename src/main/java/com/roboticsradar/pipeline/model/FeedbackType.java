package com.roboticsradar.pipeline.model;

import java.util.Locale;

/** User reaction kinds recorded by the feedback subsystem. */
public enum FeedbackType {
    LIKE(1.0),
    DISLIKE(-1.0),
    SAVE(1.0);

    /** Sign applied to a record's weight when aggregating. */
    private final double polarity;

    FeedbackType(double polarity) {
        this.polarity = polarity;
    }

    public double polarity() {
        return polarity;
    }

    /** Parses a stored value ({@code like}, {@code dislike}, {@code save}); returns null for anything else. */
    public static FeedbackType parse(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
