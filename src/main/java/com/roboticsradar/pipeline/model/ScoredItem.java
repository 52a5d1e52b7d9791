package com.roboticsradar.pipeline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An item with its score and the contributions that produced it.
 *
 * <p>{@code scoreBreakdown} holds the named contributions before the recency multiplication;
 * {@code recencyFactor} is the multiplier that was applied. The score is always
 * reproducible as {@code sum(scoreBreakdown.values()) * recencyFactor}.
 */
public class ScoredItem extends Item {
    private Map<String, Double> scoreBreakdown = new LinkedHashMap<>();
    private double recencyFactor = 1.0;

    public ScoredItem() {}

    public ScoredItem(Item item, Map<String, Double> scoreBreakdown, double recencyFactor) {
        super(item);
        this.scoreBreakdown = new LinkedHashMap<>(scoreBreakdown);
        this.recencyFactor = recencyFactor;
        setScore(breakdownTotal() * recencyFactor);
    }

    /** Sum of the contributions, before recency. */
    public double breakdownTotal() {
        double sum = 0.0;
        for (Double v : scoreBreakdown.values()) {
            if (v != null) sum += v;
        }
        return sum;
    }

    /** Score as a primitive; unscored items rank as zero. */
    public double scoreValue() {
        return getScore() != null ? getScore() : 0.0;
    }

    public Map<String, Double> getScoreBreakdown() { return Collections.unmodifiableMap(scoreBreakdown); }
    public void setScoreBreakdown(Map<String, Double> scoreBreakdown) {
        this.scoreBreakdown = scoreBreakdown != null ? new LinkedHashMap<>(scoreBreakdown) : new LinkedHashMap<>();
    }
    public double getRecencyFactor() { return recencyFactor; }
    public void setRecencyFactor(double recencyFactor) { this.recencyFactor = recencyFactor; }
}
