package com.roboticsradar.pipeline.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summarized user reaction for one item: the signed, weighted sum of its feedback records
 * and the number of records per type.
 */
public class FeedbackAggregate {
    private static final FeedbackAggregate EMPTY = new FeedbackAggregate(0.0, Map.of());

    private final double weightedSum;
    private final Map<FeedbackType, Integer> counts;

    public FeedbackAggregate(double weightedSum, Map<FeedbackType, Integer> counts) {
        this.weightedSum = weightedSum;
        EnumMap<FeedbackType, Integer> copy = new EnumMap<>(FeedbackType.class);
        if (counts != null) copy.putAll(counts);
        this.counts = Collections.unmodifiableMap(copy);
    }

    public static FeedbackAggregate empty() {
        return EMPTY;
    }

    /** Folds records into an aggregate; records without a type are ignored. */
    public static FeedbackAggregate of(List<FeedbackRecord> records) {
        if (records == null || records.isEmpty()) return EMPTY;
        double sum = 0.0;
        EnumMap<FeedbackType, Integer> counts = new EnumMap<>(FeedbackType.class);
        for (FeedbackRecord r : records) {
            if (r == null || r.getFeedbackType() == null) continue;
            sum += r.getFeedbackType().polarity() * Math.abs(r.getWeight());
            counts.merge(r.getFeedbackType(), 1, Integer::sum);
        }
        return new FeedbackAggregate(sum, counts);
    }

    public double getWeightedSum() { return weightedSum; }
    public Map<FeedbackType, Integer> getCounts() { return counts; }

    public int count(FeedbackType type) {
        return counts.getOrDefault(type, 0);
    }
}
