package com.roboticsradar.pipeline.service.dedup;

/**
 * Normalized similarity in [0, 1] between two comparison-form strings.
 *
 * <p>Implementations also expose a size {@link #measure(String) measure} such that
 * {@code similarity(a, b) <= min(measure(a), measure(b)) / max(measure(a), measure(b))}.
 * {@link DedupIndex} relies on that bound to skip candidates whose size alone rules out a match.
 */
public interface SimilarityFunction {
    /** Tolerance for threshold comparisons; thresholds are inclusive. */
    double EPSILON = 1e-9;

    String name();

    double similarity(String a, String b);

    int measure(String s);

    default boolean matches(String a, String b, double threshold) {
        return similarity(a, b) >= threshold - EPSILON;
    }
}
