package com.roboticsradar.pipeline.service.dedup;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TokenSetSimilarityTest {
    private final TokenSetSimilarity similarity = new TokenSetSimilarity();

    @Test
    public void jaccardOverWordSets() {
        assertEquals(6.0 / 7.0, similarity.similarity(
                "boston dynamics retires hydraulic atlas robot",
                "boston dynamics retires the hydraulic atlas robot"), 1e-12);
        assertEquals(1.0, similarity.similarity("arm robot", "robot arm"));
        assertEquals(0.0, similarity.similarity("robot", "pasta"));
    }

    @Test
    public void measureIsDistinctWordCount() {
        assertEquals(3, similarity.measure("robot robot arm demo"));
        assertEquals(0, similarity.measure(""));
    }
}
