package com.roboticsradar.pipeline.service.dedup;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class LevenshteinSimilarityTest {
    private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();

    private static int fullDistance(String a, String b) {
        int[][] d = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) d[i][0] = i;
        for (int j = 0; j <= b.length(); j++) d[0][j] = j;
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                d[i][j] = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
            }
        }
        return d[a.length()][b.length()];
    }

    private static String withEdits(int length, int edits) {
        StringBuilder sb = new StringBuilder("a".repeat(length));
        for (int i = 0; i < edits; i++) sb.setCharAt(i, 'b');
        return sb.toString();
    }

    @Test
    public void classicExample() {
        assertEquals(3, LevenshteinSimilarity.distance("kitten", "sitting", 10));
        assertEquals(1.0 - 3.0 / 7.0, similarity.similarity("kitten", "sitting"), 1e-12);
        assertEquals(1.0, similarity.similarity("", ""));
        assertEquals(0.0, similarity.similarity("abc", ""));
    }

    @Test
    public void boundedDistanceStopsAboveTheLimit() {
        assertEquals(3, LevenshteinSimilarity.distance("kitten", "sitting", 2));
        assertEquals(6, LevenshteinSimilarity.distance("a", "abcdefghij", 5));
    }

    @Test
    public void bandedDistanceAgreesWithFullMatrix() {
        Random random = new Random(42);
        for (int round = 0; round < 500; round++) {
            String a = randomString(random);
            String b = randomString(random);
            int limit = random.nextInt(12);
            int expected = fullDistance(a, b);
            assertEquals(Math.min(expected, limit + 1), LevenshteinSimilarity.distance(a, b, limit),
                    "a=" + a + " b=" + b + " limit=" + limit);
        }
    }

    @Test
    public void thresholdIsInclusive() {
        String base = withEdits(100, 0);
        assertTrue(similarity.matches(base, withEdits(100, 20), 0.80));
        assertFalse(similarity.matches(base, withEdits(100, 21), 0.80));
        assertEquals(0.80, similarity.similarity(base, withEdits(100, 20)), 1e-12);
    }

    @Test
    public void lengthRatioBoundsSimilarity() {
        String a = "robot arm";
        String b = "robot arm with seven degrees of freedom";
        double bound = (double) similarity.measure(a) / similarity.measure(b);
        assertTrue(similarity.similarity(a, b) <= bound + 1e-12);
    }

    private static String randomString(Random random) {
        int len = random.nextInt(15);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < len; i++) sb.append((char) ('a' + random.nextInt(3)));
        return sb.toString();
    }
}
