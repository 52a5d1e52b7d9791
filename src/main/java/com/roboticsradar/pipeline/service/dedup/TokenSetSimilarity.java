package com.roboticsradar.pipeline.service.dedup;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/** Jaccard similarity over the sets of whitespace-separated words. */
public class TokenSetSimilarity implements SimilarityFunction {

    @Override
    public String name() {
        return "token-set";
    }

    @Override
    public double similarity(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() && right.isEmpty()) return 1.0;
        int inter = (int) left.stream().filter(right::contains).count();
        int union = left.size() + right.size() - inter;
        return union == 0 ? 1.0 : (double) inter / union;
    }

    @Override
    public int measure(String s) {
        return tokens(s).size();
    }

    private static Set<String> tokens(String s) {
        if (s == null || s.isBlank()) return Set.of();
        return new HashSet<>(Arrays.asList(s.trim().split("\\s+")));
    }
}
