package com.roboticsradar.pipeline.service.dedup;

/**
 * {@code 1 - editDistance / maxLength}. Threshold checks use a banded distance that stops as
 * soon as the allowed number of edits is exceeded.
 */
public class LevenshteinSimilarity implements SimilarityFunction {

    @Override
    public String name() {
        return "levenshtein";
    }

    @Override
    public double similarity(String a, String b) {
        int max = Math.max(a.length(), b.length());
        if (max == 0) return 1.0;
        return 1.0 - (double) distance(a, b, max) / max;
    }

    @Override
    public int measure(String s) {
        return s.length();
    }

    @Override
    public boolean matches(String a, String b, double threshold) {
        int max = Math.max(a.length(), b.length());
        if (max == 0) return true;
        int allowed = (int) Math.floor((1.0 - threshold + EPSILON) * max);
        if (allowed < 0) return false;
        return distance(a, b, allowed) <= allowed;
    }

    /** Edit distance when it is at most {@code limit}, otherwise {@code limit + 1}. */
    static int distance(String a, String b, int limit) {
        int n = a.length();
        int m = b.length();
        int over = limit + 1;
        if (Math.abs(n - m) > limit) return over;
        if (n == 0) return m;
        if (m == 0) return n;

        int[] prev = new int[m + 1];
        int[] cur = new int[m + 1];
        for (int j = 0; j <= m; j++) prev[j] = j <= limit ? j : over;

        for (int i = 1; i <= n; i++) {
            int from = Math.max(1, i - limit);
            int to = Math.min(m, i + limit);
            cur[from - 1] = from == 1 ? (i <= limit ? i : over) : over;
            int rowMin = cur[from - 1];
            char ca = a.charAt(i - 1);
            for (int j = from; j <= to; j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                int v = Math.min(Math.min(prev[j] + 1, cur[j - 1] + 1), prev[j - 1] + cost);
                if (v > over) v = over;
                cur[j] = v;
                if (v < rowMin) rowMin = v;
            }
            if (to < m) cur[to + 1] = over;
            if (rowMin > limit) return over;
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }
        return Math.min(prev[m], over);
    }
}
