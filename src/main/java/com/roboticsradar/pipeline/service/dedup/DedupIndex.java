package com.roboticsradar.pipeline.service.dedup;

import com.roboticsradar.pipeline.model.Item;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Items to compare candidates against, keyed for the three checks of the cascade: exact
 * normalized URL, and title/content buckets ordered by similarity measure so a lookup only
 * visits entries whose size can still reach the threshold.
 *
 * <p>Not thread-safe for writes. The per-cycle snapshot is filled once and then only read;
 * the in-cycle index is written by the single persistence stage.
 */
public class DedupIndex {
    private final Deduplicator deduplicator;
    private final Set<String> ids = new HashSet<>();
    private final Map<String, String> idsByUrl = new HashMap<>();
    private final NavigableMap<Integer, List<Entry>> titles = new TreeMap<>();
    private final NavigableMap<Integer, List<Entry>> contents = new TreeMap<>();
    private int size;

    DedupIndex(Deduplicator deduplicator) {
        this.deduplicator = deduplicator;
    }

    public void add(Item item) {
        Deduplicator.Keys keys = deduplicator.keysOf(item);
        String id = item.getId();
        if (id != null) ids.add(id);
        if (!keys.url.isEmpty()) idsByUrl.putIfAbsent(keys.url, id);
        if (!keys.title.isEmpty()) bucket(titles, keys.titleMeasure).add(new Entry(id, keys.title));
        if (!keys.content.isEmpty()) bucket(contents, keys.contentMeasure).add(new Entry(id, keys.content));
        size++;
    }

    public boolean containsId(String itemId) {
        return itemId != null && ids.contains(itemId);
    }

    public int size() {
        return size;
    }

    String idForUrl(String url) {
        return idsByUrl.get(url);
    }

    Iterable<Entry> titleCandidates(int measure, double threshold) {
        return candidates(titles, measure, threshold);
    }

    Iterable<Entry> contentCandidates(int measure, double threshold) {
        return candidates(contents, measure, threshold);
    }

    private static Iterable<Entry> candidates(NavigableMap<Integer, List<Entry>> buckets, int measure, double threshold) {
        int lo = (int) Math.ceil(measure * threshold - SimilarityFunction.EPSILON);
        int hi = (int) Math.floor(measure / threshold + SimilarityFunction.EPSILON);
        List<Entry> out = new ArrayList<>();
        if (lo > hi) return out;
        for (List<Entry> bucket : buckets.subMap(lo, true, hi, true).values()) {
            out.addAll(bucket);
        }
        return out;
    }

    private static List<Entry> bucket(NavigableMap<Integer, List<Entry>> map, int measure) {
        return map.computeIfAbsent(measure, k -> new ArrayList<>());
    }

    static final class Entry {
        final String id;
        final String text;

        Entry(String id, String text) {
            this.id = id;
            this.text = text;
        }
    }
}
