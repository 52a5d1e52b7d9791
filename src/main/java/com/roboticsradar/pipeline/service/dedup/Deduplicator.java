package com.roboticsradar.pipeline.service.dedup;

import com.roboticsradar.pipeline.config.RadarProperties;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.util.TextNormalizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;

/**
 * Near-duplicate detection against a window of known items.
 *
 * <p>The cascade stops at the first hit: normalized URL equality, then title similarity,
 * then content similarity. Comparisons run on lower-cased, whitespace-collapsed text and
 * thresholds are inclusive. Content is the item's full text; empty titles or texts never match.
 */
@Service
public class Deduplicator {
    private final SimilarityFunction similarity;
    private final UrlNormalizer urlNormalizer;
    private final double titleThreshold;
    private final double contentThreshold;

    @Autowired
    public Deduplicator(RadarProperties properties) {
        this(similarityFor(properties.getDedup().getSimilarity()),
                new UrlNormalizer(properties.getDedup().getTrackingParams()),
                properties.getDedup().getTitleThreshold(),
                properties.getDedup().getContentThreshold());
    }

    public Deduplicator(SimilarityFunction similarity, UrlNormalizer urlNormalizer,
                        double titleThreshold, double contentThreshold) {
        this.similarity = similarity;
        this.urlNormalizer = urlNormalizer;
        this.titleThreshold = titleThreshold;
        this.contentThreshold = contentThreshold;
    }

    static SimilarityFunction similarityFor(String name) {
        if ("token-set".equals(name)) return new TokenSetSimilarity();
        return new LevenshteinSimilarity();
    }

    public DedupIndex newIndex() {
        return new DedupIndex(this);
    }

    public DedupIndex index(Collection<? extends Item> items) {
        DedupIndex index = newIndex();
        for (Item item : items) index.add(item);
        return index;
    }

    public boolean isDuplicate(Item candidate, DedupIndex window) {
        return check(candidate, window).isDuplicate();
    }

    public boolean isDuplicate(Item candidate, Collection<? extends Item> window) {
        return check(candidate, index(window)).isDuplicate();
    }

    public DuplicateMatch check(Item candidate, DedupIndex window) {
        Keys keys = keysOf(candidate);

        if (!keys.url.isEmpty()) {
            String id = window.idForUrl(keys.url);
            if (id != null) return new DuplicateMatch(DuplicateMatch.Kind.URL, id, 1.0);
        }
        if (!keys.title.isEmpty()) {
            for (DedupIndex.Entry e : window.titleCandidates(keys.titleMeasure, titleThreshold)) {
                if (similarity.matches(keys.title, e.text, titleThreshold)) {
                    return new DuplicateMatch(DuplicateMatch.Kind.TITLE, e.id, similarity.similarity(keys.title, e.text));
                }
            }
        }
        if (!keys.content.isEmpty()) {
            for (DedupIndex.Entry e : window.contentCandidates(keys.contentMeasure, contentThreshold)) {
                if (similarity.matches(keys.content, e.text, contentThreshold)) {
                    return new DuplicateMatch(DuplicateMatch.Kind.CONTENT, e.id, similarity.similarity(keys.content, e.text));
                }
            }
        }
        return DuplicateMatch.none();
    }

    Keys keysOf(Item item) {
        String title = TextNormalizer.forComparison(item.getTitle());
        String content = TextNormalizer.forComparison(item.getText());
        return new Keys(urlNormalizer.normalize(item.getUrl()), title, similarity.measure(title),
                content, similarity.measure(content));
    }

    static final class Keys {
        final String url;
        final String title;
        final int titleMeasure;
        final String content;
        final int contentMeasure;

        Keys(String url, String title, int titleMeasure, String content, int contentMeasure) {
            this.url = url;
            this.title = title;
            this.titleMeasure = titleMeasure;
            this.content = content;
            this.contentMeasure = contentMeasure;
        }
    }
}
