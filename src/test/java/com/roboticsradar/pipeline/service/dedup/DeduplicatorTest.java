package com.roboticsradar.pipeline.service.dedup;

import com.roboticsradar.pipeline.TestFixtures;
import com.roboticsradar.pipeline.model.Item;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DeduplicatorTest {
    private final Deduplicator dedup = new Deduplicator(TestFixtures.properties());

    private static String withEdits(String base, int edits) {
        StringBuilder sb = new StringBuilder(base);
        for (int i = 0; i < edits; i++) sb.setCharAt(i, sb.charAt(i) == 'z' ? 'y' : 'z');
        return sb.toString();
    }

    private static final String TITLE = "x".repeat(100);
    private static final String BODY_A = "m".repeat(100);
    private static final String BODY_B = "n".repeat(100);

    @Test
    public void trackingParametersDoNotHideUrlDuplicates() {
        Item stored = TestFixtures.item("1", "Figure 02 ships to BMW", "Body one", "https://example.com/figure-02");
        Item candidate = TestFixtures.item("2", "Completely different headline", "Other body",
                "https://www.example.com/figure-02/?utm_source=twitter&utm_campaign=launch");

        DuplicateMatch match = dedup.check(candidate, dedup.index(List.of(stored)));

        assertEquals(DuplicateMatch.Kind.URL, match.getKind());
        assertEquals(stored.getId(), match.getMatchedItemId());
    }

    @Test
    public void titleAtThresholdIsADuplicate() {
        Item stored = TestFixtures.item("1", TITLE, BODY_A, "https://a.example.com/1");
        Item candidate = TestFixtures.item("2", withEdits(TITLE, 20), BODY_B, "https://b.example.com/2");

        DuplicateMatch match = dedup.check(candidate, dedup.index(List.of(stored)));

        assertEquals(DuplicateMatch.Kind.TITLE, match.getKind());
        assertEquals(0.80, match.getSimilarity(), 1e-12);
    }

    @Test
    public void titleJustBelowThresholdIsNot() {
        Item stored = TestFixtures.item("1", TITLE, BODY_A, "https://a.example.com/1");
        Item candidate = TestFixtures.item("2", withEdits(TITLE, 21), BODY_B, "https://b.example.com/2");

        assertFalse(dedup.isDuplicate(candidate, List.of(stored)));
    }

    @Test
    public void titleComparisonIgnoresCaseAndSpacing() {
        Item stored = TestFixtures.item("1", "Tesla Optimus folds laundry", "", "https://a.example.com/1");
        Item candidate = TestFixtures.item("2", "  TESLA   optimus folds LAUNDRY ", "", "https://b.example.com/2");
        assertEquals(DuplicateMatch.Kind.TITLE, dedup.check(candidate, dedup.index(List.of(stored))).getKind());
    }

    @Test
    public void shorterTitleWithinLengthBoundStillMatches() {
        Item stored = TestFixtures.item("1", TITLE, BODY_A, "https://a.example.com/1");
        Item candidate = TestFixtures.item("2", TITLE.substring(0, 80), BODY_B, "https://b.example.com/2");
        assertEquals(DuplicateMatch.Kind.TITLE, dedup.check(candidate, dedup.index(List.of(stored))).getKind());
    }

    @Test
    public void similarTextsAreContentDuplicates() {
        String body = "q".repeat(100);
        Item stored = TestFixtures.item("1", "Unitree R1", body, "https://a.example.com/1");
        Item candidate = TestFixtures.item("2", "Budget bot", withEdits(body, 20), "https://b.example.com/2");

        DuplicateMatch match = dedup.check(candidate, dedup.index(List.of(stored)));

        assertEquals(DuplicateMatch.Kind.CONTENT, match.getKind());
        assertTrue(match.getSimilarity() >= 0.70);
        assertFalse(dedup.isDuplicate(
                TestFixtures.item("3", "Budget bot", withEdits(body, 40), "https://c.example.com/3"),
                List.of(stored)));
    }

    @Test
    public void emptyTitlesAndBodiesNeverMatch() {
        Item stored = TestFixtures.item("1", "", "", "");
        Item candidate = TestFixtures.item("2", "", "", "");
        assertEquals(DuplicateMatch.Kind.NONE, dedup.check(candidate, dedup.index(List.of(stored))).getKind());
    }

    @Test
    public void urlCheckRunsBeforeTitle() {
        Item byTitle = TestFixtures.item("1", "Tesla Optimus folds laundry", "", "https://a.example.com/1");
        Item byUrl = TestFixtures.item("2", "Something else entirely", "", "https://b.example.com/2");
        Item candidate = TestFixtures.item("3", "Tesla Optimus folds laundry", "", "http://b.example.com/2");

        DuplicateMatch match = dedup.check(candidate, dedup.index(List.of(byTitle, byUrl)));

        assertEquals(DuplicateMatch.Kind.URL, match.getKind());
        assertEquals(byUrl.getId(), match.getMatchedItemId());
    }

    @Test
    public void tokenSetSimilarityCanBeSelected() {
        Deduplicator tokenSet = new Deduplicator(new TokenSetSimilarity(), new UrlNormalizer(List.of()), 0.80, 0.70);
        Item stored = TestFixtures.item("1", "Boston Dynamics retires hydraulic Atlas robot", "", "https://a.example.com/1");
        Item candidate = TestFixtures.item("2", "Boston Dynamics retires the hydraulic Atlas robot", "", "https://b.example.com/2");
        assertEquals(DuplicateMatch.Kind.TITLE, tokenSet.check(candidate, tokenSet.index(List.of(stored))).getKind());
    }

    @Test
    public void indexTracksIds() {
        Item stored = TestFixtures.item("1", "Tesla Optimus folds laundry", "", "https://a.example.com/1");
        DedupIndex index = dedup.index(List.of(stored));
        assertTrue(index.containsId(stored.getId()));
        assertEquals(1, index.size());
        assertFalse(index.containsId("rss_2"));
    }
}
