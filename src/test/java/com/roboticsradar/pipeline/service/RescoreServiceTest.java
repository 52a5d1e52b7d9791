package com.roboticsradar.pipeline.service;

import com.roboticsradar.pipeline.TestFixtures;
import com.roboticsradar.pipeline.dto.CycleDtos;
import com.roboticsradar.pipeline.model.Engagement;
import com.roboticsradar.pipeline.model.FeedbackAggregate;
import com.roboticsradar.pipeline.model.FeedbackRecord;
import com.roboticsradar.pipeline.model.FeedbackType;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.ScoredItem;
import com.roboticsradar.pipeline.service.scoring.ScoringEngine;
import com.roboticsradar.pipeline.service.store.InMemoryItemStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RescoreServiceTest {
    private InMemoryItemStore store;
    private Map<String, FeedbackAggregate> feedback;
    private ScoringEngine engine;
    private RescoreService service;

    @BeforeEach
    public void setUp() {
        store = new InMemoryItemStore(TestFixtures::now);
        feedback = new HashMap<>();
        engine = new ScoringEngine(TestFixtures.properties(), TestFixtures.CLOCK);
        service = new RescoreService(store,
                itemId -> Mono.just(feedback.getOrDefault(itemId, FeedbackAggregate.empty())),
                engine, TestFixtures.CLOCK);
    }

    private ScoredItem stored(String externalId, int daysAgo) {
        Item item = TestFixtures.item(externalId, "Robot arm learns to fold towels " + externalId,
                "Researchers trained the arm on a few hundred demonstrations.", "https://example.com/" + externalId);
        item.setEngagement(new Engagement(10, 0, 0));
        ScoredItem scored = engine.score(item, FeedbackAggregate.empty());
        store.seed(scored, TestFixtures.now().minusDays(daysAgo));
        return scored;
    }

    @Test
    public void newFeedbackChangesStoredScore() {
        ScoredItem before = stored("1", 0);
        feedback.put(before.getId(), FeedbackAggregate.of(List.of(new FeedbackRecord(before.getId(), FeedbackType.LIKE, 1.0))));

        ScoredItem after = service.rescore(before.getId()).block();

        assertNotNull(after);
        assertEquals(3.0, after.getScoreBreakdown().get(ScoringEngine.FEEDBACK), 1e-12);
        assertTrue(after.getScore() > before.getScore());
        assertEquals(after.getScore(), store.findById(before.getId()).block().getScore(), 1e-12);
    }

    @Test
    public void unknownItemYieldsEmpty() {
        assertNull(service.rescore("rss_missing").block());
    }

    @Test
    public void rescoreRecentOnlyTouchesTheWindow() {
        stored("1", 1);
        stored("2", 2);
        stored("3", 20);

        CycleDtos.RescoreReport report = service.rescoreRecent(7).block();

        assertEquals(2, report.getRescored());
        assertEquals(7, report.getWindow_days());
    }

    @Test
    public void rescoreRecentRejectsNonPositiveWindow() {
        assertThrows(IllegalArgumentException.class, () -> service.rescoreRecent(0).block());
    }
}
