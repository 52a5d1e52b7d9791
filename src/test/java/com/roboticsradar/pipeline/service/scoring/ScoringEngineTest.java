package com.roboticsradar.pipeline.service.scoring;

import com.roboticsradar.pipeline.TestFixtures;
import com.roboticsradar.pipeline.config.RadarProperties;
import com.roboticsradar.pipeline.model.Engagement;
import com.roboticsradar.pipeline.model.FeedbackAggregate;
import com.roboticsradar.pipeline.model.FeedbackRecord;
import com.roboticsradar.pipeline.model.FeedbackType;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.ScoredItem;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ScoringEngineTest {
    private final ScoringEngine engine = new ScoringEngine(TestFixtures.properties(), TestFixtures.CLOCK);

    private static Item popular() {
        Item item = TestFixtures.item("1", "Figure 02 in production", "Body", "https://example.com/1");
        item.setEngagement(new Engagement(100, 50, 25));
        item.setAuthorFollowers(10_000);
        item.setPublishedAt(TestFixtures.now());
        return item;
    }

    @Test
    public void freshItemScoresEngagementPlusAuthority() {
        ScoredItem scored = engine.score(popular(), FeedbackAggregate.empty());

        assertEquals(246.71044036697651, scored.getScore(), 1e-9);
        assertEquals(237.5, scored.getScoreBreakdown().get(ScoringEngine.ENGAGEMENT), 1e-12);
        assertEquals(Math.log(10_001), scored.getScoreBreakdown().get(ScoringEngine.AUTHORITY), 1e-12);
        assertEquals(1.0, scored.getRecencyFactor());
    }

    @Test
    public void scoreIsReproducibleFromBreakdown() {
        Item item = popular();
        item.setPublishedAt(TestFixtures.now().minusHours(30));
        ScoredItem scored = engine.score(item, FeedbackAggregate.of(List.of(new FeedbackRecord("rss_1", FeedbackType.SAVE, 2.0))));

        double sum = scored.getScoreBreakdown().values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(sum * scored.getRecencyFactor(), scored.getScore(), 1e-9);
        assertEquals(6.0, scored.getScoreBreakdown().get(ScoringEngine.FEEDBACK), 1e-12);
    }

    @Test
    public void oneHalfLifeHalvesTheScore() {
        Item item = popular();
        item.setPublishedAt(TestFixtures.now().minusHours(48));
        ScoredItem scored = engine.score(item, FeedbackAggregate.empty());

        assertEquals(0.5, scored.getRecencyFactor(), 1e-12);
        assertEquals(246.71044036697651 / 2, scored.getScore(), 1e-9);
    }

    @Test
    public void futureTimestampsCountAsFresh() {
        Item item = popular();
        item.setPublishedAt(TestFixtures.now().plusHours(5));
        assertEquals(1.0, engine.score(item, FeedbackAggregate.empty()).getRecencyFactor());
    }

    @Test
    public void inferredTimestampIsPenalized() {
        Item item = popular();
        item.setTimestampInferred(true);
        ScoredItem scored = engine.score(item, FeedbackAggregate.empty());

        assertEquals(0.75, scored.getRecencyFactor(), 1e-12);
        assertEquals(246.71044036697651 * 0.75, scored.getScore(), 1e-9);
    }

    @Test
    public void moreLikesNeverLowerTheScore() {
        double previous = Double.NEGATIVE_INFINITY;
        for (long likes = 0; likes <= 1000; likes += 100) {
            Item item = popular();
            item.setEngagement(new Engagement(likes, 50, 25));
            double score = engine.score(item, FeedbackAggregate.empty()).getScore();
            assertTrue(score >= previous);
            previous = score;
        }
    }

    @Test
    public void negativeFeedbackCanPushScoreBelowZero() {
        Item item = TestFixtures.item("2", "Quiet post", "Body", "https://example.com/2");
        FeedbackAggregate dislikes = FeedbackAggregate.of(List.of(
                new FeedbackRecord("rss_2", FeedbackType.DISLIKE, 1.0),
                new FeedbackRecord("rss_2", FeedbackType.DISLIKE, 1.0)));

        ScoredItem scored = engine.score(item, dislikes);

        assertEquals(-6.0, scored.getScoreBreakdown().get(ScoringEngine.FEEDBACK), 1e-12);
        assertTrue(scored.getScore() < 0);
    }

    @Test
    public void sourceAndTagBonusesAreApplied() {
        RadarProperties props = TestFixtures.properties();
        props.getScoring().setSourceBonus(Map.of("rss", 2.0));
        props.getScoring().setTagBonus(Map.of("Humanoids", 1.5));
        ScoringEngine withBonus = new ScoringEngine(props, TestFixtures.CLOCK);
        Item item = popular();
        Set<String> tags = new LinkedHashSet<>(List.of("humanoids", "software"));
        item.setTags(tags);

        ScoredItem scored = withBonus.score(item, FeedbackAggregate.empty());

        assertEquals(2.0, scored.getScoreBreakdown().get(ScoringEngine.SOURCE_BONUS), 1e-12);
        assertEquals(1.5, scored.getScoreBreakdown().get(ScoringEngine.TAG_BONUS), 1e-12);
        assertEquals(246.71044036697651 + 3.5, scored.getScore(), 1e-9);
    }

    @Test
    public void scoringIsIdempotent() {
        Item item = popular();
        item.setPublishedAt(TestFixtures.now().minusHours(7));
        ScoredItem first = engine.score(item, FeedbackAggregate.empty());
        ScoredItem second = engine.score(item, FeedbackAggregate.empty());

        assertEquals(first.getScore(), second.getScore());
        assertEquals(first.getScoreBreakdown(), second.getScoreBreakdown());
    }
}
