package com.roboticsradar.pipeline.service.scoring;

import com.roboticsradar.pipeline.config.RadarProperties;
import com.roboticsradar.pipeline.model.FeedbackAggregate;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.ScoredItem;
import com.roboticsradar.pipeline.model.SourceKind;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Engagement, authority and feedback based ranking with exponential recency decay.
 *
 * <pre>
 * engagement   = likes * w_likes + shares * w_shares + replies * w_replies
 * authority    = ln(1 + followers)
 * source_bonus = sourceBonus[kind]
 * tag_bonus    = sum of tagBonus[tag]
 * feedback     = weightedFeedback * w_feedback
 * recency      = 0.5 ^ (ageHours / halfLife), in [0, 1]; future timestamps count as age 0
 * score        = (engagement + authority + source_bonus + tag_bonus + feedback) * recency
 * </pre>
 *
 * Items whose timestamp was inferred at fetch time get their recency factor multiplied by
 * the configured penalty. Scores are not clamped, so strong negative feedback can push a
 * score below zero and the breakdown still reproduces it exactly.
 */
@Service
public class ScoringEngine {
    public static final String ENGAGEMENT = "engagement";
    public static final String AUTHORITY = "authority";
    public static final String SOURCE_BONUS = "source_bonus";
    public static final String TAG_BONUS = "tag_bonus";
    public static final String FEEDBACK = "feedback";

    private final RadarProperties.Scoring weights;
    private final Map<SourceKind, Double> sourceBonus = new EnumMap<>(SourceKind.class);
    private final Map<String, Double> tagBonus = new HashMap<>();
    private final Clock clock;

    public ScoringEngine(RadarProperties properties, Clock clock) {
        this.weights = properties.getScoring();
        weights.getSourceBonus().forEach((k, v) -> sourceBonus.put(SourceKind.fromKey(k), v));
        weights.getTagBonus().forEach((k, v) -> tagBonus.put(k.toLowerCase(Locale.ROOT), v));
        this.clock = clock;
    }

    public ScoredItem score(Item item, FeedbackAggregate feedback) {
        return score(item, feedback, OffsetDateTime.now(clock));
    }

    public ScoredItem score(Item item, FeedbackAggregate feedback, OffsetDateTime now) {
        FeedbackAggregate agg = feedback != null ? feedback : FeedbackAggregate.empty();
        Map<String, Double> breakdown = new LinkedHashMap<>();
        breakdown.put(ENGAGEMENT, engagement(item));
        breakdown.put(AUTHORITY, Math.log1p(item.getAuthorFollowers()));
        breakdown.put(SOURCE_BONUS, item.getSourceKind() == null ? 0.0 : sourceBonus.getOrDefault(item.getSourceKind(), 0.0));
        double tags = 0.0;
        for (String tag : item.getTags()) {
            tags += tagBonus.getOrDefault(tag.toLowerCase(Locale.ROOT), 0.0);
        }
        breakdown.put(TAG_BONUS, tags);
        breakdown.put(FEEDBACK, agg.getWeightedSum() * weights.getFeedback());
        return new ScoredItem(item, breakdown, recencyFactor(item, now));
    }

    double engagement(Item item) {
        return item.getEngagement().getLikes() * weights.getLikes()
                + item.getEngagement().getShares() * weights.getShares()
                + item.getEngagement().getReplies() * weights.getReplies();
    }

    double recencyFactor(Item item, OffsetDateTime now) {
        double factor = 1.0;
        if (item.getPublishedAt() != null) {
            double ageHours = Duration.between(item.getPublishedAt(), now).toMillis() / 3_600_000.0;
            if (ageHours > 0) {
                factor = Math.pow(0.5, ageHours / weights.getHalfLifeHours());
            }
        }
        if (item.isTimestampInferred()) {
            factor *= weights.getInferredTimestampPenalty();
        }
        return Math.max(0.0, Math.min(1.0, factor));
    }
}
