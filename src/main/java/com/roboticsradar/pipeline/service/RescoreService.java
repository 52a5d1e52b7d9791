package com.roboticsradar.pipeline.service;

import com.roboticsradar.pipeline.dto.CycleDtos;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.ScoredItem;
import com.roboticsradar.pipeline.service.feedback.FeedbackSource;
import com.roboticsradar.pipeline.service.scoring.ScoringEngine;
import com.roboticsradar.pipeline.service.store.ItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Recomputes stored scores with current feedback and the current time, e.g. after new
 * feedback arrived or to let recency decay catch up.
 */
@Service
public class RescoreService {
    private static final Logger log = LoggerFactory.getLogger(RescoreService.class);

    private final ItemStore store;
    private final FeedbackSource feedback;
    private final ScoringEngine scoringEngine;
    private final Clock clock;

    public RescoreService(ItemStore store, FeedbackSource feedback, ScoringEngine scoringEngine, Clock clock) {
        this.store = store;
        this.feedback = feedback;
        this.scoringEngine = scoringEngine;
        this.clock = clock;
    }

    /** Rescored item, or empty when no item has this id. */
    public Mono<ScoredItem> rescore(String itemId) {
        return store.findById(itemId).flatMap(this::rescoreItem);
    }

    /** Rescores every item ingested in the last {@code days} days. */
    public Mono<CycleDtos.RescoreReport> rescoreRecent(int days) {
        if (days < 1) {
            return Mono.error(new IllegalArgumentException("days must be >= 1"));
        }
        OffsetDateTime since = OffsetDateTime.now(clock).minusDays(days);
        return store.recentWindow(since)
                .concatMap(this::rescoreItem)
                .count()
                .map(n -> {
                    log.info("Rescored {} items from the last {} days", n, days);
                    return new CycleDtos.RescoreReport(n.intValue(), days);
                });
    }

    private Mono<ScoredItem> rescoreItem(Item item) {
        return feedback.getFeedbackAggregate(item.getId())
                .map(agg -> scoringEngine.score(item, agg))
                .flatMap(scored -> store.updateScore(scored.getId(), scored.scoreValue(),
                                scored.getScoreBreakdown(), scored.getRecencyFactor())
                        .flatMap(updated -> updated ? Mono.just(scored) : Mono.<ScoredItem>empty()));
    }
}
