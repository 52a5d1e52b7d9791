package com.roboticsradar.pipeline.service.store;

import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.ScoredItem;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Durable storage of scored items. During a cycle the pipeline is the only writer.
 */
public interface ItemStore {

    Mono<Boolean> exists(String itemId);

    /** Items ingested at or after {@code since}; the comparison window for deduplication. */
    Flux<Item> recentWindow(OffsetDateTime since);

    /** Stores the item in one statement; a second insert with the same id yields {@link InsertResult#ALREADY_EXISTS}. */
    Mono<InsertResult> insert(ScoredItem item);

    /** Replaces score, breakdown and recency factor of a stored item. Emits false when the id is unknown. */
    Mono<Boolean> updateScore(String itemId, double score, Map<String, Double> breakdown, double recencyFactor);

    Mono<ScoredItem> findById(String itemId);

    /** Highest scores first. */
    Flux<ScoredItem> topItems(int limit);
}
