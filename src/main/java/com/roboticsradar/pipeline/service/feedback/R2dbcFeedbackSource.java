package com.roboticsradar.pipeline.service.feedback;

import com.roboticsradar.pipeline.model.FeedbackAggregate;
import com.roboticsradar.pipeline.model.FeedbackRecord;
import com.roboticsradar.pipeline.model.FeedbackType;
import com.roboticsradar.pipeline.util.SchemaInit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;


@Service
public class R2dbcFeedbackSource implements FeedbackSource {
    private static final Logger log = LoggerFactory.getLogger(R2dbcFeedbackSource.class);
    private final DatabaseClient db;
    private final Mono<Void> schemaReady;

    public R2dbcFeedbackSource(DatabaseClient db) {
        this.db = db;
        this.schemaReady = SchemaInit.once(ensureSchema());
    }

    private Mono<Void> ensureSchema() {
        String ddl = "CREATE TABLE IF NOT EXISTS item_feedback (" +
                "id BIGSERIAL PRIMARY KEY, " +
                "item_id TEXT NOT NULL, " +
                "feedback_type TEXT NOT NULL, " +
                "weight DOUBLE PRECISION DEFAULT 1.0, " +
                "created_at TIMESTAMPTZ DEFAULT NOW()" +
                ")";
        return db.sql(ddl).fetch().rowsUpdated().then();
    }

    @Override
    public Mono<FeedbackAggregate> getFeedbackAggregate(String itemId) {
        if (itemId == null || itemId.isBlank()) return Mono.just(FeedbackAggregate.empty());
        return schemaReady.thenMany(db.sql("SELECT feedback_type, weight FROM item_feedback WHERE item_id = :id")
                        .bind("id", itemId)
                        .fetch().all()
                        .map(row -> {
                            Object w = row.get("weight");
                            return new FeedbackRecord(itemId,
                                    FeedbackType.parse(row.get("feedback_type") == null ? null : String.valueOf(row.get("feedback_type"))),
                                    w instanceof Number n ? n.doubleValue() : 1.0);
                        }))
                .collectList()
                .map(FeedbackAggregate::of)
                .onErrorResume(e -> {
                    log.warn("feedback lookup failed for {}: {}", itemId, e.toString());
                    return Mono.just(FeedbackAggregate.empty());
                });
    }
}
