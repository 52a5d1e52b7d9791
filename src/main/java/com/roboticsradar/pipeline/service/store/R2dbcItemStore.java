package com.roboticsradar.pipeline.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roboticsradar.pipeline.model.Engagement;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.ScoredItem;
import com.roboticsradar.pipeline.model.SourceKind;
import com.roboticsradar.pipeline.util.SchemaInit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL item table through R2DBC. The table is created on first use; list and map
 * fields are stored as JSON text.
 */
@Service
public class R2dbcItemStore implements ItemStore {
    private static final Logger log = LoggerFactory.getLogger(R2dbcItemStore.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Double>> BREAKDOWN = new TypeReference<>() {};

    private static final String COLUMNS = "id, source_kind, source_name, external_id, title, body, url, " +
            "author_id, author_name, author_followers, likes, shares, replies, published_at, timestamp_inferred, " +
            "language, keywords, tags, score, score_breakdown, recency_factor, ingested_at, scored_at";

    private final DatabaseClient db;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Mono<Void> schemaReady;

    public R2dbcItemStore(DatabaseClient db, ObjectMapper mapper, Clock clock) {
        this.db = db;
        this.mapper = mapper;
        this.clock = clock;
        this.schemaReady = SchemaInit.once(ensureSchema());
    }

    private Mono<Void> ensureSchema() {
        String ddl = "CREATE TABLE IF NOT EXISTS radar_items (" +
                "id TEXT PRIMARY KEY, " +
                "source_kind TEXT NOT NULL, " +
                "source_name TEXT, " +
                "external_id TEXT NOT NULL, " +
                "title TEXT, " +
                "body TEXT, " +
                "url TEXT, " +
                "author_id TEXT, " +
                "author_name TEXT, " +
                "author_followers BIGINT DEFAULT 0, " +
                "likes BIGINT DEFAULT 0, " +
                "shares BIGINT DEFAULT 0, " +
                "replies BIGINT DEFAULT 0, " +
                "published_at TIMESTAMPTZ, " +
                "timestamp_inferred BOOLEAN DEFAULT FALSE, " +
                "language TEXT, " +
                "keywords TEXT, " +
                "tags TEXT, " +
                "score DOUBLE PRECISION, " +
                "score_breakdown TEXT, " +
                "recency_factor DOUBLE PRECISION, " +
                "ingested_at TIMESTAMPTZ NOT NULL DEFAULT NOW(), " +
                "scored_at TIMESTAMPTZ" +
                ")";
        String index = "CREATE INDEX IF NOT EXISTS radar_items_ingested_at ON radar_items (ingested_at)";
        return db.sql(ddl).fetch().rowsUpdated()
                .then(db.sql(index).fetch().rowsUpdated())
                .doOnError(e -> log.error("failed to create radar_items schema: {}", e.toString()))
                .then();
    }

    @Override
    public Mono<Boolean> exists(String itemId) {
        if (itemId == null || itemId.isBlank()) return Mono.just(false);
        return schemaReady.then(db.sql("SELECT 1 FROM radar_items WHERE id = :id")
                .bind("id", itemId)
                .fetch().first()
                .map(m -> true)
                .defaultIfEmpty(false));
    }

    @Override
    public Flux<Item> recentWindow(OffsetDateTime since) {
        return schemaReady.thenMany(db.sql("SELECT " + COLUMNS + " FROM radar_items WHERE ingested_at >= :since")
                .bind("since", since)
                .fetch().all()
                .map(this::toItem));
    }

    @Override
    public Mono<InsertResult> insert(ScoredItem item) {
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        DatabaseClient.GenericExecuteSpec spec = db.sql("INSERT INTO radar_items(" + COLUMNS + ") VALUES(" +
                        ":id, :source_kind, :source_name, :external_id, :title, :body, :url, :author_id, :author_name, " +
                        ":author_followers, :likes, :shares, :replies, :published_at, :timestamp_inferred, :language, " +
                        ":keywords, :tags, :score, :score_breakdown, :recency_factor, :ingested_at, :scored_at) " +
                        "ON CONFLICT (id) DO NOTHING")
                .bind("id", item.getId())
                .bind("source_kind", item.getSourceKind().key())
                .bind("external_id", item.getExternalId())
                .bind("author_followers", item.getAuthorFollowers())
                .bind("likes", item.getEngagement().getLikes())
                .bind("shares", item.getEngagement().getShares())
                .bind("replies", item.getEngagement().getReplies())
                .bind("timestamp_inferred", item.isTimestampInferred())
                .bind("keywords", toJson(item.getKeywords()))
                .bind("tags", toJson(List.copyOf(item.getTags())))
                .bind("score", item.scoreValue())
                .bind("score_breakdown", toJson(item.getScoreBreakdown()))
                .bind("recency_factor", item.getRecencyFactor())
                .bind("ingested_at", now)
                .bind("scored_at", now);
        spec = bindNullable(spec, "source_name", item.getSourceName(), String.class);
        spec = bindNullable(spec, "title", item.getTitle(), String.class);
        spec = bindNullable(spec, "body", item.getBody(), String.class);
        spec = bindNullable(spec, "url", item.getUrl(), String.class);
        spec = bindNullable(spec, "author_id", item.getAuthorId(), String.class);
        spec = bindNullable(spec, "author_name", item.getAuthorName(), String.class);
        spec = bindNullable(spec, "published_at", item.getPublishedAt(), OffsetDateTime.class);
        spec = bindNullable(spec, "language", item.getLanguage(), String.class);
        DatabaseClient.GenericExecuteSpec insert = spec;
        return schemaReady.then(insert.fetch().rowsUpdated())
                .map(rows -> rows > 0 ? InsertResult.INSERTED : InsertResult.ALREADY_EXISTS);
    }

    @Override
    public Mono<Boolean> updateScore(String itemId, double score, Map<String, Double> breakdown, double recencyFactor) {
        return schemaReady.then(db.sql("UPDATE radar_items SET score = :score, score_breakdown = :breakdown, " +
                                "recency_factor = :recency, scored_at = :scored_at WHERE id = :id")
                        .bind("score", score)
                        .bind("breakdown", toJson(breakdown))
                        .bind("recency", recencyFactor)
                        .bind("scored_at", OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC))
                        .bind("id", itemId)
                        .fetch().rowsUpdated())
                .map(rows -> rows > 0);
    }

    @Override
    public Mono<ScoredItem> findById(String itemId) {
        return schemaReady.then(db.sql("SELECT " + COLUMNS + " FROM radar_items WHERE id = :id")
                .bind("id", itemId)
                .fetch().first()
                .map(this::toScoredItem));
    }

    @Override
    public Flux<ScoredItem> topItems(int limit) {
        return schemaReady.thenMany(db.sql("SELECT " + COLUMNS + " FROM radar_items ORDER BY score DESC NULLS LAST LIMIT :limit")
                .bind("limit", Math.max(1, limit))
                .fetch().all()
                .map(this::toScoredItem));
    }

    private static <T> DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec spec, String name, T value, Class<T> type) {
        return value != null ? spec.bind(name, value) : spec.bindNull(name, type);
    }

    private Item toItem(Map<String, Object> row) {
        Item item = new Item();
        item.setExternalId(str(row.get("external_id")));
        item.setSourceKind(SourceKind.fromKey(str(row.get("source_kind"))));
        item.setSourceName(str(row.get("source_name")));
        item.setTitle(str(row.get("title")));
        item.setBody(str(row.get("body")));
        item.setUrl(str(row.get("url")));
        item.setAuthorId(str(row.get("author_id")));
        item.setAuthorName(str(row.get("author_name")));
        item.setAuthorFollowers(num(row.get("author_followers")));
        item.setEngagement(new Engagement(num(row.get("likes")), num(row.get("shares")), num(row.get("replies"))));
        item.setPublishedAt(time(row.get("published_at")));
        item.setTimestampInferred(Boolean.TRUE.equals(row.get("timestamp_inferred")));
        item.setLanguage(str(row.get("language")));
        item.setKeywords(fromJson(str(row.get("keywords")), STRING_LIST));
        List<String> tags = fromJson(str(row.get("tags")), STRING_LIST);
        item.setTags(tags == null ? null : new LinkedHashSet<>(tags));
        Object score = row.get("score");
        item.setScore(score instanceof Number n ? n.doubleValue() : null);
        return item;
    }

    private ScoredItem toScoredItem(Map<String, Object> row) {
        Item item = toItem(row);
        Map<String, Double> breakdown = fromJson(str(row.get("score_breakdown")), BREAKDOWN);
        Object rf = row.get("recency_factor");
        ScoredItem scored = new ScoredItem(item, breakdown != null ? breakdown : new LinkedHashMap<>(),
                rf instanceof Number n ? n.doubleValue() : 1.0);
        // keep the stored score even if the breakdown predates a formula change
        scored.setScore(item.getScore());
        return scored;
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize " + value, e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) return null;
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("unreadable JSON column: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String str(Object o) {
        return o == null ? null : String.valueOf(o);
    }

    private static long num(Object o) {
        return o instanceof Number n ? n.longValue() : 0L;
    }

    private static OffsetDateTime time(Object o) {
        if (o instanceof OffsetDateTime odt) return odt.withOffsetSameInstant(ZoneOffset.UTC);
        if (o instanceof Instant i) return OffsetDateTime.ofInstant(i, ZoneOffset.UTC);
        if (o instanceof LocalDateTime ldt) return ldt.atOffset(ZoneOffset.UTC);
        return null;
    }
}
