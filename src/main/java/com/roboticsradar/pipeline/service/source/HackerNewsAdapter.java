package com.roboticsradar.pipeline.service.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roboticsradar.pipeline.config.SourceSettings;
import com.roboticsradar.pipeline.model.Engagement;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.SourceKind;
import com.roboticsradar.pipeline.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Hacker News through the public Firebase API: the story id list first, then one request
 * per story. Points map to likes and {@code descendants} to replies.
 *
 * <p>{@code url} is the API base and defaults to {@value #DEFAULT_BASE}; the listing
 * defaults to {@code newstories}.
 */
@Service
public class HackerNewsAdapter extends HttpSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(HackerNewsAdapter.class);
    static final String DEFAULT_BASE = "https://hacker-news.firebaseio.com/v0";
    private static final String ITEM_PAGE = "https://news.ycombinator.com/item?id=";
    private static final int ITEM_CONCURRENCY = 4;

    private final ObjectMapper mapper;

    public HackerNewsAdapter(@Qualifier("sourceClient") WebClient http, Clock clock, ObjectMapper mapper) {
        super(http, clock);
        this.mapper = mapper;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.HACKERNEWS;
    }

    @Override
    public Flux<Item> fetch(SourceSettings source) {
        String base = listingBase(source);
        String listing = source.getUrl() != null && source.getUrl().endsWith(".json")
                ? source.getUrl()
                : base + "/newstories.json";
        return get(source, listing)
                .flatMapIterable(json -> storyIds(json, source))
                .flatMapSequential(id -> fetchStory(source, base, id), ITEM_CONCURRENCY);
    }

    private Mono<Item> fetchStory(SourceSettings source, String base, long id) {
        return get(source, base + "/item/" + id + ".json")
                .flatMap(json -> Mono.justOrEmpty(parseStory(json, source)))
                .onErrorResume(SourceUnavailableException.class, e -> {
                    // one missing story does not make the whole source unavailable
                    log.warn("Skipping story {} from {}: {}", id, source.getName(), e.getMessage());
                    return Mono.empty();
                });
    }

    private static String listingBase(SourceSettings source) {
        String url = source.getUrl();
        if (url == null || url.isBlank()) return DEFAULT_BASE;
        String base = url.trim();
        if (base.endsWith(".json")) base = base.substring(0, base.lastIndexOf('/'));
        while (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return base;
    }

    List<Long> storyIds(String json, SourceSettings source) {
        JsonNode root = readTree(json, source);
        if (!root.isArray()) {
            throw new SourceUnavailableException(source.getName(), "story listing is not an array");
        }
        List<Long> ids = new ArrayList<>();
        for (JsonNode n : root) {
            if (ids.size() >= source.getLimit()) break;
            if (n.canConvertToLong()) ids.add(n.asLong());
        }
        return ids;
    }

    /** Parses one item document; returns null for anything that is not a live story. */
    Item parseStory(String json, SourceSettings source) {
        JsonNode story;
        try {
            story = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            logSkipped(source, new MalformedItemException("story is not JSON", e));
            return null;
        }
        if (story == null || story.isNull() || !"story".equals(story.path("type").asText())) return null;
        if (story.path("dead").asBoolean(false) || story.path("deleted").asBoolean(false)) return null;
        try {
            return toItem(story, source);
        } catch (MalformedItemException e) {
            logSkipped(source, e);
            return null;
        }
    }

    private Item toItem(JsonNode story, SourceSettings source) {
        long id = story.path("id").asLong(0);
        String title = story.path("title").asText("");
        if (id <= 0 || title.isEmpty()) {
            throw new MalformedItemException("story without id or title");
        }
        String url = story.path("url").asText("");

        Item item = new Item();
        item.setExternalId(String.valueOf(id));
        item.setSourceKind(SourceKind.HACKERNEWS);
        item.setSourceName(source.getName());
        item.setTitle(TextNormalizer.sanitizeTitle(title));
        item.setBody(htmlToText(story.path("text").asText("")));
        item.setUrl(url.isEmpty() ? ITEM_PAGE + id : url);
        String by = story.path("by").asText("");
        item.setAuthorId(by.isEmpty() ? null : by);
        item.setAuthorName(by.isEmpty() ? null : by);
        item.setEngagement(new Engagement(story.path("score").asLong(0), 0, story.path("descendants").asLong(0)));
        JsonNode time = story.path("time");
        applyTimestamp(item, time.isNumber()
                ? OffsetDateTime.ofInstant(Instant.ofEpochSecond(time.asLong()), ZoneOffset.UTC)
                : null);
        return item;
    }

    private JsonNode readTree(String json, SourceSettings source) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException(source.getName(), "response is not JSON", e);
        }
    }
}
