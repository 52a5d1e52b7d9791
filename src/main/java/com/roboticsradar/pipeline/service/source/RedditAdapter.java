package com.roboticsradar.pipeline.service.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roboticsradar.pipeline.config.SourceSettings;
import com.roboticsradar.pipeline.model.Engagement;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.SourceKind;
import com.roboticsradar.pipeline.util.TextNormalizer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Subreddit listings ({@code https://www.reddit.com/r/<sub>/new.json}). Upvote score maps
 * to likes and comment count to replies. Self posts link to their permalink.
 */
@Service
public class RedditAdapter extends HttpSourceAdapter {
    private static final String REDDIT_BASE = "https://www.reddit.com";

    private final ObjectMapper mapper;

    public RedditAdapter(@Qualifier("sourceClient") WebClient http, Clock clock, ObjectMapper mapper) {
        super(http, clock);
        this.mapper = mapper;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.REDDIT;
    }

    @Override
    public Flux<Item> fetch(SourceSettings source) {
        return get(source, source.getUrl(), h -> h.set("Accept", "application/json"))
                .flatMapIterable(json -> parse(json, source));
    }

    List<Item> parse(String json, SourceSettings source) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException(source.getName(), "listing is not JSON", e);
        }
        JsonNode children = root.path("data").path("children");
        if (!children.isArray()) {
            throw new SourceUnavailableException(source.getName(), "unexpected listing shape");
        }
        List<Item> items = new ArrayList<>();
        for (JsonNode child : children) {
            if (items.size() >= source.getLimit()) break;
            JsonNode post = child.path("data");
            if (post.path("stickied").asBoolean(false)) continue;
            try {
                items.add(toItem(post, source));
            } catch (MalformedItemException e) {
                logSkipped(source, e);
            }
        }
        return items;
    }

    private Item toItem(JsonNode post, SourceSettings source) {
        String id = post.path("id").asText("");
        String title = post.path("title").asText("");
        if (id.isEmpty() || title.isEmpty()) {
            throw new MalformedItemException("post without id or title");
        }
        String permalink = post.path("permalink").asText("");
        boolean self = post.path("is_self").asBoolean(false);
        String url = self || post.path("url").asText("").isEmpty()
                ? (permalink.isEmpty() ? "" : REDDIT_BASE + permalink)
                : post.path("url").asText();

        Item item = new Item();
        item.setExternalId(id);
        item.setSourceKind(SourceKind.REDDIT);
        item.setSourceName(source.getName());
        item.setTitle(TextNormalizer.sanitizeTitle(title));
        item.setBody(TextNormalizer.collapse(post.path("selftext").asText("")));
        item.setUrl(url);
        String author = post.path("author").asText("");
        item.setAuthorId(author.isEmpty() ? null : author);
        item.setAuthorName(author.isEmpty() ? null : author);
        item.setEngagement(new Engagement(post.path("score").asLong(0), 0, post.path("num_comments").asLong(0)));

        JsonNode created = post.path("created_utc");
        OffsetDateTime ts = created.isNumber()
                ? OffsetDateTime.ofInstant(Instant.ofEpochSecond(created.asLong()), ZoneOffset.UTC)
                : null;
        applyTimestamp(item, ts);
        return item;
    }
}
