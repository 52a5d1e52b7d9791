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
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * GitHub repository search results. Stars map to likes and forks to shares; the owner is
 * the author. {@code pushed_at} is the timestamp, falling back to {@code created_at}.
 */
@Service
public class GitHubAdapter extends HttpSourceAdapter {
    private final ObjectMapper mapper;

    public GitHubAdapter(@Qualifier("sourceClient") WebClient http, Clock clock, ObjectMapper mapper) {
        super(http, clock);
        this.mapper = mapper;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.GITHUB;
    }

    @Override
    public Flux<Item> fetch(SourceSettings source) {
        return get(source, source.getUrl(), h -> {
                    h.set(HttpHeaders.ACCEPT, "application/vnd.github+json");
                    if (source.getToken() != null && !source.getToken().isBlank()) {
                        h.setBearerAuth(source.getToken().trim());
                    }
                })
                .flatMapIterable(json -> parse(json, source));
    }

    List<Item> parse(String json, SourceSettings source) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException(source.getName(), "search response is not JSON", e);
        }
        JsonNode repos = root.path("items");
        if (!repos.isArray()) {
            throw new SourceUnavailableException(source.getName(), "search response has no items");
        }
        List<Item> items = new ArrayList<>();
        for (JsonNode repo : repos) {
            if (items.size() >= source.getLimit()) break;
            try {
                items.add(toItem(repo, source));
            } catch (MalformedItemException e) {
                logSkipped(source, e);
            }
        }
        return items;
    }

    private Item toItem(JsonNode repo, SourceSettings source) {
        String id = repo.path("id").asText("");
        String name = repo.path("full_name").asText("");
        if (id.isEmpty() || name.isEmpty()) {
            throw new MalformedItemException("repository without id or name");
        }
        StringBuilder body = new StringBuilder(repo.path("description").asText(""));
        JsonNode topics = repo.path("topics");
        if (topics.isArray() && topics.size() > 0) {
            List<String> names = new ArrayList<>();
            topics.forEach(t -> names.add(t.asText()));
            body.append(" Topics: ").append(String.join(", ", names));
        }

        Item item = new Item();
        item.setExternalId(id);
        item.setSourceKind(SourceKind.GITHUB);
        item.setSourceName(source.getName());
        item.setTitle(name);
        item.setBody(TextNormalizer.collapse(body.toString()));
        item.setUrl(repo.path("html_url").asText(""));
        JsonNode owner = repo.path("owner");
        String login = owner.path("login").asText("");
        item.setAuthorId(login.isEmpty() ? null : login);
        item.setAuthorName(login.isEmpty() ? null : login);
        item.setEngagement(new Engagement(repo.path("stargazers_count").asLong(0), repo.path("forks_count").asLong(0), 0));

        String ts = repo.path("pushed_at").asText("");
        if (ts.isEmpty()) ts = repo.path("created_at").asText("");
        applyTimestamp(item, parseIso(ts));
        return item;
    }

    private static OffsetDateTime parseIso(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return OffsetDateTime.parse(s.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
