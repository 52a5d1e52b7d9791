package com.roboticsradar.pipeline.service.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roboticsradar.pipeline.TestFixtures;
import com.roboticsradar.pipeline.config.SourceSettings;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.SourceKind;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class GitHubAdapterTest {
    private static final String SEARCH = "{\"total_count\":2,\"items\":[" +
            "{\"id\":42,\"full_name\":\"acme/robot-sdk\",\"description\":\"SDK for the Acme robot arm\",\"topics\":[\"robotics\",\"ros2\"]," +
            "\"html_url\":\"https://github.com/acme/robot-sdk\",\"owner\":{\"login\":\"acme\"},\"stargazers_count\":310," +
            "\"forks_count\":25,\"pushed_at\":\"2025-03-09T18:30:00Z\",\"created_at\":\"2023-01-01T00:00:00Z\"}," +
            "{\"full_name\":\"broken/no-id\"}]}";

    @Test
    public void mapsRepositoriesToItems() {
        GitHubAdapter adapter = new GitHubAdapter(
                TestFixtures.client(url -> TestFixtures.ok("application/json", SEARCH)), TestFixtures.CLOCK, new ObjectMapper());
        SourceSettings source = new SourceSettings("gh", SourceKind.GITHUB, "https://api.github.com/search/repositories?q=robotics");

        List<Item> items = adapter.parse(SEARCH, source);

        assertEquals(1, items.size());
        Item repo = items.get(0);
        assertEquals("github_42", repo.getId());
        assertEquals("acme/robot-sdk", repo.getTitle());
        assertEquals("SDK for the Acme robot arm Topics: robotics, ros2", repo.getBody());
        assertEquals(310, repo.getEngagement().getLikes());
        assertEquals(25, repo.getEngagement().getShares());
        assertEquals("acme", repo.getAuthorId());
        assertEquals(OffsetDateTime.parse("2025-03-09T18:30:00Z"), repo.getPublishedAt());
    }

    @Test
    public void sendsConfiguredTokenAsBearer() {
        AtomicReference<String> auth = new AtomicReference<>();
        WebClient client = WebClient.builder().exchangeFunction(request -> {
            auth.set(request.headers().getFirst("Authorization"));
            return Mono.just(TestFixtures.ok("application/json", SEARCH));
        }).build();
        GitHubAdapter adapter = new GitHubAdapter(client, TestFixtures.CLOCK, new ObjectMapper());
        SourceSettings source = new SourceSettings("gh", SourceKind.GITHUB, "https://api.github.com/search/repositories?q=robotics");
        source.setToken("secret-token");

        assertEquals(1, adapter.fetch(source).count().block());
        assertEquals("Bearer secret-token", auth.get());
    }

    @Test
    public void unauthorizedIsUnavailable() {
        GitHubAdapter adapter = new GitHubAdapter(
                TestFixtures.client(url -> TestFixtures.status(HttpStatus.UNAUTHORIZED)), TestFixtures.CLOCK, new ObjectMapper());
        SourceSettings source = new SourceSettings("gh", SourceKind.GITHUB, "https://api.github.com/search/repositories?q=robotics");
        assertThrows(SourceUnavailableException.class, () -> adapter.fetch(source).blockLast());
    }
}
