package com.roboticsradar.pipeline.service.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roboticsradar.pipeline.TestFixtures;
import com.roboticsradar.pipeline.config.SourceSettings;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.SourceKind;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HackerNewsAdapterTest {
    private static final SourceSettings HN = new SourceSettings("hn", SourceKind.HACKERNEWS, null);

    private static final String STORY = "{\"id\":101,\"type\":\"story\",\"by\":\"pg\",\"title\":\"Show HN: A tiny robot arm\"," +
            "\"url\":\"https://example.com/arm\",\"score\":250,\"descendants\":80,\"time\":1741600800}";
    private static final String ASK = "{\"id\":102,\"type\":\"story\",\"by\":\"dang\",\"title\":\"Ask HN: Learning ROS?\"," +
            "\"text\":\"<p>Where do I <i>start</i>?</p>\",\"score\":12,\"descendants\":5,\"time\":1741600000}";
    private static final String JOB = "{\"id\":103,\"type\":\"job\",\"title\":\"Robotics startup is hiring\"}";

    private final HackerNewsAdapter adapter = new HackerNewsAdapter(TestFixtures.client(url -> {
        if (url.endsWith("/newstories.json")) return TestFixtures.ok("application/json", "[101,102,103,104]");
        if (url.endsWith("/item/101.json")) return TestFixtures.ok("application/json", STORY);
        if (url.endsWith("/item/102.json")) return TestFixtures.ok("application/json", ASK);
        if (url.endsWith("/item/103.json")) return TestFixtures.ok("application/json", JOB);
        return TestFixtures.status(HttpStatus.NOT_FOUND);
    }), TestFixtures.CLOCK, new ObjectMapper());

    @Test
    public void fetchesStoriesAndSkipsOtherTypesAndMissingItems() {
        List<Item> items = adapter.fetch(HN).collectList().block();

        assertNotNull(items);
        assertEquals(2, items.size());
        Item story = items.get(0);
        assertEquals("hackernews_101", story.getId());
        assertEquals(250, story.getEngagement().getLikes());
        assertEquals(80, story.getEngagement().getReplies());
        assertEquals("https://example.com/arm", story.getUrl());
    }

    @Test
    public void askPostsLinkToTheDiscussionAndKeepText() {
        Item ask = adapter.parseStory(ASK, HN);
        assertNotNull(ask);
        assertEquals("https://news.ycombinator.com/item?id=102", ask.getUrl());
        assertEquals("Where do I start?", ask.getBody());
    }

    @Test
    public void nonStoriesAreIgnored() {
        assertNull(adapter.parseStory(JOB, HN));
        assertNull(adapter.parseStory("{\"id\":5,\"type\":\"story\",\"title\":\"gone\",\"deleted\":true}", HN));
    }

    @Test
    public void storyListIsCappedByLimit() {
        SourceSettings small = new SourceSettings("hn-small", SourceKind.HACKERNEWS, null);
        small.setLimit(2);
        assertEquals(List.of(101L, 102L), adapter.storyIds("[101,102,103]", small));
    }

    @Test
    public void failingListingMakesSourceUnavailable() {
        HackerNewsAdapter down = new HackerNewsAdapter(
                TestFixtures.client(url -> TestFixtures.status(HttpStatus.SERVICE_UNAVAILABLE)), TestFixtures.CLOCK, new ObjectMapper());
        assertThrows(SourceUnavailableException.class, () -> down.fetch(HN).collectList().block());
    }
}
