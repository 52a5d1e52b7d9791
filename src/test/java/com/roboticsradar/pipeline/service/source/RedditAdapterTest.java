package com.roboticsradar.pipeline.service.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roboticsradar.pipeline.TestFixtures;
import com.roboticsradar.pipeline.config.SourceSettings;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.SourceKind;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RedditAdapterTest {
    private static final SourceSettings SUB = new SourceSettings("r-robotics", SourceKind.REDDIT, "https://www.reddit.com/r/robotics/new.json");

    private static final String LISTING = "{\"kind\":\"Listing\",\"data\":{\"children\":[" +
            "{\"kind\":\"t3\",\"data\":{\"id\":\"sticky\",\"title\":\"Weekly thread\",\"stickied\":true}}," +
            "{\"kind\":\"t3\",\"data\":{\"id\":\"1abc\",\"title\":\"My robot arm build\",\"selftext\":\"Built a 6-DOF arm with ROS 2.\"," +
            "\"is_self\":true,\"permalink\":\"/r/robotics/comments/1abc/my_robot_arm_build/\",\"url\":\"https://www.reddit.com/r/robotics/comments/1abc/\"," +
            "\"author\":\"maker42\",\"score\":120,\"num_comments\":34,\"created_utc\":1741600800}}," +
            "{\"kind\":\"t3\",\"data\":{\"id\":\"1def\",\"title\":\"Unitree G1 teardown\",\"selftext\":\"\",\"is_self\":false," +
            "\"permalink\":\"/r/robotics/comments/1def/\",\"url\":\"https://example.com/g1-teardown\",\"author\":\"someone\",\"score\":-3,\"num_comments\":2}}," +
            "{\"kind\":\"t3\",\"data\":{\"title\":\"no id\"}}" +
            "]}}";

    private final RedditAdapter adapter = new RedditAdapter(
            TestFixtures.client(url -> TestFixtures.ok("application/json", LISTING)), TestFixtures.CLOCK, new ObjectMapper());

    @Test
    public void mapsPostsToItems() {
        List<Item> items = adapter.parse(LISTING, SUB);

        assertEquals(2, items.size(), "stickied and id-less posts are skipped");
        Item self = items.get(0);
        assertEquals("reddit_1abc", self.getId());
        assertEquals("https://www.reddit.com/r/robotics/comments/1abc/my_robot_arm_build/", self.getUrl());
        assertEquals(120, self.getEngagement().getLikes());
        assertEquals(34, self.getEngagement().getReplies());
        assertEquals(0, self.getEngagement().getShares());
        assertEquals("maker42", self.getAuthorId());
        assertEquals(OffsetDateTime.parse("2025-03-10T10:00:00Z"), self.getPublishedAt());
    }

    @Test
    public void linkPostsKeepExternalUrlAndClampScore() {
        Item link = adapter.parse(LISTING, SUB).get(1);
        assertEquals("https://example.com/g1-teardown", link.getUrl());
        assertEquals(0, link.getEngagement().getLikes());
        assertTrue(link.isTimestampInferred());
    }

    @Test
    public void nonJsonListingIsUnavailable() {
        assertThrows(SourceUnavailableException.class, () -> adapter.parse("<html>rate limited</html>", SUB));
    }

    @Test
    public void fetchParsesTheListing() {
        assertEquals(2, adapter.fetch(SUB).count().block());
    }
}
