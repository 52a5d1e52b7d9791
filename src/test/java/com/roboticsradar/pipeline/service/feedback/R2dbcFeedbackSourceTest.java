package com.roboticsradar.pipeline.service.feedback;

import com.roboticsradar.pipeline.model.FeedbackAggregate;
import com.roboticsradar.pipeline.util.SchemaInitTest.RefusingConnectionFactory;
import org.junit.jupiter.api.Test;
import org.springframework.r2dbc.core.DatabaseClient;

import static org.junit.jupiter.api.Assertions.*;

public class R2dbcFeedbackSourceTest {

    @Test
    public void unreachableDatabaseYieldsEmptyAggregateAndRetriesSchema() {
        RefusingConnectionFactory factory = new RefusingConnectionFactory();
        R2dbcFeedbackSource source = new R2dbcFeedbackSource(DatabaseClient.create(factory));

        FeedbackAggregate first = source.getFeedbackAggregate("rss_1").block();
        FeedbackAggregate second = source.getFeedbackAggregate("rss_1").block();

        assertNotNull(first);
        assertEquals(0.0, first.getWeightedSum());
        assertTrue(second.getCounts().isEmpty());
        assertEquals(2, factory.attempts());
    }
}
