package com.roboticsradar.pipeline.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roboticsradar.pipeline.TestFixtures;
import com.roboticsradar.pipeline.util.SchemaInitTest.RefusingConnectionFactory;
import org.junit.jupiter.api.Test;
import org.springframework.r2dbc.core.DatabaseClient;

import static org.junit.jupiter.api.Assertions.*;

public class R2dbcItemStoreTest {

    @Test
    public void schemaCreationIsRetriedAfterDatabaseOutage() {
        RefusingConnectionFactory factory = new RefusingConnectionFactory();
        R2dbcItemStore store = new R2dbcItemStore(DatabaseClient.create(factory), new ObjectMapper(), TestFixtures.CLOCK);

        assertThrows(RuntimeException.class, () -> store.exists("rss_1").block());
        assertThrows(RuntimeException.class, () -> store.exists("rss_1").block());
        assertEquals(2, factory.attempts());
    }

    @Test
    public void blankIdSkipsTheDatabase() {
        RefusingConnectionFactory factory = new RefusingConnectionFactory();
        R2dbcItemStore store = new R2dbcItemStore(DatabaseClient.create(factory), new ObjectMapper(), TestFixtures.CLOCK);

        assertEquals(Boolean.FALSE, store.exists(" ").block());
        assertEquals(0, factory.attempts());
    }
}
