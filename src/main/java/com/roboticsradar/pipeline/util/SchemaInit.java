package com.roboticsradar.pipeline.util;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Runs schema creation once per process. A failed attempt is not remembered, so the next
 * caller tries again once the database is reachable.
 */
public final class SchemaInit {
    private static final Duration FOREVER = Duration.ofMillis(Long.MAX_VALUE);

    private SchemaInit() {}

    public static Mono<Void> once(Mono<Void> ensureSchema) {
        return ensureSchema.cache(v -> FOREVER, e -> Duration.ZERO, () -> FOREVER);
    }
}
