package com.roboticsradar.pipeline.service.source;

import com.roboticsradar.pipeline.config.SourceSettings;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.util.TextNormalizer;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.function.Consumer;

/**
 * Shared plumbing for adapters that read a source over HTTP: GET with error translation,
 * HTML-to-text reduction and fetch-time timestamp inference.
 */
public abstract class HttpSourceAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(HttpSourceAdapter.class);

    protected final WebClient http;
    protected final Clock clock;

    protected HttpSourceAdapter(WebClient http, Clock clock) {
        this.http = http;
        this.clock = clock;
    }

    /** GETs {@code url} as a string; every transport or status failure becomes {@link SourceUnavailableException}. */
    protected Mono<String> get(SourceSettings source, String url, Consumer<HttpHeaders> headers) {
        return Mono.defer(() -> http.get()
                        .uri(URI.create(url))
                        .headers(headers)
                        .retrieve()
                        .bodyToMono(String.class))
                .onErrorMap(e -> !(e instanceof SourceUnavailableException),
                        e -> new SourceUnavailableException(source.getName(), describe(e), e));
    }

    protected Mono<String> get(SourceSettings source, String url) {
        return get(source, url, h -> {});
    }

    private static String describe(Throwable e) {
        if (e instanceof WebClientResponseException wre) {
            return "HTTP " + wre.getStatusCode().value();
        }
        if (e instanceof WebClientRequestException wre) {
            return "request to " + wre.getUri() + " failed: " + wre.getMostSpecificCause().getMessage();
        }
        if (e instanceof IllegalArgumentException) {
            return "invalid url: " + e.getMessage();
        }
        return e.toString();
    }

    /** Plain text of an HTML fragment (feed summaries, self posts). */
    protected static String htmlToText(String html) {
        if (html == null || html.isBlank()) return "";
        return TextNormalizer.collapse(Jsoup.parse(html).text());
    }

    protected OffsetDateTime fetchTime() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }

    /** Uses the parsed timestamp, or fetch time with {@code timestampInferred} set when there is none. */
    protected void applyTimestamp(Item item, OffsetDateTime parsed) {
        if (parsed != null) {
            item.setPublishedAt(parsed.withOffsetSameInstant(ZoneOffset.UTC));
            item.setTimestampInferred(false);
        } else {
            item.setPublishedAt(fetchTime());
            item.setTimestampInferred(true);
        }
    }

    protected static void logSkipped(SourceSettings source, MalformedItemException e) {
        log.warn("Skipping malformed entry from {}: {}", source.getName(), e.getMessage());
    }
}
