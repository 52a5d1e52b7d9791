package com.roboticsradar.pipeline.service.quality;

import com.roboticsradar.pipeline.config.RadarProperties;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.RejectionReason;
import com.roboticsradar.pipeline.util.TextNormalizer;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rejects items that are not worth analysing. Checks run in a fixed order and the first
 * failure is reported: stub, too short, invalid URL, too old.
 *
 * <p>Pure: the verdict depends only on the item, the configuration and the clock.
 */
@Service
public class QualityFilter {
    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{P}\\p{S}]+");

    private final int minLength;
    private final int maxAgeDays;
    private final List<String> stubPhrases;
    private final Pattern stubPattern; // null when no phrases are configured
    private final Clock clock;

    public QualityFilter(RadarProperties properties, Clock clock) {
        RadarProperties.Quality q = properties.getQuality();
        this.minLength = q.getMinLength();
        this.maxAgeDays = q.getMaxAgeDays();
        this.stubPhrases = q.getStubPatterns().stream()
                .filter(p -> p != null && !p.isBlank())
                .map(p -> TextNormalizer.forComparison(p))
                .collect(Collectors.toList());
        this.stubPattern = stubPhrases.isEmpty() ? null : Pattern.compile(
                stubPhrases.stream().map(Pattern::quote).collect(Collectors.joining("|")),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.clock = clock;
    }

    public boolean isAcceptable(Item item) {
        return evaluate(item).isAccepted();
    }

    public QualityVerdict evaluate(Item item) {
        String text = TextNormalizer.collapse(item.getText());

        if (isStub(item, text)) {
            return QualityVerdict.reject(RejectionReason.STUB, "placeholder content");
        }
        if (text.length() < minLength) {
            return QualityVerdict.reject(RejectionReason.TOO_SHORT, text.length() + " < " + minLength + " chars");
        }
        if (item.hasUrl() && !isValidUrl(item.getUrl())) {
            return QualityVerdict.reject(RejectionReason.INVALID_URL, item.getUrl());
        }
        if (maxAgeDays > 0 && item.getPublishedAt() != null) {
            OffsetDateTime cutoff = OffsetDateTime.now(clock).minusDays(maxAgeDays);
            if (item.getPublishedAt().isBefore(cutoff)) {
                return QualityVerdict.reject(RejectionReason.TOO_OLD, "published " + item.getPublishedAt());
            }
        }
        return QualityVerdict.accept();
    }

    private boolean isStub(Item item, String text) {
        String body = TextNormalizer.forComparison(item.getBody());
        if (!body.isEmpty() && body.equals(TextNormalizer.forComparison(item.getTitle()))) {
            return true;
        }
        if (stubPattern == null) return false;
        String lower = text.toLowerCase(Locale.ROOT);
        if (!stubPattern.matcher(lower).find()) return false;
        String rest = stubPattern.matcher(lower).replaceAll(" ");
        rest = TextNormalizer.collapse(PUNCTUATION.matcher(rest).replaceAll(" "));
        return rest.length() < minLength;
    }

    static boolean isValidUrl(String url) {
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null) return false;
            String s = scheme.toLowerCase(Locale.ROOT);
            return (s.equals("http") || s.equals("https")) && uri.getHost() != null && !uri.getHost().isBlank();
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
