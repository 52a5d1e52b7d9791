package com.roboticsradar.pipeline.service.dedup;

import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Canonical form of a URL for duplicate detection: no scheme, lower-case host without
 * {@code www.}, no default port, no fragment, no trailing slash, tracking parameters
 * removed and the remaining parameters sorted.
 *
 * <p>{@code https://www.Example.com/a/?utm_source=x&b=2&a=1#top} becomes {@code example.com/a?a=1&b=2}.
 */
public class UrlNormalizer {
    private final List<String> exactParams = new ArrayList<>();
    private final List<String> prefixParams = new ArrayList<>();

    /** @param trackingParams parameter names to drop; a trailing {@code *} matches any suffix */
    public UrlNormalizer(List<String> trackingParams) {
        for (String p : trackingParams) {
            if (p == null || p.isBlank()) continue;
            String name = p.trim().toLowerCase(Locale.ROOT);
            if (name.endsWith("*")) prefixParams.add(name.substring(0, name.length() - 1));
            else exactParams.add(name);
        }
    }

    /** Returns the canonical form, or an empty string for blank input. */
    public String normalize(String url) {
        if (url == null || url.isBlank()) return "";
        String raw = url.trim();
        UriComponents uri;
        try {
            uri = UriComponentsBuilder.fromUriString(raw).build();
        } catch (IllegalArgumentException e) {
            return raw.toLowerCase(Locale.ROOT);
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return raw.toLowerCase(Locale.ROOT);
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) host = host.substring(4);

        StringBuilder out = new StringBuilder(host);
        int port = uri.getPort();
        if (port > 0 && port != 80 && port != 443) out.append(':').append(port);

        String path = uri.getPath() == null ? "" : uri.getPath();
        while (path.endsWith("/")) path = path.substring(0, path.length() - 1);
        out.append(path);

        List<String> params = new ArrayList<>();
        MultiValueMap<String, String> query = uri.getQueryParams();
        for (Map.Entry<String, List<String>> e : query.entrySet()) {
            if (isTracking(e.getKey())) continue;
            for (String v : e.getValue()) {
                params.add(v == null ? e.getKey() : e.getKey() + "=" + v);
            }
        }
        if (!params.isEmpty()) {
            params.sort(null);
            out.append('?').append(String.join("&", params));
        }
        return out.toString();
    }

    boolean isTracking(String param) {
        String p = param.toLowerCase(Locale.ROOT);
        if (exactParams.contains(p)) return true;
        for (String prefix : prefixParams) {
            if (p.startsWith(prefix)) return true;
        }
        return false;
    }
}
