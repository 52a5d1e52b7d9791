package com.roboticsradar.pipeline.config;

import com.roboticsradar.pipeline.model.SourceKind;

/**
 * One configured source: which adapter handles it and where it lives.
 *
 * <p>{@code url} meaning depends on the kind: the feed URL for RSS/Atom, the listing JSON for
 * Reddit, the API base for Hacker News and the repository search URL for GitHub.
 */
public class SourceSettings {
    private String name;
    private SourceKind kind;
    private String url;
    /**
     * Optional bearer token sent with API requests (GitHub). Usually injected from the
     * environment, e.g. {@code ${GITHUB_TOKEN:}}.
     */
    private String token;
    private boolean enabled = true;
    /** Maximum entries taken from this source per cycle. */
    private int limit = 25;

    public SourceSettings() {}

    public SourceSettings(String name, SourceKind kind, String url) {
        this.name = name;
        this.kind = kind;
        this.url = url;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public SourceKind getKind() { return kind; }
    public void setKind(SourceKind kind) { this.kind = kind; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public int getLimit() { return limit; }
    public void setLimit(int limit) { this.limit = limit; }

    @Override
    public String toString() {
        return name + " (" + (kind != null ? kind.key() : "?") + ")";
    }
}
