package com.roboticsradar.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.roboticsradar.pipeline.util.TextNormalizer;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A unit of content produced by a source adapter for one fetch cycle.
 *
 * <p>{@code externalId} + {@code sourceKind} identify the item at the adapter boundary and
 * form the stored {@link #getId() id}; they are not the dedup key. A story cross-posted to
 * two sources arrives as two items with different external ids.
 */
public class Item {
    private static final int MAX_ID_LENGTH = 120;

    private String externalId;
    private SourceKind sourceKind;
    private String sourceName;
    private String title;
    private String body;
    private String text; // title + body, used for analysis
    private String url;
    private String authorId;
    private String authorName;
    private long authorFollowers;
    private Engagement engagement = Engagement.none();
    private OffsetDateTime publishedAt;
    private boolean timestampInferred;
    private String language; // as declared by the feed, may be null
    private List<String> keywords = new ArrayList<>();
    private Set<String> tags = new LinkedHashSet<>();
    private Double score; // null until scored

    public Item() {}

    /** Copies every field of {@code other}; collections are copied, not shared. */
    protected Item(Item other) {
        this.externalId = other.externalId;
        this.sourceKind = other.sourceKind;
        this.sourceName = other.sourceName;
        this.title = other.title;
        this.body = other.body;
        this.text = other.text;
        this.url = other.url;
        this.authorId = other.authorId;
        this.authorName = other.authorName;
        this.authorFollowers = other.authorFollowers;
        Engagement e = other.engagement != null ? other.engagement : Engagement.none();
        this.engagement = new Engagement(e.getLikes(), e.getShares(), e.getReplies());
        this.publishedAt = other.publishedAt;
        this.timestampInferred = other.timestampInferred;
        this.language = other.language;
        this.keywords = new ArrayList<>(other.keywords != null ? other.keywords : List.of());
        this.tags = new LinkedHashSet<>(other.tags != null ? other.tags : Set.of());
        this.score = other.score;
    }

    /**
     * Stable storage id: {@code <kind>_<externalId>} with unsafe characters replaced.
     * Over-long external ids (typically feed links) are replaced by a name-based UUID.
     */
    public String getId() {
        if (sourceKind == null || externalId == null) return null;
        String ext = externalId.trim();
        String safe = ext.replaceAll("[^a-zA-Z0-9_-]", "_");
        if (safe.length() > MAX_ID_LENGTH) {
            safe = UUID.nameUUIDFromBytes(ext.getBytes(StandardCharsets.UTF_8)).toString();
        }
        return sourceKind.key() + "_" + safe;
    }

    /** Text used for analysis; falls back to title + body when no explicit text was set. */
    public String getText() {
        if (text != null) return text;
        return TextNormalizer.joinTitleAndBody(title, body);
    }

    public void setText(String text) { this.text = text; }

    @JsonIgnore
    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }
    public SourceKind getSourceKind() { return sourceKind; }
    public void setSourceKind(SourceKind sourceKind) { this.sourceKind = sourceKind; }
    public String getSourceName() { return sourceName; }
    public void setSourceName(String sourceName) { this.sourceName = sourceName; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getBody() { return body; }
    public void setBody(String body) { this.body = body; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getAuthorId() { return authorId; }
    public void setAuthorId(String authorId) { this.authorId = authorId; }
    public String getAuthorName() { return authorName; }
    public void setAuthorName(String authorName) { this.authorName = authorName; }
    public long getAuthorFollowers() { return authorFollowers; }
    public void setAuthorFollowers(long authorFollowers) { this.authorFollowers = Math.max(0, authorFollowers); }
    public Engagement getEngagement() { return engagement; }
    public void setEngagement(Engagement engagement) { this.engagement = engagement != null ? engagement : Engagement.none(); }
    public OffsetDateTime getPublishedAt() { return publishedAt; }
    public void setPublishedAt(OffsetDateTime publishedAt) { this.publishedAt = publishedAt; }
    public boolean isTimestampInferred() { return timestampInferred; }
    public void setTimestampInferred(boolean timestampInferred) { this.timestampInferred = timestampInferred; }
    public String getLanguage() { return language; }
    public void setLanguage(String language) { this.language = language; }
    public List<String> getKeywords() { return keywords; }
    public void setKeywords(List<String> keywords) { this.keywords = keywords != null ? new ArrayList<>(keywords) : new ArrayList<>(); }
    public Set<String> getTags() { return tags; }
    public void setTags(Set<String> tags) { this.tags = tags != null ? new LinkedHashSet<>(tags) : new LinkedHashSet<>(); }
    public Double getScore() { return score; }
    public void setScore(Double score) { this.score = score; }

    @Override
    public String toString() {
        return "Item{id=" + getId() + ", source=" + sourceName + ", title=" + title + "}";
    }
}
