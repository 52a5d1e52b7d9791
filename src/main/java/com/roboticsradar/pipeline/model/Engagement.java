package com.roboticsradar.pipeline.model;

/**
 * Engagement counters normalized across sources: upvotes, points and stars map to
 * {@code likes}; retweets and forks to {@code shares}; comments to {@code replies}.
 * Negative inputs are clamped to zero.
 */
public class Engagement {
    private long likes;
    private long shares;
    private long replies;

    public Engagement() {}

    public Engagement(long likes, long shares, long replies) {
        setLikes(likes);
        setShares(shares);
        setReplies(replies);
    }

    public static Engagement none() {
        return new Engagement(0, 0, 0);
    }

    public long getLikes() { return likes; }
    public void setLikes(long likes) { this.likes = Math.max(0, likes); }
    public long getShares() { return shares; }
    public void setShares(long shares) { this.shares = Math.max(0, shares); }
    public long getReplies() { return replies; }
    public void setReplies(long replies) { this.replies = Math.max(0, replies); }

    @Override
    public String toString() {
        return "Engagement{likes=" + likes + ", shares=" + shares + ", replies=" + replies + "}";
    }
}
