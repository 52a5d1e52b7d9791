package com.roboticsradar.pipeline.model;

/** One stored user reaction to an item. Weight is non-negative; the type carries the sign. */
public class FeedbackRecord {
    private String itemId;
    private FeedbackType feedbackType;
    private double weight = 1.0;

    public FeedbackRecord() {}

    public FeedbackRecord(String itemId, FeedbackType feedbackType, double weight) {
        this.itemId = itemId;
        this.feedbackType = feedbackType;
        this.weight = weight;
    }

    public String getItemId() { return itemId; }
    public void setItemId(String itemId) { this.itemId = itemId; }
    public FeedbackType getFeedbackType() { return feedbackType; }
    public void setFeedbackType(FeedbackType feedbackType) { this.feedbackType = feedbackType; }
    public double getWeight() { return weight; }
    public void setWeight(double weight) { this.weight = weight; }
}
