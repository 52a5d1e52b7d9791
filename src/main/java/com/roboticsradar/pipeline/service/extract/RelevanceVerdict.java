package com.roboticsradar.pipeline.service.extract;

import com.roboticsradar.pipeline.model.RejectionReason;

/** Relevance decision; {@code matchedTerm} names the keyword that decided it, when there was one. */
public class RelevanceVerdict {
    private final boolean relevant;
    private final RejectionReason reason;
    private final String matchedTerm;

    private RelevanceVerdict(boolean relevant, RejectionReason reason, String matchedTerm) {
        this.relevant = relevant;
        this.reason = reason;
        this.matchedTerm = matchedTerm;
    }

    public static RelevanceVerdict relevant(String matchedTerm) {
        return new RelevanceVerdict(true, null, matchedTerm);
    }

    public static RelevanceVerdict reject(RejectionReason reason, String matchedTerm) {
        return new RelevanceVerdict(false, reason, matchedTerm);
    }

    public boolean isRelevant() { return relevant; }
    public RejectionReason getReason() { return reason; }
    public String getMatchedTerm() { return matchedTerm; }
}
