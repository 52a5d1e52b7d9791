package com.roboticsradar.pipeline.service.quality;

import com.roboticsradar.pipeline.model.RejectionReason;

/** Outcome of the quality filter for one item: accepted, or the first failed check. */
public class QualityVerdict {
    private static final QualityVerdict ACCEPTED = new QualityVerdict(true, null, null);

    private final boolean accepted;
    private final RejectionReason reason;
    private final String detail;

    private QualityVerdict(boolean accepted, RejectionReason reason, String detail) {
        this.accepted = accepted;
        this.reason = reason;
        this.detail = detail;
    }

    public static QualityVerdict accept() {
        return ACCEPTED;
    }

    public static QualityVerdict reject(RejectionReason reason, String detail) {
        return new QualityVerdict(false, reason, detail);
    }

    public boolean isAccepted() { return accepted; }
    public RejectionReason getReason() { return reason; }
    public String getDetail() { return detail; }

    @Override
    public String toString() {
        return accepted ? "accepted" : reason.code() + " (" + detail + ")";
    }
}
