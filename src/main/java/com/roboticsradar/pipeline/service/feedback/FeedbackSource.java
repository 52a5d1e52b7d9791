package com.roboticsradar.pipeline.service.feedback;

import com.roboticsradar.pipeline.model.FeedbackAggregate;
import reactor.core.publisher.Mono;

/** Read-only view of user feedback. Records are written by the delivery side, never by the pipeline. */
public interface FeedbackSource {

    /** Aggregate for the item; {@link FeedbackAggregate#empty()} when nothing was recorded. */
    Mono<FeedbackAggregate> getFeedbackAggregate(String itemId);
}
