package com.phillippitts.tastemodel.service.pipeline.event;

import java.time.Instant;

/**
 * Published when an item offered to the pipeline is not accepted.
 *
 * @param queue  {@code feedback} or {@code controller}
 * @param reason {@code queue_full}, {@code disabled} or {@code unknown_track}
 */
public record FeedbackDroppedEvent(String queue, String reason, Instant at) {
    public FeedbackDroppedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
