package com.phillippitts.tastemodel.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A single user rating waiting to be applied to the track store.
 *
 * @param trackId    rated track
 * @param rating     rating in [1, 5]
 * @param receivedAt when the pipeline accepted the feedback
 */
public record Feedback(String trackId, double rating, Instant receivedAt) {

    public Feedback {
        Objects.requireNonNull(trackId, "trackId");
        if (receivedAt == null) {
            receivedAt = Instant.now();
        }
    }

    public static Feedback of(String trackId, double rating) {
        return new Feedback(trackId, rating, Instant.now());
    }
}
