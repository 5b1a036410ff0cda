package com.phillippitts.tastemodel.service.pipeline.event;

import com.phillippitts.tastemodel.domain.ModelMetrics;

import java.time.Instant;

/**
 * Published after a challenger has been trained and stored, before evaluation.
 */
public record TrainingCompletedEvent(
        String modelType,
        int version,
        int samples,
        ModelMetrics metrics,
        long durationMs,
        Instant at
) {
    public TrainingCompletedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
