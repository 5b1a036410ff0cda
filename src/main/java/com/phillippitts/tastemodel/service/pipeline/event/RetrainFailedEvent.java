package com.phillippitts.tastemodel.service.pipeline.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a retrain run ends in failure. {@code latest} is unchanged.
 */
public record RetrainFailedEvent(
        String modelType,
        UUID runId,
        String message,
        Throwable cause,
        Instant at
) {
    public RetrainFailedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
