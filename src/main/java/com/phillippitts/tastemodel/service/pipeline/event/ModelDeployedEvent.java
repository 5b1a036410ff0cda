package com.phillippitts.tastemodel.service.pipeline.event;

import java.time.Instant;

/**
 * Published when {@code latest} moves to a new version, either by promotion of a challenger
 * or by an operator rollback.
 *
 * @param previousVersion version latest pointed to before, {@code null} for a first model
 * @param relativeImprovement error reduction over the previous version, when measured
 * @param rollback        true when an operator re-pointed latest
 */
public record ModelDeployedEvent(
        String modelType,
        int version,
        Integer previousVersion,
        Double relativeImprovement,
        boolean rollback,
        Instant at
) {
    public ModelDeployedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
