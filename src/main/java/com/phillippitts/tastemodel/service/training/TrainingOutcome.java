package com.phillippitts.tastemodel.service.training;

import com.phillippitts.tastemodel.domain.ModelMetrics;

import java.util.Map;
import java.util.Objects;

/**
 * What a {@link Trainer} hands back: the artifact bytes to store, held-out metrics and the
 * hyperparameters that produced them.
 */
public record TrainingOutcome(byte[] artifact, ModelMetrics metrics, Map<String, Object> hyperparameters) {

    public TrainingOutcome {
        Objects.requireNonNull(artifact, "artifact");
        Objects.requireNonNull(metrics, "metrics");
        artifact = artifact.clone();
        hyperparameters = hyperparameters == null ? Map.of() : Map.copyOf(hyperparameters);
    }

    @Override
    public byte[] artifact() {
        return artifact.clone();
    }
}
