package com.phillippitts.tastemodel.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Descriptive record stored next to every model artifact as {@code metadata.json}.
 *
 * <p>{@code version} is assigned by the registry; callers pass {@code 0} and receive the
 * stamped copy back from {@code loadVersion}/{@code listVersions}.
 */
public record ModelMetadata(
        int version,
        String modelType,
        Instant createdAt,
        int trainingSamples,
        int featureDim,
        Map<String, Object> hyperparameters,
        long trainingDurationMs,
        String notes
) {

    public ModelMetadata {
        Objects.requireNonNull(modelType, "modelType");
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        hyperparameters = hyperparameters == null ? Map.of() : Map.copyOf(hyperparameters);
        if (notes == null) {
            notes = "";
        }
    }

    public static ModelMetadata of(String modelType, int trainingSamples, int featureDim,
                                   Map<String, Object> hyperparameters) {
        return new ModelMetadata(0, modelType, Instant.now(), trainingSamples, featureDim,
                hyperparameters, 0L, "");
    }

    public ModelMetadata withVersion(int newVersion) {
        return new ModelMetadata(newVersion, modelType, createdAt, trainingSamples, featureDim,
                hyperparameters, trainingDurationMs, notes);
    }

    public ModelMetadata withTrainingDuration(long durationMs) {
        return new ModelMetadata(version, modelType, createdAt, trainingSamples, featureDim,
                hyperparameters, durationMs, notes);
    }
}
