package com.phillippitts.tastemodel.service.registry;

import com.phillippitts.tastemodel.domain.ModelMetadata;
import com.phillippitts.tastemodel.domain.ModelMetrics;

/**
 * A verified model version read back from the registry.
 */
public record LoadedModel(
        String modelType,
        int version,
        byte[] artifact,
        ModelMetadata metadata,
        ModelMetrics metrics,
        String artifactHash
) {

    public LoadedModel {
        artifact = artifact.clone();
    }

    @Override
    public byte[] artifact() {
        return artifact.clone();
    }

    @Override
    public String toString() {
        return "LoadedModel[" + modelType + " v" + version + ", " + artifact.length + " bytes, sha256=" + artifactHash + "]";
    }
}
