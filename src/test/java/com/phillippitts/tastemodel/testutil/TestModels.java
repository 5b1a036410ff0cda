package com.phillippitts.tastemodel.testutil;

import com.phillippitts.tastemodel.domain.ModelMetadata;
import com.phillippitts.tastemodel.domain.ModelMetrics;

import java.util.Map;

/**
 * Small factories for registry fixtures.
 */
public final class TestModels {

    private TestModels() {}

    public static ModelMetadata metadata(String modelType) {
        return ModelMetadata.of(modelType, 10, 7, Map.of("algorithm", "test"));
    }

    public static ModelMetrics metrics(double mse) {
        return ModelMetrics.of(mse, Math.sqrt(mse), 0.5);
    }
}
