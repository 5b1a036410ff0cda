package com.phillippitts.tastemodel.domain;

import java.util.Map;

/**
 * Held-out evaluation metrics for a model version, stored as {@code metrics.json}.
 *
 * @param mse               mean squared error
 * @param mae               mean absolute error
 * @param rmse              root mean squared error
 * @param r2                coefficient of determination
 * @param valMse            validation-split MSE, when the trainer reports one separately
 * @param valMae            validation-split MAE, when reported
 * @param featureImportance absolute weight per feature name
 */
public record ModelMetrics(
        double mse,
        double mae,
        double rmse,
        double r2,
        Double valMse,
        Double valMae,
        Map<String, Double> featureImportance
) {

    public ModelMetrics {
        featureImportance = featureImportance == null ? Map.of() : Map.copyOf(featureImportance);
    }

    public static ModelMetrics of(double mse, double mae, double r2) {
        return new ModelMetrics(mse, mae, Math.sqrt(Math.max(0.0, mse)), r2, null, null, Map.of());
    }

    /**
     * Error metric used when ranking versions: validation MSE when present, otherwise MSE.
     */
    public double errorMetric() {
        return valMse != null ? valMse : mse;
    }
}
