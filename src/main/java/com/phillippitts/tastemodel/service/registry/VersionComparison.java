package com.phillippitts.tastemodel.service.registry;

import com.phillippitts.tastemodel.domain.ModelMetrics;

/**
 * Metric deltas between two versions and the verdict on which one to keep.
 *
 * <p>Deltas are {@code b - a}. {@code relativeImprovement} is the fractional drop in error
 * metric from {@code a} to {@code b}; positive means {@code b} is better.
 *
 * @param better {@link Side#B} only when {@code relativeImprovement >= margin}; ties and
 *               inconclusive gains keep {@link Side#A}
 */
public record VersionComparison(
        String modelType,
        int versionA,
        int versionB,
        double mseDelta,
        double maeDelta,
        double r2Delta,
        Double relativeImprovement,
        double margin,
        Side better
) {

    public enum Side { A, B }

    /**
     * Applies the promotion rule. An incumbent with a non-positive or non-finite error metric
     * cannot be measured against, so the comparison is inconclusive and keeps {@code a}.
     */
    public static VersionComparison evaluate(String modelType, int versionA, ModelMetrics a,
                                             int versionB, ModelMetrics b, double margin) {
        double errA = a.errorMetric();
        double errB = b.errorMetric();
        Double improvement = null;
        if (errA > 0.0 && Double.isFinite(errA) && Double.isFinite(errB)) {
            improvement = (errA - errB) / errA;
        }
        Side better = improvement != null && improvement >= margin ? Side.B : Side.A;
        return new VersionComparison(modelType, versionA, versionB,
                b.mse() - a.mse(), b.mae() - a.mae(), b.r2() - a.r2(),
                improvement, margin, better);
    }

    public int betterVersion() {
        return better == Side.B ? versionB : versionA;
    }

    public boolean challengerWins() {
        return better == Side.B;
    }
}
