package com.phillippitts.tastemodel.domain;

/**
 * Health bands derived from the composite health score.
 */
public enum HealthStatus {
    HEALTHY(0.90),
    DEGRADED(0.70),
    UNHEALTHY(0.50),
    CRITICAL(0.0);

    private final double lowerBound;

    HealthStatus(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public double lowerBound() {
        return lowerBound;
    }

    /**
     * Maps a score in [0, 1] to its band: {@code >=0.90} healthy, {@code >=0.70} degraded,
     * {@code >=0.50} unhealthy, otherwise critical.
     */
    public static HealthStatus fromScore(double score) {
        if (score >= HEALTHY.lowerBound) {
            return HEALTHY;
        }
        if (score >= DEGRADED.lowerBound) {
            return DEGRADED;
        }
        if (score >= UNHEALTHY.lowerBound) {
            return UNHEALTHY;
        }
        return CRITICAL;
    }
}
