package com.phillippitts.tastemodel.domain;

import java.time.Instant;

/**
 * One probe of the serving path plus the request counters aggregated since the previous probe.
 */
public record HealthSample(
        Instant timestamp,
        boolean connectionStatus,
        double responseTimeMs,
        double errorRate,
        long requestCount,
        long successCount,
        long failureCount,
        double avgLatencyMs,
        double p95LatencyMs,
        double p99LatencyMs
) {

    public HealthSample {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (errorRate < 0.0 || errorRate > 1.0) {
            throw new IllegalArgumentException("Error rate must be between 0.0 and 1.0, got: " + errorRate);
        }
    }

    /**
     * Sample recorded when the probe itself could not run.
     */
    public static HealthSample unreachable(Instant at) {
        return new HealthSample(at, false, 0.0, 1.0, 0, 0, 0, 0.0, 0.0, 0.0);
    }
}
