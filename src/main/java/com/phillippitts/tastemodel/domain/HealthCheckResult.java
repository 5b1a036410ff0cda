package com.phillippitts.tastemodel.domain;

import java.time.Instant;
import java.util.List;

/**
 * Scored outcome of one health check.
 */
public record HealthCheckResult(
        HealthStatus status,
        double score,
        HealthSample sample,
        List<String> issues,
        List<String> recommendations,
        Instant timestamp
) {

    public HealthCheckResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        if (timestamp == null) {
            timestamp = sample != null ? sample.timestamp() : Instant.now();
        }
    }
}
