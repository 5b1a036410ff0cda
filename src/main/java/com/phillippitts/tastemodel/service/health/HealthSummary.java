package com.phillippitts.tastemodel.service.health;

import com.phillippitts.tastemodel.domain.HealthStatus;

import java.time.Instant;

/**
 * Condensed view of the recent health history.
 *
 * @param currentStatus       status of the latest check, {@code null} before the first one
 * @param currentScore        score of the latest check
 * @param trend               {@code improving}, {@code degrading}, {@code stable} or {@code unknown}
 * @param scoreChange         latest score minus the previous one
 * @param issuesCount         issues reported by the latest check
 * @param recommendationsCount recommendations reported by the latest check
 * @param latestCheck         time of the latest check
 * @param historyCount        checks currently retained
 */
public record HealthSummary(
        HealthStatus currentStatus,
        double currentScore,
        String trend,
        double scoreChange,
        int issuesCount,
        int recommendationsCount,
        Instant latestCheck,
        int historyCount
) {

    static HealthSummary empty() {
        return new HealthSummary(null, 0.0, "unknown", 0.0, 0, 0, null, 0);
    }
}
