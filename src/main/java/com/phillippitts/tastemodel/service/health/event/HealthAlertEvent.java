package com.phillippitts.tastemodel.service.health.event;

import com.phillippitts.tastemodel.domain.HealthCheckResult;
import com.phillippitts.tastemodel.domain.HealthStatus;

import java.time.Instant;

/**
 * Published once when the health status changes to a band whose score is at or below the alert
 * threshold. Repeated probes in the same band do not publish again.
 *
 * @param previous status before the transition
 * @param current  status after the transition
 * @param score    score that caused the transition
 * @param result   full check result, with issues and recommendations
 * @param at       time of the check
 */
public record HealthAlertEvent(
        HealthStatus previous,
        HealthStatus current,
        double score,
        HealthCheckResult result,
        Instant at
) {
    public HealthAlertEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
