package com.phillippitts.tastemodel.service.health;

import com.phillippitts.tastemodel.domain.HealthCheckResult;
import com.phillippitts.tastemodel.domain.HealthStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Health indicator backed by the serving health monitor.
 *
 * <p>Reports UP for healthy and degraded, DOWN for unhealthy and critical, and UNKNOWN
 * before the first check. Exposed via /actuator/health endpoint.
 */
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    private final HealthMonitor monitor;

    public PipelineHealthIndicator(HealthMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public Health health() {
        Optional<HealthCheckResult> latest = monitor.latest();
        if (latest.isEmpty()) {
            return Health.unknown().withDetail("status", "No health check has run yet").build();
        }
        HealthCheckResult result = latest.get();
        Health.Builder builder = isServing(result.status()) ? Health.up() : Health.down();
        return builder
                .withDetail("servingStatus", result.status().name())
                .withDetail("score", result.score())
                .withDetail("issues", result.issues())
                .withDetail("checkedAt", result.timestamp().toString())
                .build();
    }

    private static boolean isServing(HealthStatus status) {
        return status == HealthStatus.HEALTHY || status == HealthStatus.DEGRADED;
    }
}
