package com.phillippitts.tastemodel.service.health;

import com.phillippitts.tastemodel.domain.HealthCheckResult;
import com.phillippitts.tastemodel.domain.HealthSample;
import com.phillippitts.tastemodel.domain.HealthStatus;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PipelineHealthIndicatorTest {

    private static HealthCheckResult result(HealthStatus status, double score) {
        HealthSample sample = new HealthSample(Instant.parse("2026-03-01T10:00:00Z"), true, 3.0, 0.0,
                0, 0, 0, 0.0, 0.0, 0.0);
        return new HealthCheckResult(status, score, sample, List.of("x"), List.of(), null);
    }

    @Test
    void unknownBeforeFirstCheck() {
        HealthMonitor monitor = mock(HealthMonitor.class);
        when(monitor.latest()).thenReturn(Optional.empty());

        Health health = new PipelineHealthIndicator(monitor).health();

        assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN);
    }

    @Test
    void degradedIsStillUp() {
        HealthMonitor monitor = mock(HealthMonitor.class);
        when(monitor.latest()).thenReturn(Optional.of(result(HealthStatus.DEGRADED, 0.75)));

        Health health = new PipelineHealthIndicator(monitor).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("servingStatus", "DEGRADED")
                .containsEntry("score", 0.75)
                .containsEntry("checkedAt", "2026-03-01T10:00:00Z");
    }

    @Test
    void unhealthyAndCriticalAreDown() {
        HealthMonitor monitor = mock(HealthMonitor.class);
        when(monitor.latest()).thenReturn(Optional.of(result(HealthStatus.UNHEALTHY, 0.6)));
        assertThat(new PipelineHealthIndicator(monitor).health().getStatus()).isEqualTo(Status.DOWN);

        when(monitor.latest()).thenReturn(Optional.of(result(HealthStatus.CRITICAL, 0.2)));
        assertThat(new PipelineHealthIndicator(monitor).health().getStatus()).isEqualTo(Status.DOWN);
    }
}
