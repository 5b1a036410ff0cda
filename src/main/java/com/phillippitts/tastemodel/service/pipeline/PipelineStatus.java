package com.phillippitts.tastemodel.service.pipeline;

import com.phillippitts.tastemodel.domain.HealthCheckResult;
import com.phillippitts.tastemodel.domain.HealthStatus;
import com.phillippitts.tastemodel.domain.PipelineState;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time view of the coordinator.
 *
 * @param state              current state machine state
 * @param running            whether the background workers are scheduled
 * @param modelType          model type the decision worker evaluates
 * @param healthStatus       status of the latest health check
 * @param health             latest health check, {@code null} before the first one
 * @param trainingDataCount  ratings collected since the last stored version
 * @param lastTrainingTime   creation time of the latest version, read from the registry
 * @param shouldRetrain      whether the decision worker would start a run now
 * @param latestVersion      version {@code latest} points to, or {@code null}
 * @param lastError          message of the last failure, or {@code null}
 * @param lastErrorAt        time of the last failure
 * @param lastRun            most recent finished run
 * @param counters           totals per outcome plus feedback and coalescing counters
 * @param feedbackQueueDepth items waiting for the collector
 * @param controllerQueueDepth controller events waiting for the collector
 * @param canaryPercentage   configured canary share; informational only
 */
public record PipelineStatus(
        PipelineState state,
        boolean running,
        String modelType,
        HealthStatus healthStatus,
        HealthCheckResult health,
        long trainingDataCount,
        Instant lastTrainingTime,
        boolean shouldRetrain,
        Integer latestVersion,
        String lastError,
        Instant lastErrorAt,
        RetrainRun lastRun,
        Map<String, Long> counters,
        int feedbackQueueDepth,
        int controllerQueueDepth,
        double canaryPercentage
) {

    public PipelineStatus {
        counters = counters == null ? Map.of() : Map.copyOf(counters);
    }
}
