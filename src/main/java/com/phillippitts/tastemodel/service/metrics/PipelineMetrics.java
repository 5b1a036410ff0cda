package com.phillippitts.tastemodel.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleFunction;

/**
 * Centralized metrics for the model lifecycle pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Retrain outcomes per model type (promoted, retained, blocked, discarded, failed)</li>
 *   <li>Coalesced triggers and training duration</li>
 *   <li>Accepted and dropped feedback</li>
 *   <li>Health score and alerts</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "tastemodel";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts one finished retrain attempt.
     *
     * @param modelType model type that was trained
     * @param outcome   lower-case outcome name
     */
    public void recordRetrain(String modelType, String outcome) {
        Counter.builder(METRIC_PREFIX + ".pipeline.retrain")
                .description("Retrain attempts by outcome")
                .tag("model_type", modelType)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementCoalesced(String modelType) {
        Counter.builder(METRIC_PREFIX + ".pipeline.trigger.coalesced")
                .description("Retrain triggers ignored because a run was already in flight")
                .tag("model_type", modelType)
                .register(registry)
                .increment();
    }

    public void recordTrainingDuration(String modelType, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".pipeline.training.duration")
                .description("Time spent inside the trainer")
                .tag("model_type", modelType)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementFeedbackAccepted() {
        Counter.builder(METRIC_PREFIX + ".feedback.accepted")
                .description("Feedback items applied to the track store")
                .register(registry)
                .increment();
    }

    /**
     * Counts an item that was not processed.
     *
     * @param queue  {@code feedback} or {@code controller}
     * @param reason {@code queue_full}, {@code unknown_track}, ...
     */
    public void incrementDropped(String queue, String reason) {
        Counter.builder(METRIC_PREFIX + ".feedback.dropped")
                .description("Items dropped before reaching the pipeline")
                .tag("queue", queue)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementHealthAlert(String status) {
        Counter.builder(METRIC_PREFIX + ".health.alerts")
                .description("Health alerts fired on status transitions")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Registers the health score gauge. Micrometer holds {@code source} weakly.
     */
    public <T> void registerHealthScore(T source, ToDoubleFunction<T> score) {
        Gauge.builder(METRIC_PREFIX + ".health.score", source, score)
                .description("Composite serving health score (0-1)")
                .register(registry);
    }
}
