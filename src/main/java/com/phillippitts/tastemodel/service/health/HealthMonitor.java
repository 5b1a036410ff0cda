package com.phillippitts.tastemodel.service.health;

import com.phillippitts.tastemodel.config.properties.HealthMonitorProperties;
import com.phillippitts.tastemodel.domain.HealthCheckResult;
import com.phillippitts.tastemodel.domain.HealthSample;
import com.phillippitts.tastemodel.domain.HealthStatus;
import com.phillippitts.tastemodel.exception.HealthProbeTimeoutException;
import com.phillippitts.tastemodel.service.health.event.HealthAlertEvent;
import com.phillippitts.tastemodel.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Probes the serving path and turns each probe into a scored {@link HealthCheckResult}.
 *
 * <p>Score: {@code 0.4 * connection + 0.4 * (1 - errorRate) + 0.2 * latencyScore}, where
 * {@code latencyScore = max(0, 1 - avgLatency / latencyBudget)}, clamped to [0, 1].
 * Bands: {@code >= 0.90} healthy, {@code >= 0.70} degraded, {@code >= 0.50} unhealthy,
 * otherwise critical.
 *
 * <p>A {@link HealthAlertEvent} is published only when the status changes and the new
 * score is at or below the alert threshold. Results are retained for {@code retentionDays} and
 * pruned by an hourly sweep.
 *
 * <p><b>Thread Safety:</b> history and the last status are guarded by this instance's
 * monitor; the probe itself runs outside it.
 */
@Service
public class HealthMonitor {

    private static final Logger LOG = LogManager.getLogger(HealthMonitor.class);

    static final double CONNECTION_WEIGHT = 0.4;
    static final double ERROR_WEIGHT = 0.4;
    static final double LATENCY_WEIGHT = 0.2;

    private static final double HIGH_ERROR_RATE = 0.1;
    private static final double HIGH_AVG_LATENCY_MS = 500;
    private static final double HIGH_P95_LATENCY_MS = 1000;
    private static final double SLOW_RESPONSE_MS = 2000;

    private final ServingProbe probe;
    private final ServingRequestStats requestStats;
    private final HealthMonitorProperties properties;
    private final Executor probeExecutor;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final Deque<HealthCheckResult> history = new ArrayDeque<>();
    private HealthStatus lastStatus = HealthStatus.HEALTHY;

    @Autowired
    public HealthMonitor(ServingProbe probe,
                         ServingRequestStats requestStats,
                         HealthMonitorProperties properties,
                         @Qualifier("probeExecutor") Executor probeExecutor,
                         ApplicationEventPublisher publisher,
                         PipelineMetrics metrics) {
        this(probe, requestStats, properties, probeExecutor, publisher, metrics, Clock.systemUTC());
    }

    HealthMonitor(ServingProbe probe,
                  ServingRequestStats requestStats,
                  HealthMonitorProperties properties,
                  Executor probeExecutor,
                  ApplicationEventPublisher publisher,
                  PipelineMetrics metrics,
                  Clock clock) {
        this.probe = Objects.requireNonNull(probe, "probe");
        this.requestStats = Objects.requireNonNull(requestStats, "requestStats");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.probeExecutor = Objects.requireNonNull(probeExecutor, "probeExecutor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        metrics.registerHealthScore(this, HealthMonitor::latestScore);
    }

    /**
     * Runs one probe, drains the request counters and records the scored result.
     * Never throws for probe failures; they become a disconnected sample.
     */
    public HealthCheckResult checkHealth() {
        long start = System.nanoTime();
        boolean connected = runProbe();
        double responseTimeMs = connected ? (System.nanoTime() - start) / 1_000_000.0 : 0.0;

        ServingRequestStats.Snapshot window = requestStats.drain();
        HealthSample sample = new HealthSample(
                clock.instant(),
                connected,
                responseTimeMs,
                window.errorRate(),
                window.requestCount(),
                window.successCount(),
                window.failureCount(),
                window.avgLatencyMs(),
                window.p95LatencyMs(),
                window.p99LatencyMs());
        return record(sample);
    }

    /**
     * Scores a sample, appends it to the history and fires an alert on a qualifying transition.
     */
    public HealthCheckResult record(HealthSample sample) {
        double score = score(sample);
        HealthStatus status = HealthStatus.fromScore(score);
        List<String> issues = identifyIssues(sample);
        HealthCheckResult result = new HealthCheckResult(status, score, sample, issues,
                recommendations(sample, issues), sample.timestamp());

        HealthStatus previous;
        synchronized (this) {
            history.addLast(result);
            previous = lastStatus;
            lastStatus = status;
        }
        logResult(result);

        if (status != previous && score <= properties.getAlertThreshold()) {
            LOG.warn("Health alert: {} -> {} (score={}, errorRate={}, issues={})",
                    previous, status, format(score), format(sample.errorRate()), issues);
            metrics.incrementHealthAlert(status.name().toLowerCase(Locale.ROOT));
            publisher.publishEvent(new HealthAlertEvent(previous, status, score, result, sample.timestamp()));
        }
        return result;
    }

    /**
     * Composite health score of a sample, in [0, 1].
     */
    public double score(HealthSample sample) {
        double connection = sample.connectionStatus() ? 1.0 : 0.0;
        double errorScore = Math.max(0.0, 1.0 - sample.errorRate());
        double latencyScore = Math.max(0.0, 1.0 - sample.avgLatencyMs() / properties.getLatencyBudgetMs());
        double score = CONNECTION_WEIGHT * connection + ERROR_WEIGHT * errorScore + LATENCY_WEIGHT * latencyScore;
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * Status of the latest check; {@link HealthStatus#HEALTHY} before the first one.
     */
    public synchronized HealthStatus currentStatus() {
        return lastStatus;
    }

    public synchronized Optional<HealthCheckResult> latest() {
        return Optional.ofNullable(history.peekLast());
    }

    /**
     * Samples recorded within the last {@code hours}, oldest first.
     */
    public List<HealthSample> getHistory(int hours) {
        return getResults(hours).stream().map(HealthCheckResult::sample).toList();
    }

    /**
     * Check results recorded within the last {@code hours}, oldest first.
     */
    public synchronized List<HealthCheckResult> getResults(int hours) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(Math.max(0, hours)));
        List<HealthCheckResult> out = new ArrayList<>();
        for (HealthCheckResult r : history) {
            if (r.timestamp().isAfter(cutoff)) {
                out.add(r);
            }
        }
        return out;
    }

    public synchronized HealthSummary summary() {
        HealthCheckResult latest = history.peekLast();
        if (latest == null) {
            return HealthSummary.empty();
        }
        String trend = "unknown";
        double change = 0.0;
        if (history.size() >= 2) {
            Iterator<HealthCheckResult> it = history.descendingIterator();
            it.next();
            change = latest.score() - it.next().score();
            trend = change > 0 ? "improving" : change < 0 ? "degrading" : "stable";
        }
        return new HealthSummary(latest.status(), latest.score(), trend, change,
                latest.issues().size(), latest.recommendations().size(), latest.timestamp(), history.size());
    }

    /**
     * Drops results older than the retention window.
     *
     * @return number of results removed
     */
    @Scheduled(fixedRate = 3_600_000, initialDelay = 3_600_000)
    public synchronized int pruneHistory() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getRetentionDays()));
        int removed = 0;
        while (!history.isEmpty() && !history.peekFirst().timestamp().isAfter(cutoff)) {
            history.removeFirst();
            removed++;
        }
        if (removed > 0) {
            LOG.info("Pruned {} health results older than {} days", removed, properties.getRetentionDays());
        }
        return removed;
    }

    double latestScore() {
        return latest().map(HealthCheckResult::score).orElse(Double.NaN);
    }

    private boolean runProbe() {
        long timeoutMs = properties.getProbeTimeoutMs();
        CompletableFuture<Boolean> future;
        try {
            future = CompletableFuture.supplyAsync(probe::probe, probeExecutor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Probe rejected by executor; recording as disconnected: {}", e.getMessage());
            return false;
        }
        try {
            return Boolean.TRUE.equals(future.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException te) {
            future.cancel(true);
            LOG.warn("{}; recording as disconnected", new HealthProbeTimeoutException(timeoutMs).getMessage());
            return false;
        } catch (ExecutionException ee) {
            LOG.warn("Probe failed; recording as disconnected: {}", String.valueOf(ee.getCause()));
            return false;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for probe");
            return false;
        }
    }

    static List<String> identifyIssues(HealthSample s) {
        List<String> issues = new ArrayList<>();
        if (!s.connectionStatus()) {
            issues.add("Serving path not reachable");
        }
        if (s.errorRate() > HIGH_ERROR_RATE) {
            issues.add(String.format(Locale.ROOT, "High error rate: %.1f%%", s.errorRate() * 100));
        }
        if (s.avgLatencyMs() > HIGH_AVG_LATENCY_MS) {
            issues.add(String.format(Locale.ROOT, "High latency: %.0fms", s.avgLatencyMs()));
        }
        if (s.p95LatencyMs() > HIGH_P95_LATENCY_MS) {
            issues.add(String.format(Locale.ROOT, "P95 latency too high: %.0fms", s.p95LatencyMs()));
        }
        if (s.responseTimeMs() > SLOW_RESPONSE_MS) {
            issues.add(String.format(Locale.ROOT, "Slow response time: %.0fms", s.responseTimeMs()));
        }
        if (s.failureCount() > s.successCount()) {
            issues.add("More failures than successes");
        }
        return issues;
    }

    static List<String> recommendations(HealthSample s, List<String> issues) {
        List<String> out = new ArrayList<>();
        if (!s.connectionStatus()) {
            out.add("Check the serving process is running");
            out.add("Verify network connectivity");
        }
        if (s.errorRate() > HIGH_ERROR_RATE) {
            out.add("Review error logs for patterns");
            out.add("Consider rolling back the latest model if errors are prediction-related");
        }
        if (s.avgLatencyMs() > HIGH_AVG_LATENCY_MS) {
            out.add("Optimize model inference time");
        }
        if (s.p95LatencyMs() > HIGH_P95_LATENCY_MS) {
            out.add("Investigate slow request patterns");
        }
        if (issues.isEmpty()) {
            out.add("Serving path is healthy - continue monitoring");
        }
        return out;
    }

    private static void logResult(HealthCheckResult r) {
        switch (r.status()) {
            case CRITICAL -> LOG.error("Serving health CRITICAL: {}", format(r.score()));
            case UNHEALTHY, DEGRADED -> LOG.warn("Serving health {}: {}", r.status(), format(r.score()));
            default -> LOG.debug("Serving health OK: {}", format(r.score()));
        }
    }

    private static String format(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
