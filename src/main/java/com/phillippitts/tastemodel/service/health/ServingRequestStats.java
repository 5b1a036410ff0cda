package com.phillippitts.tastemodel.service.health;

import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Request counters and latencies accumulated between two health probes.
 *
 * <p>Fed by the request filter on every HTTP call; {@link #drain()} hands the window to the
 * health monitor and starts a new one. Latency samples beyond {@value #MAX_LATENCY_SAMPLES}
 * per window are counted but not kept for percentiles.
 */
@Component
public class ServingRequestStats {

    static final int MAX_LATENCY_SAMPLES = 10_000;

    private long requests;
    private long failures;
    private double[] latencies = new double[256];
    private int latencyCount;
    private double latencySum;

    public synchronized void record(double latencyMs, boolean success) {
        requests++;
        if (!success) {
            failures++;
        }
        latencySum += latencyMs;
        if (latencyCount < MAX_LATENCY_SAMPLES) {
            if (latencyCount == latencies.length) {
                latencies = Arrays.copyOf(latencies, Math.min(latencies.length * 2, MAX_LATENCY_SAMPLES));
            }
            latencies[latencyCount++] = latencyMs;
        }
    }

    /**
     * Returns the current window and resets the counters.
     */
    public synchronized Snapshot drain() {
        double[] window = Arrays.copyOf(latencies, latencyCount);
        Arrays.sort(window);
        Snapshot snapshot = new Snapshot(
                requests,
                requests - failures,
                failures,
                requests == 0 ? 0.0 : latencySum / requests,
                percentile(window, 0.95),
                percentile(window, 0.99));
        requests = 0;
        failures = 0;
        latencyCount = 0;
        latencySum = 0.0;
        return snapshot;
    }

    /** Nearest-rank percentile of a sorted array; 0 when empty. */
    static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) {
            return 0.0;
        }
        int rank = (int) Math.ceil(p * sorted.length);
        return sorted[Math.max(0, Math.min(sorted.length - 1, rank - 1))];
    }

    /**
     * One drained window.
     */
    public record Snapshot(
            long requestCount,
            long successCount,
            long failureCount,
            double avgLatencyMs,
            double p95LatencyMs,
            double p99LatencyMs
    ) {

        public double errorRate() {
            return requestCount == 0 ? 0.0 : (double) failureCount / requestCount;
        }
    }
}
