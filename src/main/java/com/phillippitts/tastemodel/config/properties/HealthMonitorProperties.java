package com.phillippitts.tastemodel.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the serving health monitor.
 */
@ConfigurationProperties(prefix = "health.monitor")
@Validated
public class HealthMonitorProperties {

    /** Alert when a status change lands on a score at or below this value. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double alertThreshold = 0.8;

    /** Timeout of a single serving probe, independent of the check interval. */
    @Positive(message = "Probe timeout must be positive")
    private long probeTimeoutMs = 2_000;

    /** Liveness URL of the serving dependency; blank disables the HTTP probe. */
    private String probeUrl = "";

    /** Days of health history kept before the hourly sweep drops samples. */
    @Positive(message = "Retention days must be positive")
    private int retentionDays = 7;

    /** Average latency at which the latency component of the score reaches zero. */
    @Positive(message = "Latency budget must be positive")
    private long latencyBudgetMs = 1_000;

    public double getAlertThreshold() {
        return alertThreshold;
    }

    public void setAlertThreshold(double alertThreshold) {
        this.alertThreshold = alertThreshold;
    }

    public long getProbeTimeoutMs() {
        return probeTimeoutMs;
    }

    public void setProbeTimeoutMs(long probeTimeoutMs) {
        this.probeTimeoutMs = probeTimeoutMs;
    }

    public String getProbeUrl() {
        return probeUrl;
    }

    public void setProbeUrl(String probeUrl) {
        this.probeUrl = probeUrl;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }

    public long getLatencyBudgetMs() {
        return latencyBudgetMs;
    }

    public void setLatencyBudgetMs(long latencyBudgetMs) {
        this.latencyBudgetMs = latencyBudgetMs;
    }
}
