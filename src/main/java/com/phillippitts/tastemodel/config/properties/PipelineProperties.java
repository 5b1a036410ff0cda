package com.phillippitts.tastemodel.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Every recognized option of the retrain pipeline.
 *
 * <p>Properties:
 * <ul>
 *   <li>pipeline.model-type - model type the decision loop retrains (default: preference)</li>
 *   <li>pipeline.auto-start - start background workers with the application (default: true)</li>
 *   <li>pipeline.auto-promote - promote winning challengers automatically (default: true)</li>
 *   <li>pipeline.retrain-threshold - new ratings needed before a retrain (default: 50)</li>
 *   <li>pipeline.min-retrain-interval-minutes - minimum age of {@code latest} before retraining (default: 1440)</li>
 *   <li>pipeline.feedback-queue-capacity - bounded feedback queue size (default: 10000)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public class PipelineProperties {

    /** Model type retrained by the decision loop. */
    @NotBlank
    private String modelType = "preference";

    /** Start collector, health and decision workers when the context starts. */
    private boolean autoStart = true;

    /** Promote challengers that win the comparison; when false they are only stored. */
    private boolean autoPromote = true;

    /** Accept rating feedback. */
    private boolean collectFeedback = true;

    /** Accept controller usage events. */
    private boolean collectControllerData = true;

    /** New ratings required since the last training before a retrain is due. */
    @Positive(message = "Retrain threshold must be positive")
    private int retrainThreshold = 50;

    /** Minimum minutes between the creation of {@code latest} and the next retrain. */
    @PositiveOrZero(message = "Minimum retrain interval must not be negative")
    private long minRetrainIntervalMinutes = 24 * 60;

    /** Rated tracks required for a training run; smaller datasets are discarded. */
    @Positive(message = "Minimum training samples must be positive")
    private int minTrainingSamples = 10;

    /** Runs whose trainer returns later than this are treated as failed. */
    @Positive(message = "Training timeout must be positive")
    private long trainingTimeoutMs = 600_000;

    /** Minutes scheduled retrains wait after a discarded or failed run. Forced triggers ignore it. */
    @PositiveOrZero(message = "Retry backoff must not be negative")
    private long retryBackoffMinutes = 30;

    /** Delay between collector loop iterations. */
    @Positive(message = "Collector interval must be positive")
    private long collectorIntervalMs = 1_000;

    /** Delay between decision loop iterations. */
    @Positive(message = "Decision interval must be positive")
    private long decisionIntervalMs = 10_000;

    /** Delay between health probes. */
    @Positive(message = "Health check interval must be positive")
    private long healthCheckIntervalMs = 60_000;

    /** Upper bound on waiting for workers in {@code stop()}. */
    @Positive(message = "Stop timeout must be positive")
    private long stopTimeoutMs = 5_000;

    @Positive(message = "Feedback queue capacity must be positive")
    private int feedbackQueueCapacity = 10_000;

    @Positive(message = "Controller data queue capacity must be positive")
    private int controllerDataQueueCapacity = 10_000;

    /** Number of recent controller events kept for inspection. */
    @Positive(message = "Controller data retention must be positive")
    private int controllerDataRetention = 1_000;

    /**
     * Share of traffic a canary deployment would receive. Declared for configuration
     * compatibility; no traffic splitting is performed.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double canaryPercentage = 0.1;

    public String getModelType() {
        return modelType;
    }

    public void setModelType(String modelType) {
        this.modelType = modelType;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public boolean isAutoPromote() {
        return autoPromote;
    }

    public void setAutoPromote(boolean autoPromote) {
        this.autoPromote = autoPromote;
    }

    public boolean isCollectFeedback() {
        return collectFeedback;
    }

    public void setCollectFeedback(boolean collectFeedback) {
        this.collectFeedback = collectFeedback;
    }

    public boolean isCollectControllerData() {
        return collectControllerData;
    }

    public void setCollectControllerData(boolean collectControllerData) {
        this.collectControllerData = collectControllerData;
    }

    public int getRetrainThreshold() {
        return retrainThreshold;
    }

    public void setRetrainThreshold(int retrainThreshold) {
        this.retrainThreshold = retrainThreshold;
    }

    public long getMinRetrainIntervalMinutes() {
        return minRetrainIntervalMinutes;
    }

    public void setMinRetrainIntervalMinutes(long minRetrainIntervalMinutes) {
        this.minRetrainIntervalMinutes = minRetrainIntervalMinutes;
    }

    public int getMinTrainingSamples() {
        return minTrainingSamples;
    }

    public void setMinTrainingSamples(int minTrainingSamples) {
        this.minTrainingSamples = minTrainingSamples;
    }

    public long getTrainingTimeoutMs() {
        return trainingTimeoutMs;
    }

    public void setTrainingTimeoutMs(long trainingTimeoutMs) {
        this.trainingTimeoutMs = trainingTimeoutMs;
    }

    public long getRetryBackoffMinutes() {
        return retryBackoffMinutes;
    }

    public void setRetryBackoffMinutes(long retryBackoffMinutes) {
        this.retryBackoffMinutes = retryBackoffMinutes;
    }

    public long getCollectorIntervalMs() {
        return collectorIntervalMs;
    }

    public void setCollectorIntervalMs(long collectorIntervalMs) {
        this.collectorIntervalMs = collectorIntervalMs;
    }

    public long getDecisionIntervalMs() {
        return decisionIntervalMs;
    }

    public void setDecisionIntervalMs(long decisionIntervalMs) {
        this.decisionIntervalMs = decisionIntervalMs;
    }

    public long getHealthCheckIntervalMs() {
        return healthCheckIntervalMs;
    }

    public void setHealthCheckIntervalMs(long healthCheckIntervalMs) {
        this.healthCheckIntervalMs = healthCheckIntervalMs;
    }

    public long getStopTimeoutMs() {
        return stopTimeoutMs;
    }

    public void setStopTimeoutMs(long stopTimeoutMs) {
        this.stopTimeoutMs = stopTimeoutMs;
    }

    public int getFeedbackQueueCapacity() {
        return feedbackQueueCapacity;
    }

    public void setFeedbackQueueCapacity(int feedbackQueueCapacity) {
        this.feedbackQueueCapacity = feedbackQueueCapacity;
    }

    public int getControllerDataQueueCapacity() {
        return controllerDataQueueCapacity;
    }

    public void setControllerDataQueueCapacity(int controllerDataQueueCapacity) {
        this.controllerDataQueueCapacity = controllerDataQueueCapacity;
    }

    public int getControllerDataRetention() {
        return controllerDataRetention;
    }

    public void setControllerDataRetention(int controllerDataRetention) {
        this.controllerDataRetention = controllerDataRetention;
    }

    public double getCanaryPercentage() {
        return canaryPercentage;
    }

    public void setCanaryPercentage(double canaryPercentage) {
        this.canaryPercentage = canaryPercentage;
    }
}
