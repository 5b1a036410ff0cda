package com.phillippitts.tastemodel.service.events;

import com.phillippitts.tastemodel.service.health.event.HealthAlertEvent;
import com.phillippitts.tastemodel.service.pipeline.event.FeedbackDroppedEvent;
import com.phillippitts.tastemodel.service.pipeline.event.ModelDeployedEvent;
import com.phillippitts.tastemodel.service.pipeline.event.RetrainFailedEvent;
import com.phillippitts.tastemodel.service.pipeline.event.TrainingCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log of pipeline notifications. Repeated drop warnings are throttled to
 * avoid log spam when a producer floods a full queue.
 */
@Component
class PipelineEventsListener {
    private static final Logger LOG = LogManager.getLogger(PipelineEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onHealthAlert(HealthAlertEvent e) {
        LOG.warn("Serving health {} -> {} (score={}). Issues: {}. Recommendations: {}",
                e.previous(), e.current(), String.format(Locale.ROOT, "%.2f", e.score()),
                e.result().issues(), e.result().recommendations());
    }

    @EventListener
    void onTrainingCompleted(TrainingCompletedEvent e) {
        LOG.info("Challenger stored: {} v{} on {} samples in {}ms (error={})",
                e.modelType(), e.version(), e.samples(), e.durationMs(), e.metrics().errorMetric());
    }

    @EventListener
    void onModelDeployed(ModelDeployedEvent e) {
        LOG.info("Serving {} v{} (previous={}, rollback={})",
                e.modelType(), e.version(), e.previousVersion(), e.rollback());
    }

    @EventListener
    void onRetrainFailed(RetrainFailedEvent e) {
        if (shouldLog("retrain-failed-" + e.modelType())) {
            LOG.warn("Retrain of {} failed: {}. Accumulated feedback is kept for the next run.",
                    e.modelType(), e.message());
        }
    }

    @EventListener
    void onFeedbackDropped(FeedbackDroppedEvent e) {
        if (shouldLog("dropped-" + e.queue() + '-' + e.reason())) {
            LOG.warn("Dropping {} items: reason={}. Further drops are counted in tastemodel.feedback.dropped.",
                    e.queue(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
