package com.phillippitts.tastemodel.service.pipeline;

import com.phillippitts.tastemodel.config.properties.PipelineProperties;
import com.phillippitts.tastemodel.domain.ControllerEvent;
import com.phillippitts.tastemodel.domain.Feedback;
import com.phillippitts.tastemodel.domain.HealthStatus;
import com.phillippitts.tastemodel.domain.ModelMetadata;
import com.phillippitts.tastemodel.domain.PipelineState;
import com.phillippitts.tastemodel.domain.VersionInfo;
import com.phillippitts.tastemodel.exception.ConcurrentTrainingException;
import com.phillippitts.tastemodel.exception.DeploymentBlockedException;
import com.phillippitts.tastemodel.exception.InvalidInputException;
import com.phillippitts.tastemodel.exception.NotFoundException;
import com.phillippitts.tastemodel.exception.RegistryInvariantException;
import com.phillippitts.tastemodel.exception.TrainingException;
import com.phillippitts.tastemodel.service.catalog.TrackCatalogService;
import com.phillippitts.tastemodel.service.health.HealthMonitor;
import com.phillippitts.tastemodel.service.metrics.PipelineMetrics;
import com.phillippitts.tastemodel.service.pipeline.event.FeedbackDroppedEvent;
import com.phillippitts.tastemodel.service.pipeline.event.ModelDeployedEvent;
import com.phillippitts.tastemodel.service.pipeline.event.RetrainFailedEvent;
import com.phillippitts.tastemodel.service.pipeline.event.TrainingCompletedEvent;
import com.phillippitts.tastemodel.service.registry.ModelRegistry;
import com.phillippitts.tastemodel.service.registry.SavedVersion;
import com.phillippitts.tastemodel.service.registry.VersionComparison;
import com.phillippitts.tastemodel.service.training.Trainer;
import com.phillippitts.tastemodel.service.training.TrainingDataset;
import com.phillippitts.tastemodel.service.training.TrainingOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the model lifecycle: collects feedback, decides when to retrain, trains, evaluates
 * challenger against incumbent and promotes subject to the health gate.
 *
 * <p>Three independently scheduled workers run while the coordinator is started:
 * <ul>
 *   <li><b>collector</b> drains the feedback and controller queues and applies ratings</li>
 *   <li><b>health</b> runs a health check on its own interval</li>
 *   <li><b>decision</b> evaluates {@link #shouldRetrain(String)} and admits a run when due</li>
 * </ul>
 * Training runs on the training executor, so neither a worker nor a request thread waits
 * on a trainer.
 *
 * <p>Run sequence: snapshot dataset, train, save the challenger without moving
 * {@code latest}, reduce the feedback counter by the consumed amount, compare against the
 * incumbent, then promote only when the challenger wins by the promotion margin and health
 * is not {@link HealthStatus#CRITICAL}. Any exception ends the run as
 * {@link RetrainOutcome#FAILED}; {@code latest} is never partially re-pointed.
 *
 * <p><b>Thread Safety:</b> the check-then-act between "is a retrain due" and "admit a run"
 * happens under one coordinator lock. Feedback producers never block: queues are bounded and
 * a full queue drops the item and counts it.
 */
public class RetrainCoordinator {

    private static final Logger LOG = LogManager.getLogger(RetrainCoordinator.class);

    static final String FEEDBACK_QUEUE = "feedback";
    static final String CONTROLLER_QUEUE = "controller";

    private final PipelineProperties properties;
    private final ModelRegistry registry;
    private final Map<String, Trainer> trainers;
    private final TrackCatalogService catalog;
    private final HealthMonitor healthMonitor;
    private final Executor trainingExecutor;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final PipelineStateMachine stateMachine = new PipelineStateMachine();
    private final ReentrantLock lock = new ReentrantLock();

    private final BlockingQueue<Feedback> feedbackQueue;
    private final BlockingQueue<ControllerEvent> controllerQueue;
    private final Deque<ControllerEvent> recentControllerEvents = new ArrayDeque<>();

    private final AtomicLong trainingDataCount = new AtomicLong();
    private final AtomicLong feedbackAccepted = new AtomicLong();
    private final AtomicLong feedbackDropped = new AtomicLong();
    private final AtomicLong controllerEventsReceived = new AtomicLong();
    private final AtomicLong coalesced = new AtomicLong();
    private final Map<RetrainOutcome, AtomicLong> outcomes = new EnumMap<>(RetrainOutcome.class);

    private volatile RetrainRun lastRun;
    private volatile String lastError;
    private volatile Instant lastErrorAt;
    private volatile Instant retryNotBefore;

    // Guarded by lock
    private ThreadPoolTaskScheduler scheduler;
    private final List<ScheduledFuture<?>> workers = new ArrayList<>();

    public RetrainCoordinator(PipelineProperties properties,
                              ModelRegistry registry,
                              List<Trainer> trainers,
                              TrackCatalogService catalog,
                              HealthMonitor healthMonitor,
                              Executor trainingExecutor,
                              ApplicationEventPublisher publisher,
                              PipelineMetrics metrics,
                              Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.trainingExecutor = Objects.requireNonNull(trainingExecutor, "trainingExecutor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");

        Map<String, Trainer> byType = new LinkedHashMap<>();
        for (Trainer t : trainers) {
            if (byType.putIfAbsent(t.modelType(), t) != null) {
                throw new IllegalStateException("Two trainers registered for model type " + t.modelType());
            }
        }
        if (!byType.containsKey(properties.getModelType())) {
            throw new IllegalStateException("No trainer for configured model type '" + properties.getModelType()
                    + "' (available: " + byType.keySet() + ")");
        }
        this.trainers = Map.copyOf(byType);
        for (RetrainOutcome o : RetrainOutcome.values()) {
            outcomes.put(o, new AtomicLong());
        }
        this.feedbackQueue = new ArrayBlockingQueue<>(properties.getFeedbackQueueCapacity());
        this.controllerQueue = new ArrayBlockingQueue<>(properties.getControllerDataQueueCapacity());

        LOG.info("Retrain coordinator created: modelType={}, threshold={}, minInterval={}min, trainers={}",
                properties.getModelType(), properties.getRetrainThreshold(),
                properties.getMinRetrainIntervalMinutes(), this.trainers.keySet());
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Schedules the collector, health and decision workers. Idempotent.
     */
    public void start() {
        lock.lock();
        try {
            if (scheduler != null) {
                LOG.debug("Pipeline already started");
                return;
            }
            ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
            s.setPoolSize(3);
            s.setThreadNamePrefix("pipeline-");
            s.setErrorHandler(t -> LOG.error("Pipeline worker error", t));
            s.initialize();
            workers.add(s.scheduleWithFixedDelay(this::collectorTick,
                    Duration.ofMillis(properties.getCollectorIntervalMs())));
            workers.add(s.scheduleWithFixedDelay(this::healthTick,
                    Duration.ofMillis(properties.getHealthCheckIntervalMs())));
            workers.add(s.scheduleWithFixedDelay(this::decisionTick,
                    Duration.ofMillis(properties.getDecisionIntervalMs())));
            scheduler = s;
            stateMachine.setWorkersRunning(true);
            LOG.info("Pipeline started (collector={}ms, health={}ms, decision={}ms)",
                    properties.getCollectorIntervalMs(), properties.getHealthCheckIntervalMs(),
                    properties.getDecisionIntervalMs());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the workers cooperatively and waits up to {@code stopTimeoutMs} for ticks in
     * progress. An in-flight training run is not interrupted. Idempotent.
     */
    public void stop() {
        ThreadPoolTaskScheduler s;
        lock.lock();
        try {
            s = scheduler;
            if (s == null) {
                return;
            }
            workers.forEach(f -> f.cancel(false));
            workers.clear();
            scheduler = null;
            stateMachine.setWorkersRunning(false);
        } finally {
            lock.unlock();
        }
        s.getScheduledExecutor().shutdown();
        try {
            if (!s.getScheduledExecutor().awaitTermination(properties.getStopTimeoutMs(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Pipeline workers did not stop within {}ms", properties.getStopTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Pipeline stopped");
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return scheduler != null;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- producers

    /**
     * Offers a rating to the collector. Never blocks.
     *
     * @return {@code false} when collection is disabled or the queue is full
     * @throws InvalidInputException if the rating is outside [1, 5]
     * @throws NotFoundException if the track is not in the catalog
     */
    public boolean collectFeedback(Feedback feedback) {
        Objects.requireNonNull(feedback, "feedback");
        TrackCatalogService.validateRating(feedback.rating());
        if (!catalog.contains(feedback.trackId())) {
            throw NotFoundException.track(feedback.trackId());
        }
        if (!properties.isCollectFeedback()) {
            drop(FEEDBACK_QUEUE, "disabled");
            return false;
        }
        if (!feedbackQueue.offer(feedback)) {
            drop(FEEDBACK_QUEUE, "queue_full");
            return false;
        }
        return true;
    }

    /**
     * Offers a controller telemetry event to the collector. Never blocks.
     *
     * @return {@code false} when collection is disabled or the queue is full
     */
    public boolean collectControllerData(ControllerEvent event) {
        Objects.requireNonNull(event, "event");
        if (!properties.isCollectControllerData()) {
            drop(CONTROLLER_QUEUE, "disabled");
            return false;
        }
        if (!controllerQueue.offer(event)) {
            drop(CONTROLLER_QUEUE, "queue_full");
            return false;
        }
        return true;
    }

    // ---------------------------------------------------------------- decisions

    /**
     * {@code newRatings >= retrainThreshold} and at least {@code minRetrainInterval} since the
     * latest version was created. With no latest version only the threshold applies.
     * After a discarded or failed run nothing is due until {@code retryBackoff} has passed.
     */
    public boolean shouldRetrain(String modelType) {
        if (trainingDataCount.get() < properties.getRetrainThreshold()) {
            return false;
        }
        Instant notBefore = retryNotBefore;
        if (notBefore != null && clock.instant().isBefore(notBefore)) {
            return false;
        }
        Optional<Instant> last = lastTrainingTime(modelType);
        if (last.isEmpty()) {
            return true;
        }
        Duration since = Duration.between(last.get(), clock.instant());
        return since.compareTo(Duration.ofMinutes(properties.getMinRetrainIntervalMinutes())) >= 0;
    }

    /**
     * Requests a retrain.
     *
     * @param force start even when {@link #shouldRetrain(String)} does not hold
     * @return STARTED, COALESCED while another run is active, or NOT_DUE
     * @throws InvalidInputException for a model type without a trainer
     */
    public TriggerResult triggerTrain(String modelType, boolean force) {
        requireTrainer(modelType);
        UUID runId = UUID.randomUUID();
        long snapshot;
        lock.lock();
        try {
            if (!force && !shouldRetrain(modelType)) {
                return TriggerResult.NOT_DUE;
            }
            try {
                admit(modelType, runId, PipelineState.TRAINING);
            } catch (ConcurrentTrainingException e) {
                coalesced.incrementAndGet();
                metrics.incrementCoalesced(modelType);
                LOG.info("Retrain trigger for {} coalesced: {}", modelType, e.getMessage());
                return TriggerResult.COALESCED;
            }
            snapshot = trainingDataCount.get();
        } finally {
            lock.unlock();
        }

        Instant startedAt = clock.instant();
        LOG.info("Retrain admitted: modelType={}, runId={}, force={}, pendingRatings={}",
                modelType, runId, force, snapshot);
        try {
            trainingExecutor.execute(() -> runRetrain(modelType, runId, snapshot, startedAt));
        } catch (RejectedExecutionException e) {
            fail(modelType, runId, startedAt, null, null,
                    new TrainingException("Training executor rejected the run", modelType, e));
        }
        return TriggerResult.STARTED;
    }

    /**
     * Operator rollback: re-points {@code latest} while holding the pipeline, so it cannot
     * interleave with a promotion.
     *
     * @return {@code false} when the target version does not exist
     * @throws ConcurrentTrainingException while a retrain run is active
     */
    public boolean rollback(String modelType, int toVersion) {
        UUID runId = UUID.randomUUID();
        lock.lock();
        try {
            admit(modelType, runId, PipelineState.ROLLING_BACK);
        } finally {
            lock.unlock();
        }
        try {
            OptionalInt previous = registry.latestVersion(modelType);
            boolean done = registry.rollback(modelType, toVersion);
            if (done) {
                publisher.publishEvent(new ModelDeployedEvent(modelType, toVersion,
                        previous.isPresent() ? previous.getAsInt() : null, null, true, clock.instant()));
            }
            return done;
        } finally {
            stateMachine.finish(runId);
        }
    }

    // ---------------------------------------------------------------- status

    public PipelineStatus status() {
        String modelType = properties.getModelType();
        Instant lastTraining = null;
        Integer latest = null;
        boolean due = false;
        try {
            lastTraining = lastTrainingTime(modelType).orElse(null);
            OptionalInt l = registry.latestVersion(modelType);
            latest = l.isPresent() ? l.getAsInt() : null;
            due = shouldRetrain(modelType);
        } catch (RuntimeException e) {
            LOG.warn("Registry unreadable while building status: {}", e.getMessage());
        }
        return new PipelineStatus(
                stateMachine.state(),
                isRunning(),
                modelType,
                healthMonitor.currentStatus(),
                healthMonitor.latest().orElse(null),
                trainingDataCount.get(),
                lastTraining,
                due,
                latest,
                lastError,
                lastErrorAt,
                lastRun,
                counters(),
                feedbackQueue.size(),
                controllerQueue.size(),
                properties.getCanaryPercentage());
    }

    public PipelineState state() {
        return stateMachine.state();
    }

    public Optional<RetrainRun> lastRun() {
        return Optional.ofNullable(lastRun);
    }

    public long trainingDataCount() {
        return trainingDataCount.get();
    }

    /**
     * Most recent controller events, oldest first, bounded by {@code controllerDataRetention}.
     */
    public List<ControllerEvent> recentControllerEvents() {
        synchronized (recentControllerEvents) {
            return List.copyOf(recentControllerEvents);
        }
    }

    // ---------------------------------------------------------------- workers

    /** Visible for tests */
    void collectorTick() {
        try {
            Feedback f;
            while ((f = feedbackQueue.poll()) != null) {
                applyFeedback(f);
            }
            ControllerEvent e;
            while ((e = controllerQueue.poll()) != null) {
                recordControllerEvent(e);
            }
        } catch (RuntimeException ex) {
            LOG.error("Collector iteration failed; continuing", ex);
        }
    }

    /** Visible for tests */
    void healthTick() {
        try {
            healthMonitor.checkHealth();
        } catch (RuntimeException ex) {
            LOG.error("Health iteration failed; continuing", ex);
        }
    }

    /** Visible for tests */
    void decisionTick() {
        String modelType = properties.getModelType();
        try {
            if (stateMachine.hasActiveRun()) {
                return;
            }
            TriggerResult result = triggerTrain(modelType, false);
            if (result != TriggerResult.NOT_DUE) {
                LOG.info("Decision worker trigger for {}: {}", modelType, result);
            }
        } catch (RuntimeException ex) {
            LOG.error("Decision iteration failed for {}; continuing", modelType, ex);
        }
    }

    private void applyFeedback(Feedback f) {
        try {
            catalog.rate(f.trackId(), f.rating(), f.receivedAt());
            trainingDataCount.incrementAndGet();
            feedbackAccepted.incrementAndGet();
            metrics.incrementFeedbackAccepted();
        } catch (NotFoundException e) {
            drop(FEEDBACK_QUEUE, "unknown_track");
        }
    }

    private void recordControllerEvent(ControllerEvent e) {
        controllerEventsReceived.incrementAndGet();
        synchronized (recentControllerEvents) {
            recentControllerEvents.addLast(e);
            while (recentControllerEvents.size() > properties.getControllerDataRetention()) {
                recentControllerEvents.removeFirst();
            }
        }
        LOG.debug("Controller event: type={}", e.type());
    }

    // ---------------------------------------------------------------- the run

    private void runRetrain(String modelType, UUID runId, long snapshot, Instant startedAt) {
        ThreadContext.put("modelType", modelType);
        ThreadContext.put("runId", runId.toString());
        Integer challenger = null;
        Integer incumbent = null;
        try {
            TrainingDataset dataset = TrainingDataset.fromTracks(modelType, catalog.tracks(), catalog.featureNames());
            if (dataset.size() < properties.getMinTrainingSamples()) {
                finish(modelType, runId, RetrainOutcome.DISCARDED, null, null, startedAt,
                        "only " + dataset.size() + " rated samples, need " + properties.getMinTrainingSamples());
                return;
            }

            Trainer trainer = trainers.get(modelType);
            long t0 = System.nanoTime();
            TrainingOutcome trained = trainer.train(dataset);
            long elapsedNanos = System.nanoTime() - t0;
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
            metrics.recordTrainingDuration(modelType, elapsedNanos);
            if (elapsedMs > properties.getTrainingTimeoutMs()) {
                throw new TrainingException("Trainer took " + elapsedMs + "ms, exceeding the "
                        + properties.getTrainingTimeoutMs() + "ms timeout", modelType);
            }

            ModelMetadata metadata = ModelMetadata.of(modelType, dataset.size(), dataset.featureDim(),
                    trained.hyperparameters()).withTrainingDuration(elapsedMs);
            SavedVersion saved = registry.saveVersion(modelType, trained.artifact(), metadata, trained.metrics(), false);
            challenger = saved.version();
            trainingDataCount.updateAndGet(c -> Math.max(0, c - snapshot));
            publisher.publishEvent(new TrainingCompletedEvent(modelType, challenger, dataset.size(),
                    trained.metrics(), elapsedMs, clock.instant()));

            stateMachine.advance(runId, PipelineState.EVALUATING);
            OptionalInt latest = registry.latestVersion(modelType);
            VersionComparison comparison = null;
            boolean challengerWins = true;
            if (latest.isPresent()) {
                incumbent = latest.getAsInt();
                comparison = registry.compareVersions(modelType, incumbent, challenger);
                challengerWins = comparison.challengerWins();
            }

            if (!challengerWins) {
                stateMachine.advance(runId, PipelineState.ROLLING_BACK);
                finish(modelType, runId, RetrainOutcome.RETAINED, challenger, incumbent, startedAt,
                        "challenger v" + challenger + " did not beat v" + incumbent + " by "
                                + percent(comparison.margin()) + " (improvement " + percent(comparison.relativeImprovement()) + ")");
                return;
            }
            if (!properties.isAutoPromote()) {
                stateMachine.advance(runId, PipelineState.ROLLING_BACK);
                finish(modelType, runId, RetrainOutcome.RETAINED, challenger, incumbent, startedAt,
                        "challenger v" + challenger + " won but auto-promote is disabled");
                return;
            }
            HealthStatus health = healthMonitor.currentStatus();
            if (health == HealthStatus.CRITICAL) {
                stateMachine.advance(runId, PipelineState.ROLLING_BACK);
                DeploymentBlockedException blocked = new DeploymentBlockedException(modelType, challenger, health);
                finish(modelType, runId, RetrainOutcome.BLOCKED, challenger, incumbent, startedAt, blocked.getMessage());
                return;
            }

            stateMachine.advance(runId, PipelineState.DEPLOYING);
            if (!registry.promote(modelType, challenger)) {
                throw new RegistryInvariantException("Stored challenger " + modelType + " v" + challenger
                        + " vanished before promotion");
            }
            publisher.publishEvent(new ModelDeployedEvent(modelType, challenger, incumbent,
                    comparison == null ? null : comparison.relativeImprovement(), false, clock.instant()));
            finish(modelType, runId, RetrainOutcome.PROMOTED, challenger, incumbent, startedAt,
                    incumbent == null ? "first model" : "beat v" + incumbent + " by " + percent(comparison.relativeImprovement()));
        } catch (RuntimeException e) {
            fail(modelType, runId, startedAt, challenger, incumbent, e);
        } catch (Error e) {
            fail(modelType, runId, startedAt, challenger, incumbent, e);
            throw e;
        } finally {
            if (stateMachine.finish(runId)) {
                LOG.warn("Retrain {} ended without an outcome; run released", runId);
            }
            ThreadContext.remove("modelType");
            ThreadContext.remove("runId");
        }
    }

    private void finish(String modelType, UUID runId, RetrainOutcome outcome, Integer version, Integer incumbent,
                        Instant startedAt, String detail) {
        record(new RetrainRun(runId, modelType, outcome, version, incumbent, detail, startedAt, clock.instant()));
        if (outcome == RetrainOutcome.PROMOTED) {
            LOG.info("Retrain {}: {} v{} promoted ({})", runId, modelType, version, detail);
        } else {
            LOG.warn("Retrain {}: {} {} ({})", runId, modelType, outcome, detail);
        }
        stateMachine.finish(runId);
    }

    private void fail(String modelType, UUID runId, Instant startedAt, Integer version, Integer incumbent,
                      Throwable e) {
        stateMachine.fail(runId);
        lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
        lastErrorAt = clock.instant();
        LOG.error("Retrain {} failed: modelType={}, challenger={}, incumbent={}, startedAt={}; latest unchanged",
                runId, modelType, version, incumbent, startedAt, e);
        record(new RetrainRun(runId, modelType, RetrainOutcome.FAILED, version, incumbent, lastError,
                startedAt, lastErrorAt));
        publisher.publishEvent(new RetrainFailedEvent(modelType, runId, lastError, e, lastErrorAt));
        stateMachine.finish(runId);
    }

    private void record(RetrainRun run) {
        lastRun = run;
        if (run.outcome() == RetrainOutcome.DISCARDED || run.outcome() == RetrainOutcome.FAILED) {
            retryNotBefore = run.finishedAt().plus(Duration.ofMinutes(properties.getRetryBackoffMinutes()));
        } else {
            retryNotBefore = null;
        }
        outcomes.get(run.outcome()).incrementAndGet();
        metrics.recordRetrain(run.modelType(), run.outcome().tag());
    }

    // ---------------------------------------------------------------- helpers

    /** Caller holds {@link #lock}. */
    private void admit(String modelType, UUID runId, PipelineState initial) {
        if (!stateMachine.tryBegin(modelType, runId, initial)) {
            throw new ConcurrentTrainingException(modelType, stateMachine.activeModelType());
        }
    }

    private Optional<Instant> lastTrainingTime(String modelType) {
        return registry.listVersions(modelType).stream()
                .filter(VersionInfo::latest)
                .findFirst()
                .map(v -> v.metadata().createdAt());
    }

    private void requireTrainer(String modelType) {
        if (modelType == null || !trainers.containsKey(modelType)) {
            throw new InvalidInputException("modelType", "no trainer for '" + modelType + "' (available: "
                    + trainers.keySet() + ")");
        }
    }

    private void drop(String queue, String reason) {
        feedbackDropped.incrementAndGet();
        metrics.incrementDropped(queue, reason);
        publisher.publishEvent(new FeedbackDroppedEvent(queue, reason, clock.instant()));
    }

    private Map<String, Long> counters() {
        Map<String, Long> out = new LinkedHashMap<>();
        outcomes.forEach((k, v) -> out.put(k.tag(), v.get()));
        out.put("coalesced", coalesced.get());
        out.put("feedback_accepted", feedbackAccepted.get());
        out.put("feedback_dropped", feedbackDropped.get());
        out.put("controller_events", controllerEventsReceived.get());
        return out;
    }

    private static String percent(Double fraction) {
        return fraction == null ? "n/a" : String.format(Locale.ROOT, "%.1f%%", fraction * 100);
    }
}
