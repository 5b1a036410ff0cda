package com.phillippitts.tastemodel.service.pipeline;

import com.phillippitts.tastemodel.config.properties.CatalogProperties;
import com.phillippitts.tastemodel.config.properties.PipelineProperties;
import com.phillippitts.tastemodel.domain.ControllerEvent;
import com.phillippitts.tastemodel.domain.Feedback;
import com.phillippitts.tastemodel.domain.HealthStatus;
import com.phillippitts.tastemodel.domain.PipelineState;
import com.phillippitts.tastemodel.domain.VersionInfo;
import com.phillippitts.tastemodel.exception.ConcurrentTrainingException;
import com.phillippitts.tastemodel.exception.InvalidInputException;
import com.phillippitts.tastemodel.exception.NotFoundException;
import com.phillippitts.tastemodel.exception.TrainingException;
import com.phillippitts.tastemodel.service.catalog.AttributeFeatureProvider;
import com.phillippitts.tastemodel.service.catalog.InMemoryTrackStore;
import com.phillippitts.tastemodel.service.catalog.TrackCatalogService;
import com.phillippitts.tastemodel.service.health.HealthMonitor;
import com.phillippitts.tastemodel.service.metrics.PipelineMetrics;
import com.phillippitts.tastemodel.service.pipeline.event.FeedbackDroppedEvent;
import com.phillippitts.tastemodel.service.pipeline.event.ModelDeployedEvent;
import com.phillippitts.tastemodel.service.pipeline.event.RetrainFailedEvent;
import com.phillippitts.tastemodel.service.pipeline.event.TrainingCompletedEvent;
import com.phillippitts.tastemodel.service.registry.FileSystemModelRegistry;
import com.phillippitts.tastemodel.service.training.Trainer;
import com.phillippitts.tastemodel.testutil.EventCapturingPublisher;
import com.phillippitts.tastemodel.testutil.MutableClock;
import com.phillippitts.tastemodel.testutil.ScriptedTrainer;
import com.phillippitts.tastemodel.testutil.SyncExecutor;
import com.phillippitts.tastemodel.testutil.TestModels;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetrainCoordinatorTest {

    private static final String TYPE = "preference";
    private static final byte[] SEED_ARTIFACT = "seed".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path root;

    private PipelineProperties properties;
    private FileSystemModelRegistry registry;
    private TrackCatalogService catalog;
    private HealthMonitor healthMonitor;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private RetrainCoordinator coordinator;
    private ExecutorService asyncPool;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.setModelType(TYPE);
        properties.setRetrainThreshold(3);
        properties.setMinTrainingSamples(3);
        properties.setMinRetrainIntervalMinutes(60);

        registry = new FileSystemModelRegistry(root, 0.05);
        catalog = new TrackCatalogService(new InMemoryTrackStore(), new AttributeFeatureProvider(), new CatalogProperties());
        healthMonitor = mock(HealthMonitor.class);
        when(healthMonitor.currentStatus()).thenReturn(HealthStatus.HEALTHY);
        publisher = new EventCapturingPublisher();
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(Instant.now());

        for (int i = 1; i <= 5; i++) {
            catalog.register("t" + i, i % 2 == 0 ? "house" : "techno", Map.of("bpm", 110 + i * 5, "energy", i / 10.0));
        }
    }

    @AfterEach
    void tearDown() {
        if (coordinator != null) {
            coordinator.stop();
        }
        if (asyncPool != null) {
            asyncPool.shutdownNow();
        }
    }

    private RetrainCoordinator coordinator(Trainer trainer) {
        return coordinator(trainer, new SyncExecutor());
    }

    private RetrainCoordinator coordinator(Trainer trainer, Executor executor) {
        coordinator = new RetrainCoordinator(properties, registry, List.of(trainer), catalog, healthMonitor,
                executor, publisher, new PipelineMetrics(meterRegistry), clock);
        return coordinator;
    }

    private void rateAll() {
        for (int i = 1; i <= 5; i++) {
            catalog.rate("t" + i, 1 + i % 5, Instant.now());
        }
    }

    private void seedVersions(double... mses) {
        for (double mse : mses) {
            registry.saveVersion(TYPE, SEED_ARTIFACT, TestModels.metadata(TYPE), TestModels.metrics(mse), true);
        }
    }

    @Test
    void promotesChallengerThatBeatsIncumbentByMargin() {
        seedVersions(0.50, 0.45, 0.40);
        rateAll();
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE, 0.32));

        assertThat(c.triggerTrain(TYPE, true)).isEqualTo(TriggerResult.STARTED);

        assertThat(registry.latestVersion(TYPE)).hasValue(4);
        assertThat(registry.listVersions(TYPE)).extracting(VersionInfo::version).contains(3);
        RetrainRun run = c.lastRun().orElseThrow();
        assertThat(run.outcome()).isEqualTo(RetrainOutcome.PROMOTED);
        assertThat(run.version()).isEqualTo(4);
        assertThat(run.incumbent()).isEqualTo(3);
        assertThat(c.state()).isEqualTo(PipelineState.IDLE);

        ModelDeployedEvent deployed = publisher.eventsOf(ModelDeployedEvent.class).get(0);
        assertThat(deployed.version()).isEqualTo(4);
        assertThat(deployed.previousVersion()).isEqualTo(3);
        assertThat(deployed.rollback()).isFalse();
        assertThat(publisher.eventsOf(TrainingCompletedEvent.class)).hasSize(1);
    }

    @Test
    void retainsIncumbentWhenChallengerIsWorse() {
        seedVersions(0.50, 0.45, 0.40, 0.32);
        rateAll();
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE, 0.39));

        c.triggerTrain(TYPE, true);

        assertThat(registry.latestVersion(TYPE)).hasValue(4);
        assertThat(registry.listVersions(TYPE)).extracting(VersionInfo::version).containsExactly(5, 4, 3, 2, 1);
        assertThat(c.lastRun().orElseThrow().outcome()).isEqualTo(RetrainOutcome.RETAINED);
        assertThat(publisher.eventsOf(ModelDeployedEvent.class)).isEmpty();
    }

    @Test
    void firstModelIsPromotedWithoutComparison() {
        rateAll();
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE, 0.9));

        c.triggerTrain(TYPE, true);

        assertThat(registry.latestVersion(TYPE)).hasValue(1);
        assertThat(c.lastRun().orElseThrow().outcome()).isEqualTo(RetrainOutcome.PROMOTED);
        assertThat(publisher.eventsOf(ModelDeployedEvent.class).get(0).previousVersion()).isNull();
    }

    @Test
    void criticalHealthBlocksPromotion() {
        seedVersions(0.40);
        rateAll();
        when(healthMonitor.currentStatus()).thenReturn(HealthStatus.CRITICAL);
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE, 0.10));

        c.triggerTrain(TYPE, true);

        assertThat(registry.latestVersion(TYPE)).hasValue(1);
        assertThat(registry.listVersions(TYPE)).hasSize(2);
        RetrainRun run = c.lastRun().orElseThrow();
        assertThat(run.outcome()).isEqualTo(RetrainOutcome.BLOCKED);
        assertThat(run.detail()).contains("CRITICAL");
    }

    @Test
    void degradedHealthStillPromotes() {
        seedVersions(0.40);
        rateAll();
        when(healthMonitor.currentStatus()).thenReturn(HealthStatus.DEGRADED);
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE, 0.10));

        c.triggerTrain(TYPE, true);

        assertThat(registry.latestVersion(TYPE)).hasValue(2);
    }

    @Test
    void autoPromoteDisabledKeepsLatest() {
        seedVersions(0.40);
        rateAll();
        properties.setAutoPromote(false);
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE, 0.10));

        c.triggerTrain(TYPE, true);

        assertThat(registry.latestVersion(TYPE)).hasValue(1);
        assertThat(c.lastRun().orElseThrow().outcome()).isEqualTo(RetrainOutcome.RETAINED);
    }

    @Test
    void trainerFailureLeavesLatestUntouchedAndRecordsError() {
        seedVersions(0.40);
        rateAll();
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE)
                .failWith(new TrainingException("matrix is singular", TYPE)));

        assertThat(c.triggerTrain(TYPE, true)).isEqualTo(TriggerResult.STARTED);

        assertThat(registry.latestVersion(TYPE)).hasValue(1);
        assertThat(registry.listVersions(TYPE)).hasSize(1);
        assertThat(c.lastRun().orElseThrow().outcome()).isEqualTo(RetrainOutcome.FAILED);
        assertThat(c.status().lastError()).contains("matrix is singular");
        assertThat(c.status().lastErrorAt()).isEqualTo(clock.instant());
        assertThat(c.state()).isEqualTo(PipelineState.IDLE);
        RetrainFailedEvent failed = publisher.eventsOf(RetrainFailedEvent.class).get(0);
        assertThat(failed.modelType()).isEqualTo(TYPE);
        assertThat(meterRegistry.get("tastemodel.pipeline.retrain").tag("outcome", "failed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void tooFewSamplesDiscardsRunAndKeepsCounter() {
        catalog.rate("t1", 4.0, Instant.now());
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE, 0.1));
        c.collectFeedback(Feedback.of("t2", 5.0));
        c.collectorTick();

        c.triggerTrain(TYPE, true);

        assertThat(c.lastRun().orElseThrow().outcome()).isEqualTo(RetrainOutcome.DISCARDED);
        assertThat(registry.listVersions(TYPE)).isEmpty();
        assertThat(c.trainingDataCount()).isEqualTo(1);
    }

    @Test
    void collectedFeedbackIsAppliedAndConsumedByRun() {
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE, 0.2));
        c.collectFeedback(Feedback.of("t1", 5.0));
        c.collectFeedback(Feedback.of("t2", 1.0));
        c.collectFeedback(Feedback.of("t3", 3.0));
        assertThat(c.trainingDataCount()).isZero();

        c.collectorTick();

        assertThat(c.trainingDataCount()).isEqualTo(3);
        assertThat(catalog.get("t1").rating()).isEqualTo(5.0);
        assertThat(c.shouldRetrain(TYPE)).isTrue();

        c.decisionTick();

        assertThat(registry.latestVersion(TYPE)).hasValue(1);
        assertThat(c.trainingDataCount()).isZero();
        assertThat(c.shouldRetrain(TYPE)).isFalse();
    }

    @Test
    void shouldRetrainHonoursThresholdAndMinimumInterval() {
        seedVersions(0.40);
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE, 0.1));
        c.collectFeedback(Feedback.of("t1", 5.0));
        c.collectFeedback(Feedback.of("t2", 4.0));
        c.collectorTick();
        assertThat(c.shouldRetrain(TYPE)).isFalse();

        c.collectFeedback(Feedback.of("t3", 2.0));
        c.collectorTick();
        assertThat(c.shouldRetrain(TYPE)).isFalse();
        assertThat(c.triggerTrain(TYPE, false)).isEqualTo(TriggerResult.NOT_DUE);

        clock.advance(Duration.ofMinutes(61));
        assertThat(c.shouldRetrain(TYPE)).isTrue();
    }

    @Test
    void concurrentTriggersCoalesceIntoOneRun() throws InterruptedException {
        rateAll();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch gate = new CountDownLatch(1);
        ScriptedTrainer trainer = new ScriptedTrainer(TYPE, 0.2).blockOn(entered, gate);
        asyncPool = Executors.newSingleThreadExecutor();
        RetrainCoordinator c = coordinator(trainer, asyncPool);

        assertThat(c.triggerTrain(TYPE, true)).isEqualTo(TriggerResult.STARTED);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(c.state()).isEqualTo(PipelineState.TRAINING);

        assertThat(c.triggerTrain(TYPE, true)).isEqualTo(TriggerResult.COALESCED);
        assertThat(c.triggerTrain(TYPE, true)).isEqualTo(TriggerResult.COALESCED);
        assertThatThrownBy(() -> c.rollback(TYPE, 1)).isInstanceOf(ConcurrentTrainingException.class);

        gate.countDown();
        await().atMost(Duration.ofSeconds(5)).until(() -> c.state() == PipelineState.IDLE);

        assertThat(trainer.calls()).isEqualTo(1);
        assertThat(registry.listVersions(TYPE)).hasSize(1);
        assertThat(c.status().counters()).containsEntry("coalesced", 2L);
    }

    @Test
    void operatorRollbackRepointsAndPublishes() {
        seedVersions(0.40, 0.30);
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE));

        assertThat(c.rollback(TYPE, 1)).isTrue();
        assertThat(c.rollback(TYPE, 9)).isFalse();

        assertThat(registry.latestVersion(TYPE)).hasValue(1);
        ModelDeployedEvent event = publisher.eventsOf(ModelDeployedEvent.class).get(0);
        assertThat(event.rollback()).isTrue();
        assertThat(event.previousVersion()).isEqualTo(2);
        assertThat(c.state()).isEqualTo(PipelineState.IDLE);
    }

    @Test
    void validatesFeedbackInput() {
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE));

        assertThatThrownBy(() -> c.collectFeedback(Feedback.of("t1", 6.0)))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> c.collectFeedback(Feedback.of("t1", 0.5)))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> c.collectFeedback(Feedback.of("missing", 3.0)))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> c.triggerTrain("unknown", true))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void fullQueueDropsFeedbackWithoutBlocking() {
        properties.setFeedbackQueueCapacity(1);
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE));

        assertThat(c.collectFeedback(Feedback.of("t1", 3.0))).isTrue();
        assertThat(c.collectFeedback(Feedback.of("t2", 3.0))).isFalse();

        FeedbackDroppedEvent dropped = publisher.eventsOf(FeedbackDroppedEvent.class).get(0);
        assertThat(dropped.reason()).isEqualTo("queue_full");
        assertThat(c.status().counters()).containsEntry("feedback_dropped", 1L);
    }

    @Test
    void disabledCollectionDropsFeedback() {
        properties.setCollectFeedback(false);
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE));

        assertThat(c.collectFeedback(Feedback.of("t1", 3.0))).isFalse();
        assertThat(publisher.eventsOf(FeedbackDroppedEvent.class).get(0).reason()).isEqualTo("disabled");
    }

    @Test
    void controllerEventsAreRetainedUpToLimit() {
        properties.setControllerDataRetention(2);
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE));

        c.collectControllerData(new ControllerEvent("preview", Map.of("track", "t1"), null));
        c.collectControllerData(new ControllerEvent("skip", Map.of(), null));
        c.collectControllerData(new ControllerEvent(null, Map.of(), null));
        c.collectorTick();

        assertThat(c.recentControllerEvents()).extracting(ControllerEvent::type).containsExactly("skip", "unknown");
        assertThat(c.status().counters()).containsEntry("controller_events", 3L);
    }

    @Test
    void startAndStopMoveBetweenRunningAndIdle() {
        properties.setCollectorIntervalMs(50);
        properties.setDecisionIntervalMs(50);
        properties.setHealthCheckIntervalMs(50);
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE));

        c.start();
        c.start();
        assertThat(c.isRunning()).isTrue();
        assertThat(c.state()).isEqualTo(PipelineState.RUNNING);

        c.stop();
        assertThat(c.isRunning()).isFalse();
        assertThat(c.state()).isEqualTo(PipelineState.IDLE);
    }

    @Test
    void workersCollectAndTrainInBackground() {
        properties.setCollectorIntervalMs(20);
        properties.setDecisionIntervalMs(20);
        properties.setHealthCheckIntervalMs(1_000);
        asyncPool = Executors.newSingleThreadExecutor();
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE, 0.2), asyncPool);
        c.start();

        c.collectFeedback(Feedback.of("t1", 5.0));
        c.collectFeedback(Feedback.of("t2", 2.0));
        c.collectFeedback(Feedback.of("t3", 4.0));

        await().atMost(Duration.ofSeconds(5)).until(() -> registry.latestVersion(TYPE).isPresent());
        assertThat(c.lastRun()).isPresent();
    }

    @Test
    void stateSurvivesRestart() {
        rateAll();
        coordinator(new ScriptedTrainer(TYPE, 0.3)).triggerTrain(TYPE, true);

        FileSystemModelRegistry reopened = new FileSystemModelRegistry(root, 0.05);
        RetrainCoordinator restarted = new RetrainCoordinator(properties, reopened,
                List.of(new ScriptedTrainer(TYPE, 0.1)), catalog, healthMonitor, new SyncExecutor(),
                publisher, new PipelineMetrics(meterRegistry), clock);

        assertThat(restarted.status().latestVersion()).isEqualTo(1);
        assertThat(restarted.status().lastTrainingTime()).isNotNull();

        restarted.triggerTrain(TYPE, true);
        assertThat(reopened.latestVersion(TYPE)).hasValue(2);
    }

    @Test
    void rejectsMissingOrDuplicateTrainers() {
        assertThatThrownBy(() -> coordinator(new ScriptedTrainer("other")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("preference");
        assertThatThrownBy(() -> new RetrainCoordinator(properties, registry,
                List.of(new ScriptedTrainer(TYPE), new ScriptedTrainer(TYPE)), catalog, healthMonitor,
                new SyncExecutor(), publisher, new PipelineMetrics(meterRegistry), clock))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectedExecutionEndsRunAsFailed() {
        rateAll();
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE), command -> {
            throw new RejectedExecutionException("saturated");
        });

        assertThat(c.triggerTrain(TYPE, true)).isEqualTo(TriggerResult.STARTED);

        assertThat(c.lastRun().orElseThrow().outcome()).isEqualTo(RetrainOutcome.FAILED);
        assertThat(c.state()).isEqualTo(PipelineState.IDLE);
    }

    @Test
    void errorFromTrainerStillReleasesPipeline() {
        rateAll();
        ScriptedTrainer trainer = new ScriptedTrainer(TYPE).failWith(new NoClassDefFoundError("org/ejml/Matrix"));
        asyncPool = Executors.newSingleThreadExecutor();
        RetrainCoordinator c = coordinator(trainer, asyncPool);

        assertThat(c.triggerTrain(TYPE, true)).isEqualTo(TriggerResult.STARTED);
        await().atMost(Duration.ofSeconds(5)).until(() -> c.state() == PipelineState.IDLE);

        assertThat(c.lastRun().orElseThrow().outcome()).isEqualTo(RetrainOutcome.FAILED);
        assertThat(c.status().lastError()).contains("NoClassDefFoundError");
        assertThat(publisher.eventsOf(RetrainFailedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.cause()).isInstanceOf(NoClassDefFoundError.class));

        assertThat(c.triggerTrain(TYPE, true)).isEqualTo(TriggerResult.STARTED);
        await().atMost(Duration.ofSeconds(5)).until(() -> c.state() == PipelineState.IDLE);
        assertThat(trainer.calls()).isEqualTo(2);
        assertThat(c.status().counters()).containsEntry("failed", 2L);
    }

    @Test
    void trainerExceedingTimeoutFailsWithoutStoringOrConsumingFeedback() {
        seedVersions(0.40);
        rateAll();
        properties.setTrainingTimeoutMs(1);
        RetrainCoordinator c = coordinator(new ScriptedTrainer(TYPE, 0.1).taking(50));
        c.collectFeedback(Feedback.of("t1", 5.0));
        c.collectFeedback(Feedback.of("t2", 1.0));
        c.collectorTick();

        assertThat(c.triggerTrain(TYPE, true)).isEqualTo(TriggerResult.STARTED);

        RetrainRun run = c.lastRun().orElseThrow();
        assertThat(run.outcome()).isEqualTo(RetrainOutcome.FAILED);
        assertThat(run.version()).isNull();
        assertThat(c.status().lastError()).contains("TrainingException").contains("1ms timeout");
        assertThat(registry.latestVersion(TYPE)).hasValue(1);
        assertThat(registry.listVersions(TYPE)).hasSize(1);
        assertThat(c.trainingDataCount()).isEqualTo(2);
        assertThat(publisher.eventsOf(TrainingCompletedEvent.class)).isEmpty();
        assertThat(c.state()).isEqualTo(PipelineState.IDLE);
    }

    @Test
    void scheduledRetrainsBackOffAfterDiscardedRun() {
        properties.setRetryBackoffMinutes(30);
        ScriptedTrainer trainer = new ScriptedTrainer(TYPE, 0.1);
        RetrainCoordinator c = coordinator(trainer);
        for (int i = 0; i < 3; i++) {
            c.collectFeedback(Feedback.of("t1", 4.0));
        }
        c.collectorTick();

        for (int tick = 0; tick < 5; tick++) {
            c.decisionTick();
        }

        assertThat(c.status().counters()).containsEntry("discarded", 1L);
        assertThat(c.trainingDataCount()).isEqualTo(3);
        assertThat(c.shouldRetrain(TYPE)).isFalse();
        assertThat(c.triggerTrain(TYPE, false)).isEqualTo(TriggerResult.NOT_DUE);

        clock.advance(Duration.ofMinutes(31));
        assertThat(c.shouldRetrain(TYPE)).isTrue();
        c.decisionTick();
        c.decisionTick();

        assertThat(c.status().counters()).containsEntry("discarded", 2L);
        assertThat(trainer.calls()).isZero();
    }

    @Test
    void forcedTriggerIgnoresBackoffAndSuccessClearsIt() {
        properties.setRetryBackoffMinutes(120);
        properties.setTrainingTimeoutMs(1);
        ScriptedTrainer trainer = new ScriptedTrainer(TYPE, 0.2, 0.1).taking(20);
        rateAll();
        RetrainCoordinator c = coordinator(trainer);
        for (int i = 1; i <= 3; i++) {
            c.collectFeedback(Feedback.of("t" + i, 3.0));
        }
        c.collectorTick();

        c.decisionTick();
        c.decisionTick();
        assertThat(trainer.calls()).isEqualTo(1);
        assertThat(c.lastRun().orElseThrow().outcome()).isEqualTo(RetrainOutcome.FAILED);

        properties.setTrainingTimeoutMs(600_000);
        assertThat(c.triggerTrain(TYPE, false)).isEqualTo(TriggerResult.NOT_DUE);
        assertThat(c.triggerTrain(TYPE, true)).isEqualTo(TriggerResult.STARTED);
        assertThat(c.lastRun().orElseThrow().outcome()).isEqualTo(RetrainOutcome.PROMOTED);

        for (int i = 1; i <= 3; i++) {
            c.collectFeedback(Feedback.of("t" + i, 4.0));
        }
        c.collectorTick();
        clock.advance(Duration.ofMinutes(61));
        assertThat(c.shouldRetrain(TYPE)).isTrue();
    }
}
