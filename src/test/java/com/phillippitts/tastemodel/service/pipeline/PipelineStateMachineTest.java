package com.phillippitts.tastemodel.service.pipeline;

import com.phillippitts.tastemodel.domain.PipelineState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineStateMachineTest {

    private PipelineStateMachine sm;

    @BeforeEach
    void setUp() {
        sm = new PipelineStateMachine();
    }

    @Test
    void startsIdleAndFollowsWorkers() {
        assertThat(sm.state()).isEqualTo(PipelineState.IDLE);
        sm.setWorkersRunning(true);
        assertThat(sm.state()).isEqualTo(PipelineState.RUNNING);
        sm.setWorkersRunning(false);
        assertThat(sm.state()).isEqualTo(PipelineState.IDLE);
    }

    @Test
    void fullPromotionPathReturnsToRunning() {
        sm.setWorkersRunning(true);
        UUID run = UUID.randomUUID();

        assertThat(sm.tryBegin("preference", run, PipelineState.TRAINING)).isTrue();
        sm.advance(run, PipelineState.EVALUATING);
        sm.advance(run, PipelineState.DEPLOYING);
        assertThat(sm.state()).isEqualTo(PipelineState.DEPLOYING);
        assertThat(sm.activeModelType()).isEqualTo("preference");

        assertThat(sm.finish(run)).isTrue();
        assertThat(sm.state()).isEqualTo(PipelineState.RUNNING);
        assertThat(sm.hasActiveRun()).isFalse();
    }

    @Test
    void secondRunIsRejectedWhileBusy() {
        UUID first = UUID.randomUUID();
        assertThat(sm.tryBegin("preference", first, PipelineState.TRAINING)).isTrue();

        assertThat(sm.tryBegin("preference", UUID.randomUUID(), PipelineState.TRAINING)).isFalse();
        assertThat(sm.tryBegin("other", UUID.randomUUID(), PipelineState.ROLLING_BACK)).isFalse();
    }

    @Test
    void illegalTransitionsThrow() {
        UUID run = UUID.randomUUID();
        sm.tryBegin("preference", run, PipelineState.TRAINING);

        assertThatThrownBy(() -> sm.advance(run, PipelineState.DEPLOYING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("TRAINING -> DEPLOYING");
        assertThatThrownBy(() -> sm.tryBegin("preference", UUID.randomUUID(), PipelineState.EVALUATING))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void staleRunCannotMoveState() {
        UUID run = UUID.randomUUID();
        UUID stale = UUID.randomUUID();
        sm.tryBegin("preference", run, PipelineState.TRAINING);

        assertThatThrownBy(() -> sm.advance(stale, PipelineState.EVALUATING))
                .isInstanceOf(IllegalStateException.class);
        sm.fail(stale);
        assertThat(sm.finish(stale)).isFalse();
        assertThat(sm.state()).isEqualTo(PipelineState.TRAINING);
    }

    @Test
    void failureIsVisibleUntilFinished() {
        UUID run = UUID.randomUUID();
        sm.tryBegin("preference", run, PipelineState.TRAINING);

        sm.fail(run);
        assertThat(sm.state()).isEqualTo(PipelineState.FAILED);

        sm.finish(run);
        assertThat(sm.state()).isEqualTo(PipelineState.IDLE);
    }

    @Test
    void onlyOneConcurrentBeginWins() throws InterruptedException {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger admitted = new AtomicInteger();
        try {
            for (int i = 0; i < threads; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        if (sm.tryBegin("preference", UUID.randomUUID(), PipelineState.TRAINING)) {
                            admitted.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(admitted.get()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
