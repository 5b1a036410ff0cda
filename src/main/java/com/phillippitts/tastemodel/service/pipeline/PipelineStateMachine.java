package com.phillippitts.tastemodel.service.pipeline;

import com.phillippitts.tastemodel.domain.PipelineState;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state machine for the retrain pipeline.
 *
 * <p>At most one run owns the pipeline at a time. A run is admitted with
 * {@link #tryBegin(String, UUID, PipelineState)} and every later transition must present the
 * same run id, so a stale worker can never move the state of a newer run.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE ⇄ RUNNING                         (workers started / stopped)
 * IDLE | RUNNING → TRAINING | ROLLING_BACK  (run admitted)
 * TRAINING → EVALUATING
 * EVALUATING → DEPLOYING | ROLLING_BACK
 * any busy state → FAILED
 * busy state | FAILED → RUNNING or IDLE  (run finished)
 * </pre>
 *
 * <p><b>Thread Safety:</b> All public methods are thread-safe and use a
 * {@link ReentrantLock} to protect state transitions.
 */
public final class PipelineStateMachine {

    private static final Map<PipelineState, Set<PipelineState>> ALLOWED = Map.of(
            PipelineState.TRAINING, EnumSet.of(PipelineState.EVALUATING, PipelineState.FAILED),
            PipelineState.EVALUATING, EnumSet.of(PipelineState.DEPLOYING, PipelineState.ROLLING_BACK, PipelineState.FAILED),
            PipelineState.DEPLOYING, EnumSet.of(PipelineState.FAILED),
            PipelineState.ROLLING_BACK, EnumSet.of(PipelineState.FAILED)
    );

    private final Lock lock = new ReentrantLock();
    private PipelineState state = PipelineState.IDLE;
    private boolean workersRunning;
    private UUID activeRun;
    private String activeModelType;

    /**
     * Marks the background workers as scheduled or stopped. Outside a run this moves the
     * state between IDLE and RUNNING; during a run it only decides where the run returns to.
     */
    public void setWorkersRunning(boolean running) {
        lock.lock();
        try {
            workersRunning = running;
            if (activeRun == null) {
                state = running ? PipelineState.RUNNING : PipelineState.IDLE;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Admits a run if no other run owns the pipeline.
     *
     * @param initial {@link PipelineState#TRAINING} or {@link PipelineState#ROLLING_BACK}
     * @return {@code true} if admitted, {@code false} if another run is active
     */
    public boolean tryBegin(String modelType, UUID runId, PipelineState initial) {
        if (runId == null) {
            throw new NullPointerException("runId cannot be null");
        }
        if (initial != PipelineState.TRAINING && initial != PipelineState.ROLLING_BACK) {
            throw new IllegalArgumentException("A run cannot begin in state " + initial);
        }
        lock.lock();
        try {
            if (activeRun != null) {
                return false;
            }
            activeRun = runId;
            activeModelType = modelType;
            state = initial;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves the active run to {@code next}.
     *
     * @throws IllegalStateException if {@code runId} is not the active run or the transition is not allowed
     */
    public void advance(UUID runId, PipelineState next) {
        lock.lock();
        try {
            requireActive(runId);
            Set<PipelineState> allowed = ALLOWED.getOrDefault(state, Set.of());
            if (!allowed.contains(next)) {
                throw new IllegalStateException("Illegal pipeline transition " + state + " -> " + next);
            }
            state = next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves the active run to {@link PipelineState#FAILED}. A no-op for stale run ids.
     */
    public void fail(UUID runId) {
        lock.lock();
        try {
            if (runId.equals(activeRun)) {
                state = PipelineState.FAILED;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases the pipeline; the state returns to RUNNING when the workers are scheduled,
     * otherwise IDLE.
     *
     * @return {@code true} if {@code runId} was the active run
     */
    public boolean finish(UUID runId) {
        lock.lock();
        try {
            if (activeRun == null || !activeRun.equals(runId)) {
                return false;
            }
            activeRun = null;
            activeModelType = null;
            state = workersRunning ? PipelineState.RUNNING : PipelineState.IDLE;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public PipelineState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} while a run owns the pipeline
     */
    public boolean hasActiveRun() {
        lock.lock();
        try {
            return activeRun != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return model type of the active run, or {@code null}
     */
    public String activeModelType() {
        lock.lock();
        try {
            return activeModelType;
        } finally {
            lock.unlock();
        }
    }

    private void requireActive(UUID runId) {
        if (activeRun == null || !activeRun.equals(runId)) {
            throw new IllegalStateException("Run " + runId + " does not own the pipeline (active: " + activeRun + ")");
        }
    }
}
