package com.phillippitts.tastemodel.domain;

/**
 * Lifecycle stages of the retrain coordinator.
 *
 * <pre>
 * IDLE → RUNNING → TRAINING → EVALUATING → {DEPLOYING | ROLLING_BACK} → RUNNING
 * any  → FAILED → (recorded) → RUNNING or IDLE
 * </pre>
 */
public enum PipelineState {
    IDLE,
    RUNNING,
    TRAINING,
    EVALUATING,
    DEPLOYING,
    ROLLING_BACK,
    FAILED;

    /** True while a retrain run owns the pipeline. */
    public boolean isBusy() {
        return this == TRAINING || this == EVALUATING || this == DEPLOYING || this == ROLLING_BACK;
    }
}
