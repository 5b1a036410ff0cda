package com.phillippitts.tastemodel.service.pipeline;

/**
 * Answer to a retrain trigger.
 */
public enum TriggerResult {
    /** A run was admitted and submitted to the training executor. */
    STARTED,
    /** Another run holds the pipeline; the trigger was logged and dropped, not queued. */
    COALESCED,
    /** Not forced and the retrain condition does not hold. */
    NOT_DUE
}
