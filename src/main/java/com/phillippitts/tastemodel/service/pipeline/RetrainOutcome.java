package com.phillippitts.tastemodel.service.pipeline;

import java.util.Locale;

/**
 * How a retrain run ended.
 */
public enum RetrainOutcome {
    /** Challenger stored and {@code latest} re-pointed to it. */
    PROMOTED,
    /** Challenger stored for audit; the incumbent stays latest. */
    RETAINED,
    /** Challenger won but health was critical, so {@code latest} was left unchanged. */
    BLOCKED,
    /** Too few rated samples to train; nothing stored. */
    DISCARDED,
    /** The trainer or registry threw; see {@code lastError}. */
    FAILED;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
