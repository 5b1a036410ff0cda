package com.phillippitts.tastemodel.service.pipeline;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of one finished retrain run.
 *
 * @param runId      run identifier, also logged as MDC {@code runId}
 * @param modelType  model type trained
 * @param outcome    how the run ended
 * @param version    challenger version when one was stored, otherwise {@code null}
 * @param incumbent  version that was latest when evaluation began, or {@code null}
 * @param detail     human-readable reason
 * @param startedAt  admission time
 * @param finishedAt completion time
 */
public record RetrainRun(
        UUID runId,
        String modelType,
        RetrainOutcome outcome,
        Integer version,
        Integer incumbent,
        String detail,
        Instant startedAt,
        Instant finishedAt
) {}
