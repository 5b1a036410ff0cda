package com.phillippitts.tastemodel.exception;

/**
 * Raised when the serving probe does not answer within its timeout.
 * Non-fatal: the health monitor records the probe as a disconnected sample and continues.
 */
public class HealthProbeTimeoutException extends TasteModelException {

    private final long timeoutMs;

    public HealthProbeTimeoutException(long timeoutMs) {
        super("Serving probe timed out after " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
