package com.phillippitts.tastemodel.service.health;

/**
 * Liveness check of the serving dependency.
 *
 * <p>Implementations may block; the {@link HealthMonitor} runs them on the probe executor
 * under its own timeout.
 */
@FunctionalInterface
public interface ServingProbe {

    /**
     * @return true when the serving path answered successfully
     */
    boolean probe();
}
