package com.phillippitts.tastemodel.exception;

import com.phillippitts.tastemodel.domain.HealthStatus;

/**
 * Signals that a winning challenger was not promoted because the serving path is unhealthy.
 */
public class DeploymentBlockedException extends TasteModelException {

    private final String modelType;
    private final int version;
    private final HealthStatus healthStatus;

    public DeploymentBlockedException(String modelType, int version, HealthStatus healthStatus) {
        super("Promotion of " + modelType + " v" + version + " blocked: health is " + healthStatus);
        this.modelType = modelType;
        this.version = version;
        this.healthStatus = healthStatus;
    }

    public String getModelType() {
        return modelType;
    }

    public int getVersion() {
        return version;
    }

    public HealthStatus getHealthStatus() {
        return healthStatus;
    }
}
