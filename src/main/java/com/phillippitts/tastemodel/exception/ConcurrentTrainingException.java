package com.phillippitts.tastemodel.exception;

/**
 * Thrown when a retrain is requested while another run already holds the pipeline.
 */
public class ConcurrentTrainingException extends TasteModelException {

    private final String modelType;
    private final String activeModelType;

    public ConcurrentTrainingException(String modelType, String activeModelType) {
        super("Retrain already in progress (requested: " + modelType + ", active: " + activeModelType + ")");
        this.modelType = modelType;
        this.activeModelType = activeModelType;
    }

    public String getModelType() {
        return modelType;
    }

    public String getActiveModelType() {
        return activeModelType;
    }
}
