package com.phillippitts.tastemodel.exception;

/**
 * Thrown when a trainer fails, times out, or produces unusable output.
 */
public class TrainingException extends TasteModelException {

    private final String modelType;

    public TrainingException(String message, String modelType) {
        super(message + " (model type: " + modelType + ")");
        this.modelType = modelType;
    }

    public TrainingException(String message, String modelType, Throwable cause) {
        super(message + " (model type: " + modelType + ")", cause);
        this.modelType = modelType;
    }

    public String getModelType() {
        return modelType;
    }
}
