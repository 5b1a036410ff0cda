package com.phillippitts.tastemodel.exception;

/**
 * Thrown when the registry cannot read or write its storage.
 */
public class RegistryStorageException extends TasteModelException {

    private final String modelType;

    public RegistryStorageException(String modelType, String message, Throwable cause) {
        super(message + " (model type: " + modelType + ")", cause);
        this.modelType = modelType;
    }

    public String getModelType() {
        return modelType;
    }
}
