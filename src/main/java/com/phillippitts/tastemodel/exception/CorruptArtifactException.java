package com.phillippitts.tastemodel.exception;

/**
 * Thrown when a stored model artifact no longer matches its recorded SHA-256 hash.
 * Loading never returns the bytes of a corrupted artifact.
 */
public class CorruptArtifactException extends TasteModelException {

    private final String modelType;
    private final int version;

    public CorruptArtifactException(String modelType, int version, String expectedHash, String actualHash) {
        super("Artifact hash mismatch for " + modelType + " v" + version
                + " (expected " + expectedHash + ", got " + actualHash + ")");
        this.modelType = modelType;
        this.version = version;
    }

    public CorruptArtifactException(String modelType, int version, String message) {
        super("Artifact for " + modelType + " v" + version + " is unreadable: " + message);
        this.modelType = modelType;
        this.version = version;
    }

    public String getModelType() {
        return modelType;
    }

    public int getVersion() {
        return version;
    }
}
