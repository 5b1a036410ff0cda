package com.phillippitts.tastemodel.exception;

/**
 * Thrown when a requested track or model version does not exist.
 */
public class NotFoundException extends TasteModelException {

    private final String resource;
    private final String identifier;

    public NotFoundException(String resource, String identifier) {
        super(resource + " not found: " + identifier);
        this.resource = resource;
        this.identifier = identifier;
    }

    public static NotFoundException track(String trackId) {
        return new NotFoundException("Track", trackId);
    }

    public static NotFoundException modelVersion(String modelType, int version) {
        return new NotFoundException("Model version", modelType + " v" + version);
    }

    public static NotFoundException modelType(String modelType) {
        return new NotFoundException("Model type", modelType);
    }

    public String getResource() {
        return resource;
    }

    public String getIdentifier() {
        return identifier;
    }
}
