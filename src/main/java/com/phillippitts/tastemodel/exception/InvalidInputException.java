package com.phillippitts.tastemodel.exception;

/**
 * Thrown when a caller supplies a value outside its accepted range
 * (rating, neighbour count, model type, threshold).
 */
public class InvalidInputException extends TasteModelException {

    private final String field;

    public InvalidInputException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
