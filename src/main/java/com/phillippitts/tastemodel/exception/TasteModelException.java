package com.phillippitts.tastemodel.exception;

/**
 * Base exception for all taste model application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class TasteModelException extends RuntimeException {

    public TasteModelException(String message) {
        super(message);
    }

    public TasteModelException(String message, Throwable cause) {
        super(message, cause);
    }

    public TasteModelException(Throwable cause) {
        super(cause);
    }
}
