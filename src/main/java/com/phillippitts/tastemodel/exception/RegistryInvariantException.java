package com.phillippitts.tastemodel.exception;

/**
 * Thrown when registry state violates its own invariants, such as a {@code latest} pointer
 * naming a version that is not stored. Unlike {@link NotFoundException} this is never an
 * expected condition.
 */
public class RegistryInvariantException extends TasteModelException {

    public RegistryInvariantException(String message) {
        super(message);
    }
}
