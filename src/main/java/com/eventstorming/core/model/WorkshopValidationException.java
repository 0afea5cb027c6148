package com.eventstorming.core.model;

/**
 * Thrown when a request or an imported payload is malformed. Raised before any
 * state is changed, so the workshop is left untouched.
 */
public class WorkshopValidationException extends RuntimeException {
    public WorkshopValidationException(String message) {
        super(message);
    }

    public WorkshopValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
