package com.eventstorming.core.persistence;

/**
 * Thrown when the workshop store cannot be read or written.
 */
public class WorkshopStorageException extends RuntimeException {
    public WorkshopStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
