package com.beacon.observability;

/**
 * Raised by a {@link DependencyClient} when the dependency rejects or fails a liveness operation.
 */
public class DependencyUnreachableException extends Exception {

    public DependencyUnreachableException(String message) {
        super(message);
    }

    public DependencyUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
