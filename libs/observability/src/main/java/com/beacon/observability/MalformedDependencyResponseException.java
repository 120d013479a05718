package com.beacon.observability;

/**
 * Raised when a dependency answers with a reply of unexpected shape (missing row, wrong ping
 * reply, non-numeric counter). Probes treat it exactly like an unreachable dependency.
 */
public class MalformedDependencyResponseException extends RuntimeException {

    public MalformedDependencyResponseException(String message) {
        super(message);
    }

    public MalformedDependencyResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
