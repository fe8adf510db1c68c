package org.keel.exception;

/**
 * Base exception for every failure reported by the migration engine.
 */
public class KeelException extends RuntimeException {

    public KeelException(String message) {
        super(message);
    }

    public KeelException(String message, Throwable cause) {
        super(message, cause);
    }
}
