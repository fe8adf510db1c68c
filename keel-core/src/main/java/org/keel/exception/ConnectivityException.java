package org.keel.exception;

/**
 * The database could not be reached. Never retried by the engine.
 */
public class ConnectivityException extends KeelException {

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
