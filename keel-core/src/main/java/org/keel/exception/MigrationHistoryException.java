package org.keel.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * The on-disk migration history could not be read or written.
 */
@Getter
public class MigrationHistoryException extends KeelException {

    private final Path path;

    public MigrationHistoryException(String message, Path path) {
        super(message + ": " + path);
        this.path = path;
    }

    public MigrationHistoryException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }
}
