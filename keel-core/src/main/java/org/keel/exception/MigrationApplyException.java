package org.keel.exception;

import lombok.Getter;

/**
 * A statement failed while a migration was being applied. The ledger was not updated.
 */
@Getter
public class MigrationApplyException extends KeelException {

    private final String migrationName;
    private final String statement;

    public MigrationApplyException(String migrationName, String statement, Throwable cause) {
        super("Migration `" + migrationName + "` failed to apply: "
                + (cause != null ? cause.getMessage() : "unknown error")
                + "\n\nFailing statement:\n" + statement, cause);
        this.migrationName = migrationName;
        this.statement = statement;
    }
}
