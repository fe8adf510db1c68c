package org.keel.exception;

import lombok.Getter;

import java.util.List;

/**
 * Catalog read failed entirely or for some tables. A partial read is never returned.
 */
@Getter
public class IntrospectionException extends KeelException {

    private final List<String> failedTables;

    public IntrospectionException(String message, Throwable cause) {
        super(message, cause);
        this.failedTables = List.of();
    }

    public IntrospectionException(List<String> failedTables, Throwable cause) {
        super("Introspection failed for table(s) " + failedTables
                + "; refusing to diff against a partial schema", cause);
        this.failedTables = List.copyOf(failedTables);
    }
}
