package org.keel.exception;

import lombok.Getter;

import java.util.List;

/**
 * A change set drops data and the caller did not accept data loss.
 */
@Getter
public class DestructiveChangeException extends KeelException {

    private final List<String> reasons;

    public DestructiveChangeException(List<String> reasons) {
        super("Destructive changes detected: " + String.join("; ", reasons));
        this.reasons = List.copyOf(reasons);
    }
}
