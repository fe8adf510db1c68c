package org.keel.exception;

/**
 * The ledger, local history and database disagree. The only remedy is a reset.
 */
public class DriftException extends KeelException {

    public DriftException(String reason) {
        super(reason);
    }
}
