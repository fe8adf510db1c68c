package org.keel.history;

public enum MigrationState {
    /** On disk, not yet applied. */
    LOCAL_ONLY,
    APPLIED,
    /** Recorded in the ledger, but the directory is gone. */
    MISSING_LOCALLY
}
