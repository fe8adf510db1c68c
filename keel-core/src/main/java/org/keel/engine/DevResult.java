package org.keel.engine;

import org.keel.history.Migration;

import java.util.List;

/**
 * Outcome of a development run.
 *
 * @param applied migrations applied during the run, in order
 * @param created the migration written by this run, null when the database was already in sync
 * @param warnings non-fatal risks found in the created migration
 */
public record DevResult(List<Migration> applied, Migration created, List<String> warnings) {

    public DevResult {
        applied = List.copyOf(applied);
        warnings = List.copyOf(warnings);
    }

    public boolean isInSync() {
        return created == null;
    }
}
