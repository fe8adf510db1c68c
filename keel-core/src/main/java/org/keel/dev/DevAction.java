package org.keel.dev;

import org.keel.history.Migration;
import org.keel.model.ChangeSet;

import java.util.List;

/**
 * What a development run should do next.
 *
 * @param reason explanation for {@link Kind#RESET}, null otherwise
 * @param pending migrations to apply for {@link Kind#APPLY}
 * @param changes diff from the database to the declaration for {@link Kind#CREATE}, possibly empty
 * @param drift drift found while diagnosing, null when none was checked or found
 */
public record DevAction(Kind kind, String reason, List<Migration> pending, ChangeSet changes, DriftReport drift) {

    public enum Kind { APPLY, CREATE, RESET }

    public static DevAction apply(List<Migration> pending) {
        return new DevAction(Kind.APPLY, null, List.copyOf(pending), ChangeSet.empty(), null);
    }

    public static DevAction create(ChangeSet changes) {
        return new DevAction(Kind.CREATE, null, List.of(), changes, null);
    }

    public static DevAction reset(String reason) {
        return new DevAction(Kind.RESET, reason, List.of(), ChangeSet.empty(), null);
    }

    public static DevAction reset(String reason, DriftReport drift) {
        return new DevAction(Kind.RESET, reason, List.of(), ChangeSet.empty(), drift);
    }
}
