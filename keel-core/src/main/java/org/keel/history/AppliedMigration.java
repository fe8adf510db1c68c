package org.keel.history;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A row of the migration ledger.
 */
@Value
@Builder
public class AppliedMigration {
    String id;
    String name;
    String checksum;
    Instant startedAt;
    Instant finishedAt;
    Instant rolledBackAt;
    String logs;
    int appliedStepsCount;

    public boolean isApplied() {
        return finishedAt != null && rolledBackAt == null;
    }

    /**
     * Started but neither finished nor rolled back.
     */
    public boolean isFailed() {
        return finishedAt == null && rolledBackAt == null;
    }
}
