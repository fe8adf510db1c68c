package org.keel.migration;

import java.util.List;

/**
 * Outcome of {@link DestructiveChangeAnalyzer}: steps that lose data, and risky steps that
 * may fail on existing rows.
 */
public record DestructiveChangeReport(List<String> destructive, List<String> warnings) {

    public DestructiveChangeReport {
        destructive = List.copyOf(destructive);
        warnings = List.copyOf(warnings);
    }

    public boolean isDestructive() {
        return !destructive.isEmpty();
    }
}
