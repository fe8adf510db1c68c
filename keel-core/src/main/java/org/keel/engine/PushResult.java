package org.keel.engine;

import org.keel.model.ChangeSet;

import java.util.List;

public record PushResult(ChangeSet changes, String sql, List<String> warnings) {

    public PushResult {
        warnings = List.copyOf(warnings);
    }

    public boolean isInSync() {
        return changes.isEmpty();
    }
}
