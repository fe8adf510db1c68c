package org.keel.history;

public record MigrationStatus(String name, MigrationState state) {
}
