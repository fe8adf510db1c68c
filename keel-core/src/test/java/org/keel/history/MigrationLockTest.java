package org.keel.history;

import org.keel.exception.SchemaValidationException;
import org.keel.migration.DatabaseType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationLockTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("The lock file is written on first use")
    void createsLock() throws IOException {
        Path root = tempDir.resolve("migrations");

        MigrationLock.ensure(root, DatabaseType.POSTGRESQL);

        assertEquals("# Written by keel. Do not edit by hand.\nprovider = \"postgresql\"\n",
                Files.readString(root.resolve("migration_lock.toml")));
        assertEquals("postgresql", MigrationLock.readProvider(root).orElseThrow());
    }

    @Test
    @DisplayName("A matching provider passes and a different one is rejected")
    void providerMismatch() {
        MigrationLock.ensure(tempDir, DatabaseType.SQLITE);
        MigrationLock.ensure(tempDir, DatabaseType.SQLITE);

        assertThatThrownBy(() -> MigrationLock.ensure(tempDir, DatabaseType.MYSQL))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageStartingWith("The datasource provider `mysql` does not match `sqlite`");
    }

    @Test
    @DisplayName("No lock file means no recorded provider")
    void absent() {
        assertTrue(MigrationLock.readProvider(tempDir).isEmpty());
    }
}
