package org.keel.history;

import java.nio.file.Path;

/**
 * One migration directory on disk. Immutable once written.
 */
public record Migration(String name, Path directory, String sql, String checksum) {

    public static Migration of(String name, Path directory, String sql) {
        return new Migration(name, directory, sql, MigrationChecksum.compute(sql));
    }
}
