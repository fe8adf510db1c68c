package org.keel.history;

import lombok.extern.slf4j.Slf4j;
import org.keel.exception.MigrationHistoryException;
import org.keel.exception.SchemaValidationException;
import org.keel.migration.DatabaseType;
import org.keel.options.KeelOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code migration_lock.toml}: pins a migrations directory to one provider.
 */
@Slf4j
public final class MigrationLock {
    public static final String FILE_NAME = KeelOptions.Migrations.LOCK_FILE;

    private static final Pattern PROVIDER = Pattern.compile("(?m)^\\s*provider\\s*=\\s*\"([^\"]*)\"");

    private MigrationLock() {
    }

    public static Optional<String> readProvider(Path root) {
        Path file = root.resolve(FILE_NAME);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            Matcher m = PROVIDER.matcher(Files.readString(file, StandardCharsets.UTF_8));
            return m.find() ? Optional.of(m.group(1)) : Optional.empty();
        } catch (IOException e) {
            throw new MigrationHistoryException("Failed to read migration lock file", file, e);
        }
    }

    /**
     * Writes the lock file if absent, otherwise checks that it names {@code type}.
     */
    public static void ensure(Path root, DatabaseType type) {
        Optional<String> locked = readProvider(root);
        if (locked.isPresent()) {
            if (!locked.get().equalsIgnoreCase(type.getProviderName())) {
                throw new SchemaValidationException("The datasource provider `" + type.getProviderName()
                        + "` does not match `" + locked.get() + "` recorded in " + root.resolve(FILE_NAME)
                        + ". Start a new migrations directory for a different provider.");
            }
            return;
        }
        Path file = root.resolve(FILE_NAME);
        try {
            Files.createDirectories(root);
            Files.writeString(file, "# Written by keel. Do not edit by hand.\n"
                    + "provider = \"" + type.getProviderName() + "\"\n", StandardCharsets.UTF_8);
            log.debug("Created {}", file);
        } catch (IOException e) {
            throw new MigrationHistoryException("Failed to write migration lock file", file, e);
        }
    }
}
