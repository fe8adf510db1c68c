package org.keel.history;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.keel.exception.MigrationHistoryException;
import org.keel.options.KeelOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * The migrations root: one {@code <timestamp>_<name>/migration.sql} per migration.
 */
@Slf4j
public class MigrationDirectory {
    public static final String SQL_FILE = KeelOptions.Migrations.SQL_FILE;

    @Getter
    private final Path root;
    private final Clock clock;

    public MigrationDirectory(Path root) {
        this(root, Clock.systemUTC());
    }

    public MigrationDirectory(Path root, Clock clock) {
        this.root = root;
        this.clock = clock;
    }

    /**
     * Local migrations in timestamp order. A missing root is an empty history.
     */
    public List<Migration> list() {
        if (!Files.exists(root)) {
            return List.of();
        }
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            throw new MigrationHistoryException("Migrations directory is not readable", root);
        }

        List<Path> dirs = new ArrayList<>();
        try (Stream<Path> entries = Files.list(root)) {
            entries.forEach(p -> {
                String name = p.getFileName().toString();
                if (Files.isDirectory(p) && MigrationNames.isMigrationDirectory(name)) {
                    dirs.add(p);
                } else if (Files.isDirectory(p)) {
                    log.warn("Skipping {}: not a migration directory name", p);
                }
            });
        } catch (IOException e) {
            throw new MigrationHistoryException("Failed to list migrations directory", root, e);
        }
        dirs.sort(Comparator.comparing(p -> p.getFileName().toString()));

        List<Migration> migrations = new ArrayList<>();
        for (Path dir : dirs) {
            Path sqlFile = dir.resolve(SQL_FILE);
            if (!Files.isRegularFile(sqlFile)) {
                throw new MigrationHistoryException("Migration has no " + SQL_FILE, dir);
            }
            try {
                migrations.add(Migration.of(dir.getFileName().toString(), dir,
                        Files.readString(sqlFile, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                throw new MigrationHistoryException("Failed to read migration", sqlFile, e);
            }
        }
        return migrations;
    }

    /**
     * Writes a new migration directory named from the current UTC time and {@code description}.
     * The timestamp is moved past the newest local migration so names keep their order.
     */
    public Migration create(String description, String sql) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        List<Migration> existing = list();
        if (!existing.isEmpty()) {
            Instant latest = MigrationNames.timestampOf(existing.get(existing.size() - 1).name());
            if (!now.isAfter(latest)) {
                now = latest.plusSeconds(1);
            }
        }
        String name = MigrationNames.generate(description, now);
        Path dir = root.resolve(name);
        if (Files.exists(dir)) {
            throw new MigrationHistoryException("Migration directory already exists", dir);
        }
        Path sqlFile = dir.resolve(SQL_FILE);
        try {
            Files.createDirectories(dir);
            Files.writeString(sqlFile, sql.endsWith("\n") ? sql : sql + "\n", StandardCharsets.UTF_8);
            log.debug("Wrote migration {}", sqlFile);
            return Migration.of(name, dir, Files.readString(sqlFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new MigrationHistoryException("Failed to write migration", sqlFile, e);
        }
    }
}
