package org.keel.dev;

import lombok.extern.slf4j.Slf4j;
import org.keel.exception.IncompleteDiffException;
import org.keel.history.AppliedMigration;
import org.keel.history.Migration;
import org.keel.history.MigrationManager;
import org.keel.introspect.SchemaIntrospector;
import org.keel.migration.differs.SchemaDiffer;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ChangeSet;
import org.keel.model.SchemaModel;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a development run applies pending migrations, creates a new one, or needs
 * a reset because history and database disagree. Checks run in a fixed order and the first
 * one that fires wins.
 */
@Slf4j
public class DevDiagnostic {
    private final MigrationManager manager;
    private final Connection connection;
    private final DdlDialect dialect;
    private final SchemaIntrospector introspector;
    private final SchemaDiffer differ;
    private final Optional<ShadowDatabase> shadow;

    public DevDiagnostic(MigrationManager manager, Connection connection, DdlDialect dialect,
                         SchemaIntrospector introspector, SchemaDiffer differ, Optional<ShadowDatabase> shadow) {
        this.manager = manager;
        this.connection = connection;
        this.dialect = dialect;
        this.introspector = introspector;
        this.differ = differ;
        this.shadow = shadow;
    }

    public DevAction diagnose(SchemaModel desired) {
        List<AppliedMigration> failed = manager.getFailedMigrations();
        if (!failed.isEmpty()) {
            return DevAction.reset("The following migration(s) failed to apply:\n  "
                    + failed.stream().map(AppliedMigration::getName).distinct().collect(Collectors.joining(", "))
                    + "\n\nThe database may be partially migrated and must be reset.");
        }

        List<String> missing = manager.getMissingMigrations();
        if (!missing.isEmpty()) {
            return DevAction.reset("The following migration(s) are applied to the database but missing from the"
                    + " local migrations directory:\n  " + String.join(", ", missing));
        }

        List<String> modified = manager.getModifiedMigrations();
        if (!modified.isEmpty()) {
            return DevAction.reset("The following migration(s) have been modified since they were applied:\n  "
                    + String.join(", ", modified)
                    + "\n\nMigrations that have been applied to the database should not be modified.");
        }

        SchemaModel actual = introspector.introspect(connection, dialect);

        Optional<SchemaModel> expected = expectedSchema();
        if (expected.isPresent()) {
            ChangeSet drift = differ.diff(expected.get(), actual);
            if (!drift.isComplete()) {
                throw new IncompleteDiffException(drift.getFailedDiffers(), drift.getWarnings());
            }
            if (!drift.isEmpty()) {
                DriftReport report = new DriftReport(drift);
                return DevAction.reset("Drift detected: the database schema is not in sync with the migration history.\n\n"
                        + "The following is a summary of the changes leading from the schema the migrations produce"
                        + " to the actual schema of the database.\n\n" + report.render(), report);
            }
        } else {
            log.debug("No shadow database available; drift check skipped");
        }

        List<Migration> pending = manager.getPendingMigrations();
        if (!pending.isEmpty()) {
            return DevAction.apply(pending);
        }
        return DevAction.create(differ.diff(actual, desired));
    }

    /**
     * The schema the applied migrations produce, if it can be computed.
     */
    private Optional<SchemaModel> expectedSchema() {
        List<AppliedMigration> applied = manager.getAppliedMigrations();
        if (applied.isEmpty()) {
            return Optional.of(SchemaModel.empty());
        }
        if (shadow.isEmpty()) {
            return Optional.empty();
        }
        Set<String> appliedNames = applied.stream().map(AppliedMigration::getName).collect(Collectors.toSet());
        List<Migration> replay = manager.getLocalMigrations().stream()
                .filter(m -> appliedNames.contains(m.name()))
                .toList();
        return Optional.of(shadow.get().replay(replay));
    }
}
