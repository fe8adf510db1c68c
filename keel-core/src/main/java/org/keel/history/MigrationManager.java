package org.keel.history;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.keel.exception.KeelException;
import org.keel.exception.MigrationApplyException;
import org.keel.exception.MigrationHistoryException;
import org.keel.migration.spi.dialect.DdlDialect;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Reconciles local migration directories with the ledger and applies pending migrations.
 */
@Slf4j
public class MigrationManager {
    @Getter
    private final MigrationDirectory directory;
    @Getter
    private final MigrationLedger ledger;
    private final Connection connection;
    private final DdlDialect dialect;

    public MigrationManager(MigrationDirectory directory, MigrationLedger ledger, Connection connection, DdlDialect dialect) {
        this.directory = directory;
        this.ledger = ledger;
        this.connection = connection;
        this.dialect = dialect;
    }

    public List<Migration> getLocalMigrations() {
        return directory.list();
    }

    /**
     * Ledger entries that finished and were not rolled back, oldest first.
     */
    public List<AppliedMigration> getAppliedMigrations() {
        return ledger.findAll().stream().filter(AppliedMigration::isApplied).toList();
    }

    public List<AppliedMigration> getFailedMigrations() {
        return ledger.findAll().stream().filter(AppliedMigration::isFailed).toList();
    }

    public List<Migration> getPendingMigrations() {
        Set<String> applied = appliedNames();
        return getLocalMigrations().stream().filter(m -> !applied.contains(m.name())).toList();
    }

    /**
     * Applied migrations whose directory no longer exists.
     */
    public List<String> getMissingMigrations() {
        Set<String> local = getLocalMigrations().stream().map(Migration::name).collect(Collectors.toSet());
        return getAppliedMigrations().stream()
                .map(AppliedMigration::getName)
                .filter(name -> !local.contains(name))
                .distinct()
                .toList();
    }

    /**
     * Applied migrations whose local script no longer matches the recorded checksum.
     */
    public List<String> getModifiedMigrations() {
        Map<String, String> localChecksums = new LinkedHashMap<>();
        getLocalMigrations().forEach(m -> localChecksums.put(m.name(), m.checksum()));
        return getAppliedMigrations().stream()
                .filter(a -> localChecksums.containsKey(a.getName()))
                .filter(a -> !localChecksums.get(a.getName()).equals(a.getChecksum()))
                .map(AppliedMigration::getName)
                .distinct()
                .toList();
    }

    /**
     * Every known migration name with its state, in name order.
     */
    public List<MigrationStatus> getStatus() {
        Map<String, MigrationState> states = new TreeMap<>();
        getLocalMigrations().forEach(m -> states.put(m.name(), MigrationState.LOCAL_ONLY));
        for (AppliedMigration a : getAppliedMigrations()) {
            states.put(a.getName(), states.containsKey(a.getName()) ? MigrationState.APPLIED : MigrationState.MISSING_LOCALLY);
        }
        List<MigrationStatus> result = new ArrayList<>();
        states.forEach((name, state) -> result.add(new MigrationStatus(name, state)));
        return result;
    }

    /**
     * Applies every pending migration in order, stopping at the first failure.
     */
    public List<Migration> applyPending() {
        List<Migration> applied = new ArrayList<>();
        for (Migration m : getPendingMigrations()) {
            applyMigration(m);
            applied.add(m);
        }
        return applied;
    }

    /**
     * Runs the migration's statements and records it in the ledger. On providers with
     * transactional DDL both happen in one transaction; elsewhere statements run one by one and
     * a failure can leave earlier ones applied. A failed migration is never recorded.
     */
    public void applyMigration(Migration migration) {
        ledger.ensureTable();
        List<String> statements = SqlStatementSplitter.split(migration.sql(), dialect.backslashEscapesInLiterals());
        log.debug("Applying migration {} ({} statements)", migration.name(), statements.size());
        if (dialect.supportsTransactionalDdl()) {
            applyInTransaction(migration, statements);
        } else {
            applySequentially(migration, statements);
        }
        log.info("Applied migration {}", migration.name());
    }

    private void applyInTransaction(Migration migration, List<String> statements) {
        boolean autoCommit = autoCommit();
        String current = null;
        try {
            connection.setAutoCommit(false);
            String id = ledger.recordStarted(migration.name(), migration.checksum());
            try (Statement st = connection.createStatement()) {
                for (String statement : statements) {
                    current = statement;
                    log.debug("Executing: {}", statement);
                    st.execute(statement);
                }
            }
            current = null;
            ledger.recordFinished(id, statements.size());
            connection.commit();
        } catch (SQLException e) {
            rollbackQuietly(e);
            throw new MigrationApplyException(migration.name(), current != null ? current : "(ledger update)", e);
        } catch (RuntimeException e) {
            rollbackQuietly(e);
            throw e;
        } finally {
            restoreAutoCommit(autoCommit);
        }
    }

    private void applySequentially(Migration migration, List<String> statements) {
        int steps = 0;
        try (Statement st = connection.createStatement()) {
            for (String statement : statements) {
                try {
                    log.debug("Executing: {}", statement);
                    st.execute(statement);
                    steps++;
                } catch (SQLException e) {
                    if (steps > 0) {
                        log.warn("Migration {} failed after {} of {} statements; those statements stay applied",
                                migration.name(), steps, statements.size());
                    }
                    throw new MigrationApplyException(migration.name(), statement, e);
                }
            }
            String id = ledger.recordStarted(migration.name(), migration.checksum());
            ledger.recordFinished(id, steps);
        } catch (SQLException e) {
            throw new MigrationApplyException(migration.name(), "(ledger update)", e);
        }
    }

    /**
     * Records a local migration as applied without running it.
     */
    public void markApplied(String migrationName) {
        Migration local = getLocalMigrations().stream()
                .filter(m -> m.name().equals(migrationName))
                .findFirst()
                .orElseThrow(() -> new MigrationHistoryException(
                        "Migration " + migrationName + " does not exist locally", directory.getRoot()));
        ledger.markApplied(local.name(), local.checksum());
    }

    public void markRolledBack(String migrationName) {
        if (!ledger.markRolledBack(migrationName)) {
            throw new KeelException("Migration " + migrationName + " is not recorded in the ledger");
        }
    }

    /**
     * Writes a new migration directory (and the lock file) without applying it.
     */
    public Migration createMigration(String description, String sql) {
        MigrationLock.ensure(directory.getRoot(), dialect.getDatabaseType());
        return directory.create(description, sql);
    }

    private Set<String> appliedNames() {
        return getAppliedMigrations().stream().map(AppliedMigration::getName).collect(Collectors.toSet());
    }

    private boolean autoCommit() {
        try {
            return connection.getAutoCommit();
        } catch (SQLException e) {
            throw new KeelException("Failed to read connection state: " + e.getMessage(), e);
        }
    }

    private void rollbackQuietly(Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private void restoreAutoCommit(boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("Failed to restore auto-commit", e);
        }
    }
}
