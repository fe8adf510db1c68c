package org.keel.history;

import lombok.extern.slf4j.Slf4j;
import org.keel.exception.KeelException;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ColumnModel;
import org.keel.model.TableModel;
import org.keel.options.KeelOptions;
import org.keel.parser.ast.ScalarType;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The {@code _keel_migrations} table. Every read goes to the database; nothing is cached.
 */
@Slf4j
public class MigrationLedger {
    public static final String TABLE_NAME = KeelOptions.Migrations.LEDGER_TABLE;

    private final Connection connection;
    private final DdlDialect dialect;
    private final Clock clock;

    public MigrationLedger(Connection connection, DdlDialect dialect) {
        this(connection, dialect, Clock.systemUTC());
    }

    public MigrationLedger(Connection connection, DdlDialect dialect, Clock clock) {
        this.connection = connection;
        this.dialect = dialect;
        this.clock = clock;
    }

    /**
     * Ledger table definition in the provider's own types.
     */
    TableModel tableModel() {
        String timestamp = dialect.getTypeMapper().map(ScalarType.DATETIME, false);
        return TableModel.builder().tableName(TABLE_NAME).primaryKey(new ArrayList<>(List.of("id"))).build()
                .addColumn(column("id", "VARCHAR(36)", false))
                .addColumn(column("checksum", "VARCHAR(64)", false))
                .addColumn(column("finished_at", timestamp, true))
                .addColumn(column("migration_name", "VARCHAR(255)", false))
                .addColumn(column("logs", "TEXT", true))
                .addColumn(column("rolled_back_at", timestamp, true))
                .addColumn(column("started_at", timestamp, false))
                .addColumn(ColumnModel.builder()
                        .columnName("applied_steps_count")
                        .sqlType(dialect.getTypeMapper().map(ScalarType.INT, false))
                        .isNullable(false)
                        .defaultValue("0")
                        .build());
    }

    private static ColumnModel column(String name, String type, boolean nullable) {
        return ColumnModel.builder().columnName(name).sqlType(type).isNullable(nullable).build();
    }

    public boolean exists() throws SQLException {
        return dialect.introspectionQueries().listTables(connection).stream()
                .anyMatch(t -> t.equalsIgnoreCase(TABLE_NAME));
    }

    public void ensureTable() {
        try {
            if (exists()) {
                return;
            }
            try (Statement st = connection.createStatement()) {
                for (String statement : SqlStatementSplitter.split(dialect.getCreateTableSql(tableModel(), false))) {
                    st.execute(statement);
                }
            }
            commitIfManual();
            log.debug("Created ledger table {}", TABLE_NAME);
        } catch (SQLException e) {
            throw new KeelException("Failed to create migration ledger " + TABLE_NAME + ": " + e.getMessage(), e);
        }
    }

    /**
     * Every ledger row, oldest first.
     */
    public List<AppliedMigration> findAll() {
        ensureTable();
        String sql = "SELECT id, checksum, migration_name, started_at, finished_at, rolled_back_at, logs, applied_steps_count"
                + " FROM " + table() + " ORDER BY started_at, migration_name";
        List<AppliedMigration> rows = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                rows.add(AppliedMigration.builder()
                        .id(rs.getString("id"))
                        .checksum(rs.getString("checksum"))
                        .name(rs.getString("migration_name"))
                        .startedAt(instant(rs.getTimestamp("started_at")))
                        .finishedAt(instant(rs.getTimestamp("finished_at")))
                        .rolledBackAt(instant(rs.getTimestamp("rolled_back_at")))
                        .logs(rs.getString("logs"))
                        .appliedStepsCount(rs.getInt("applied_steps_count"))
                        .build());
            }
        } catch (SQLException e) {
            throw new KeelException("Failed to read migration ledger: " + e.getMessage(), e);
        }
        return rows;
    }

    public Optional<AppliedMigration> find(String migrationName) {
        return findAll().stream().filter(m -> m.getName().equals(migrationName)).reduce((a, b) -> b);
    }

    /**
     * Inserts a started, unfinished row and returns its id.
     */
    public String recordStarted(String migrationName, String checksum) throws SQLException {
        String id = UUID.randomUUID().toString();
        String sql = "INSERT INTO " + table()
                + " (id, checksum, migration_name, started_at, applied_steps_count) VALUES (?, ?, ?, ?, 0)";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, id);
            ps.setString(2, checksum);
            ps.setString(3, migrationName);
            ps.setTimestamp(4, now());
            ps.executeUpdate();
        }
        return id;
    }

    public void recordFinished(String id, int appliedSteps) throws SQLException {
        String sql = "UPDATE " + table() + " SET finished_at = ?, applied_steps_count = ? WHERE id = ?";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setTimestamp(1, now());
            ps.setInt(2, appliedSteps);
            ps.setString(3, id);
            ps.executeUpdate();
        }
    }

    /**
     * Marks {@code migrationName} applied without running it: the latest row is finished and
     * un-rolled-back, or a new finished row is inserted.
     */
    public void markApplied(String migrationName, String checksum) {
        ensureTable();
        Optional<AppliedMigration> existing = find(migrationName);
        try {
            if (existing.isPresent()) {
                String sql = "UPDATE " + table() + " SET finished_at = ?, rolled_back_at = NULL, checksum = ? WHERE id = ?";
                try (PreparedStatement ps = connection.prepareStatement(sql)) {
                    ps.setTimestamp(1, now());
                    ps.setString(2, checksum);
                    ps.setString(3, existing.get().getId());
                    ps.executeUpdate();
                }
            } else {
                String id = recordStarted(migrationName, checksum);
                recordFinished(id, 0);
            }
            commitIfManual();
        } catch (SQLException e) {
            throw new KeelException("Failed to mark migration " + migrationName + " as applied: " + e.getMessage(), e);
        }
    }

    /**
     * @return false when the ledger has no row for {@code migrationName}
     */
    public boolean markRolledBack(String migrationName) {
        ensureTable();
        String sql = "UPDATE " + table() + " SET rolled_back_at = ?, finished_at = NULL WHERE migration_name = ?";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setTimestamp(1, now());
            ps.setString(2, migrationName);
            int updated = ps.executeUpdate();
            commitIfManual();
            return updated > 0;
        } catch (SQLException e) {
            throw new KeelException("Failed to mark migration " + migrationName + " as rolled back: " + e.getMessage(), e);
        }
    }

    private String table() {
        return dialect.quoteIdentifier(TABLE_NAME);
    }

    private Timestamp now() {
        return Timestamp.from(clock.instant());
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private void commitIfManual() throws SQLException {
        if (!connection.getAutoCommit()) {
            connection.commit();
        }
    }
}
