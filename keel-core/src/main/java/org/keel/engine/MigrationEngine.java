package org.keel.engine;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.keel.dev.DevAction;
import org.keel.dev.DevDiagnostic;
import org.keel.dev.SchemaCleaner;
import org.keel.dev.ShadowDatabase;
import org.keel.exception.DriftException;
import org.keel.exception.IncompleteDiffException;
import org.keel.exception.KeelException;
import org.keel.exception.MigrationApplyException;
import org.keel.history.AppliedMigration;
import org.keel.history.Migration;
import org.keel.history.MigrationDirectory;
import org.keel.history.MigrationLedger;
import org.keel.history.MigrationLock;
import org.keel.history.MigrationManager;
import org.keel.history.MigrationStatus;
import org.keel.history.SqlStatementSplitter;
import org.keel.introspect.ConnectionFactory;
import org.keel.introspect.SchemaIntrospector;
import org.keel.mapping.SchemaModelMapper;
import org.keel.migration.DatabaseType;
import org.keel.migration.DestructiveChangeAnalyzer;
import org.keel.migration.DestructiveChangeReport;
import org.keel.migration.Dialects;
import org.keel.migration.MigrationGenerator;
import org.keel.migration.differs.SchemaDiffer;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ChangeSet;
import org.keel.model.SchemaModel;
import org.keel.options.EngineOptions;
import org.keel.parser.ast.Schema;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point for the migration workflows. Every call opens one connection and closes it
 * before returning. All settings come from the {@link EngineOptions} given at construction.
 */
@Slf4j
public class MigrationEngine {
    @Getter
    private final DdlDialect dialect;
    private final String url;
    private final MigrationDirectory directory;
    private final EngineOptions options;
    private final ConnectionFactory connections;

    private final SchemaIntrospector introspector = new SchemaIntrospector();
    private final SchemaModelMapper mapper;
    private final SchemaDiffer differ;
    private final MigrationGenerator generator;
    private final DestructiveChangeAnalyzer analyzer;

    public MigrationEngine(DdlDialect dialect, String url, Path migrationsDirectory, EngineOptions options) {
        this(dialect, url, new MigrationDirectory(migrationsDirectory), options, new ConnectionFactory());
    }

    public MigrationEngine(DdlDialect dialect, String url, MigrationDirectory directory, EngineOptions options,
                       ConnectionFactory connections) {
        this(dialect, url, directory, options, connections, new SchemaDiffer(dialect, options));
    }

    public MigrationEngine(DdlDialect dialect, String url, MigrationDirectory directory, EngineOptions options,
                           ConnectionFactory connections, SchemaDiffer differ) {
        this.dialect = dialect;
        this.url = url;
        this.directory = directory;
        this.options = options;
        this.connections = connections;
        this.mapper = new SchemaModelMapper(dialect);
        this.differ = differ;
        this.generator = new MigrationGenerator(dialect);
        this.analyzer = new DestructiveChangeAnalyzer(dialect);
    }

    /**
     * Engine for the provider the declaration names, or the one the URL implies.
     */
    public static MigrationEngine forSchema(Schema schema, String url, Path migrationsDirectory, EngineOptions options) {
        DatabaseType type = DatabaseType.resolve(schema.datasourceProvider(), url);
        return new MigrationEngine(Dialects.forType(type), url, migrationsDirectory, options);
    }

    /**
     * Applies pending migrations, then creates (and unless {@code createOnly}, applies) a
     * migration for whatever the declaration still differs by.
     *
     * @throws DriftException when history and database disagree; only a reset resolves it
     */
    public DevResult dev(Schema schema) {
        SchemaModel desired = mapper.map(schema);
        checkLock();
        return withConnection(connection -> {
            MigrationManager manager = manager(connection);
            DevDiagnostic diagnostic = diagnostic(connection, manager);

            List<Migration> applied = new ArrayList<>();
            DevAction action = diagnostic.diagnose(desired);
            if (action.kind() == DevAction.Kind.APPLY) {
                applied.addAll(manager.applyPending());
                action = diagnostic.diagnose(desired);
            }

            switch (action.kind()) {
                case RESET -> throw new DriftException(action.reason());
                case APPLY -> throw new IllegalStateException("Migrations still pending after apply: " + action.pending());
                default -> {
                }
            }

            ChangeSet changes = requireComplete(action.changes());
            if (changes.isEmpty()) {
                log.debug("Database is in sync with the declaration");
                return new DevResult(applied, null, changes.getWarnings());
            }

            DestructiveChangeReport report = analyzer.check(changes, options.isAcceptDataLoss());
            String name = options.getMigrationName();
            if (name == null || name.isBlank()) {
                throw new KeelException("A migration name is required to create a migration");
            }
            Migration created = manager.createMigration(name, generator.generateSql(changes));
            if (!options.isCreateOnly()) {
                manager.applyMigration(created);
                applied.add(created);
            }

            List<String> warnings = new ArrayList<>(changes.getWarnings());
            warnings.addAll(report.destructive());
            warnings.addAll(report.warnings());
            return new DevResult(applied, created, warnings);
        });
    }

    /**
     * Applies every pending migration. Never creates one.
     */
    public List<Migration> deploy() {
        checkLock();
        return withConnection(connection -> {
            MigrationManager manager = manager(connection);
            List<AppliedMigration> failed = manager.getFailedMigrations();
            if (!failed.isEmpty()) {
                throw new DriftException("Found failed migration(s) in the target database: "
                        + failed.stream().map(AppliedMigration::getName).distinct().collect(Collectors.joining(", "))
                        + ". Resolve them before deploying new migrations.");
            }
            return manager.applyPending();
        });
    }

    /**
     * Drops every table, the ledger included, and reapplies all local migrations.
     */
    public List<Migration> reset() {
        checkLock();
        return withConnection(connection -> {
            new SchemaCleaner(dialect, introspector).dropAll(connection);
            return manager(connection).applyPending();
        });
    }

    public List<MigrationStatus> status() {
        return withConnection(connection -> manager(connection).getStatus());
    }

    public List<Migration> pending() {
        return withConnection(connection -> manager(connection).getPendingMigrations());
    }

    public void resolveApplied(String migrationName) {
        withConnection(connection -> {
            manager(connection).markApplied(migrationName);
            return null;
        });
    }

    public void resolveRolledBack(String migrationName) {
        withConnection(connection -> {
            manager(connection).markRolledBack(migrationName);
            return null;
        });
    }

    /**
     * Changes leading from declaration {@code from} to declaration {@code to}. No database
     * is involved.
     */
    public ChangeSet diff(Schema from, Schema to) {
        return differ.diff(mapper.map(from), mapper.map(to));
    }

    public ChangeSet diff(SchemaModel from, SchemaModel to) {
        return differ.diff(from, to);
    }

    /**
     * Changes leading from the live database to the declaration.
     */
    public ChangeSet diffDatabase(Schema schema) {
        SchemaModel desired = mapper.map(schema);
        return withConnection(connection -> differ.diff(introspector.introspect(connection, dialect), desired));
    }

    public SchemaModel introspect() {
        return withConnection(connection -> introspector.introspect(connection, dialect));
    }

    public String generateSql(ChangeSet changes) {
        return generator.generateSql(changes);
    }

    /**
     * Brings the database in line with the declaration without writing a migration.
     */
    public PushResult push(Schema schema) {
        SchemaModel desired = mapper.map(schema);
        return withConnection(connection -> {
            ChangeSet changes = requireComplete(differ.diff(introspector.introspect(connection, dialect), desired));
            if (changes.isEmpty()) {
                return new PushResult(changes, "", changes.getWarnings());
            }
            DestructiveChangeReport report = analyzer.check(changes, options.isAcceptDataLoss());
            String sql = generator.generateSql(changes);
            executeScript(connection, sql);

            List<String> warnings = new ArrayList<>(changes.getWarnings());
            warnings.addAll(report.destructive());
            warnings.addAll(report.warnings());
            return new PushResult(changes, sql, warnings);
        });
    }

    private static ChangeSet requireComplete(ChangeSet changes) {
        if (!changes.isComplete()) {
            throw new IncompleteDiffException(changes.getFailedDiffers(), changes.getWarnings());
        }
        return changes;
    }

    private void executeScript(Connection connection, String sql) throws SQLException {
        boolean transactional = dialect.supportsTransactionalDdl();
        boolean autoCommit = connection.getAutoCommit();
        String current = null;
        try (Statement st = connection.createStatement()) {
            if (transactional) {
                connection.setAutoCommit(false);
            }
            for (String statement : SqlStatementSplitter.split(sql, dialect.backslashEscapesInLiterals())) {
                current = statement;
                log.debug("Executing: {}", statement);
                st.execute(statement);
            }
            if (transactional) {
                connection.commit();
            }
        } catch (SQLException e) {
            if (transactional) {
                connection.rollback();
            }
            throw new MigrationApplyException("(db push)", current, e);
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private <T> T withConnection(ConnectionCallback<T> callback) {
        try (Connection connection = connections.open(url)) {
            return callback.doInConnection(connection);
        } catch (SQLException e) {
            throw new KeelException("Database error: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface ConnectionCallback<T> {
        T doInConnection(Connection connection) throws SQLException;
    }

    private MigrationManager manager(Connection connection) {
        return new MigrationManager(directory, new MigrationLedger(connection, dialect), connection, dialect);
    }

    private DevDiagnostic diagnostic(Connection connection, MigrationManager manager) {
        Optional<String> shadowUrl = Optional.ofNullable(options.getShadowDatabaseUrl())
                .or(dialect::defaultShadowDatabaseUrl);
        Optional<ShadowDatabase> shadow = shadowUrl
                .map(u -> new ShadowDatabase(u, dialect, connections, introspector));
        return new DevDiagnostic(manager, connection, dialect, introspector, differ, shadow);
    }

    /**
     * An existing lock file must name this provider.
     */
    private void checkLock() {
        Path root = directory.getRoot();
        if (MigrationLock.readProvider(root).isPresent()) {
            MigrationLock.ensure(root, dialect.getDatabaseType());
        }
    }
}
