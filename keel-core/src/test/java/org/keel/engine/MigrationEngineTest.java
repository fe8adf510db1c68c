package org.keel.engine;

import org.keel.exception.DestructiveChangeException;
import org.keel.exception.DriftException;
import org.keel.exception.IncompleteDiffException;
import org.keel.exception.KeelException;
import org.keel.history.Migration;
import org.keel.history.MigrationDirectory;
import org.keel.history.MigrationState;
import org.keel.history.MigrationStatus;
import org.keel.introspect.ConnectionFactory;
import org.keel.migration.dialect.sqlite.SqliteDialect;
import org.keel.migration.differs.Differ;
import org.keel.migration.differs.SchemaDiffer;
import org.keel.model.ChangeSet;
import org.keel.model.SchemaModel;
import org.keel.options.EngineOptions;
import org.keel.parser.SchemaParser;
import org.keel.parser.ast.Schema;
import org.keel.testing.Declarations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationEngineTest {

    @TempDir
    Path tempDir;

    private String url;
    private Path migrations;

    private static final Schema BLOG = SchemaParser.parseOrThrow(Declarations.blog("sqlite"));
    private static final Schema BLOG_PUBLISHED = SchemaParser.parseOrThrow(Declarations.blogWithPublished("sqlite"));

    @BeforeEach
    void setUp() {
        url = "jdbc:sqlite:" + tempDir.resolve("dev.db");
        migrations = tempDir.resolve("migrations");
    }

    private MigrationEngine engine(EngineOptions options) {
        return MigrationEngine.forSchema(BLOG, url, migrations, options);
    }

    private MigrationEngine engine(String migrationName) {
        return engine(EngineOptions.builder().migrationName(migrationName).build());
    }

    private void execute(String sql) throws SQLException {
        try (Connection c = DriverManager.getConnection(url); Statement st = c.createStatement()) {
            st.execute(sql);
        }
    }

    @Test
    @DisplayName("The provider is taken from the declaration")
    void forSchemaPicksDialect() {
        assertThat(engine(EngineOptions.defaults()).getDialect()).isInstanceOf(SqliteDialect.class);
    }

    @Nested
    @DisplayName("dev")
    class Dev {

        @Test
        @DisplayName("The first run creates and applies the initial migration")
        void createsInitialMigration() throws IOException {
            DevResult result = engine("init").dev(BLOG);

            assertFalse(result.isInSync());
            Migration created = result.created();
            assertThat(created.name()).endsWith("_init");
            assertThat(result.applied()).containsExactly(created);
            assertThat(Files.readString(created.directory().resolve("migration.sql"))).contains("CREATE TABLE \"User\"");
            assertTrue(Files.exists(migrations.resolve("migration_lock.toml")));
        }

        @Test
        @DisplayName("A second run against an unchanged declaration is in sync")
        void secondRunInSync() {
            engine("init").dev(BLOG);

            DevResult result = engine("again").dev(BLOG);

            assertTrue(result.isInSync());
            assertThat(result.applied()).isEmpty();
            assertThat(new MigrationDirectoryView(migrations).names()).hasSize(1);
        }

        @Test
        @DisplayName("A changed declaration produces a follow-up migration")
        void followUpMigration() throws IOException {
            engine("init").dev(BLOG);

            DevResult result = engine("add published").dev(BLOG_PUBLISHED);

            assertThat(result.created().name()).endsWith("_add_published");
            assertThat(Files.readString(result.created().directory().resolve("migration.sql")))
                    .contains("ALTER TABLE \"Post\" ADD COLUMN \"published\" BOOLEAN NOT NULL DEFAULT false;");
            assertTrue(engine("noop").dev(BLOG_PUBLISHED).isInSync());
        }

        @Test
        @DisplayName("With createOnly the migration is written but not applied")
        void createOnly() {
            DevResult result = engine(EngineOptions.builder().migrationName("init").createOnly(true).build()).dev(BLOG);

            assertNotNull(result.created());
            assertThat(result.applied()).isEmpty();
            assertThat(engine(EngineOptions.defaults()).pending()).extracting(Migration::name)
                    .containsExactly(result.created().name());
        }

        @Test
        @DisplayName("Pending migrations are applied before diffing")
        void appliesPendingFirst() {
            engine(EngineOptions.builder().migrationName("init").createOnly(true).build()).dev(BLOG);

            DevResult result = engine("next").dev(BLOG);

            assertTrue(result.isInSync());
            assertThat(result.applied()).hasSize(1);
        }

        @Test
        @DisplayName("A change without a migration name is refused")
        void nameRequired() {
            assertThatThrownBy(() -> engine(EngineOptions.defaults()).dev(BLOG))
                    .isInstanceOf(KeelException.class)
                    .hasMessageContaining("migration name is required");
        }

        @Test
        @DisplayName("Manual changes to the database fail the run with drift")
        void drift() throws SQLException {
            engine("init").dev(BLOG);
            execute("CREATE TABLE \"Audit\" (\"id\" INTEGER NOT NULL PRIMARY KEY)");

            assertThatThrownBy(() -> engine("next").dev(BLOG))
                    .isInstanceOf(DriftException.class)
                    .hasMessageContaining("Drift detected")
                    .hasMessageContaining("Audit");
        }

        @Test
        @DisplayName("Dropping a model requires accepting data loss")
        void destructiveChange() {
            engine("init").dev(BLOG);
            Schema usersOnly = SchemaParser.parseOrThrow(Declarations.datasource("sqlite") + """

                    model User {
                      id        Int      @id @default(autoincrement())
                      email     String   @unique
                      name      String?
                      active    Boolean  @default(true)
                      createdAt DateTime @default(now())
                    }
                    """);

            assertThatThrownBy(() -> engine("drop posts").dev(usersOnly))
                    .isInstanceOf(DestructiveChangeException.class);

            DevResult accepted = engine(EngineOptions.builder().migrationName("drop posts").acceptDataLoss(true).build())
                    .dev(usersOnly);
            assertThat(accepted.created().sql()).contains("DROP TABLE \"Post\"");
            assertThat(accepted.warnings()).isNotEmpty();
        }
    }

    @Nested
    @DisplayName("deploy and reset")
    class DeployAndReset {

        @Test
        @DisplayName("Deploy applies every pending migration and nothing else")
        void deploy() {
            engine(EngineOptions.builder().migrationName("init").createOnly(true).build()).dev(BLOG);

            List<Migration> applied = engine(EngineOptions.defaults()).deploy();

            assertThat(applied).hasSize(1);
            assertThat(engine(EngineOptions.defaults()).deploy()).isEmpty();
        }

        @Test
        @DisplayName("Reset wipes manual tables and reapplies the history")
        void reset() throws SQLException {
            engine("init").dev(BLOG);
            execute("CREATE TABLE \"Audit\" (\"id\" INTEGER NOT NULL PRIMARY KEY)");

            List<Migration> applied = engine(EngineOptions.defaults()).reset();

            assertThat(applied).hasSize(1);
            SchemaModel live = engine(EngineOptions.defaults()).introspect();
            assertThat(live.getTables().keySet()).containsExactlyInAnyOrder("User", "Post");
            assertTrue(engine("next").dev(BLOG).isInSync());
        }

        @Test
        @DisplayName("Status lists local and applied migrations")
        void status() {
            engine("init").dev(BLOG);
            engine(EngineOptions.builder().migrationName("add published").createOnly(true).build()).dev(BLOG_PUBLISHED);

            List<MigrationStatus> status = engine(EngineOptions.defaults()).status();

            assertThat(status).extracting(MigrationStatus::state)
                    .containsExactly(MigrationState.APPLIED, MigrationState.LOCAL_ONLY);
        }

        @Test
        @DisplayName("Resolve records a migration as applied or rolls it back")
        void resolve() {
            Migration created = engine(EngineOptions.builder().migrationName("init").createOnly(true).build())
                    .dev(BLOG).created();
            MigrationEngine engine = engine(EngineOptions.defaults());

            engine.resolveApplied(created.name());
            assertThat(engine.pending()).isEmpty();

            engine.resolveRolledBack(created.name());
            assertThat(engine.pending()).extracting(Migration::name).containsExactly(created.name());
        }
    }

    @Nested
    @DisplayName("push and diff")
    class PushAndDiff {

        @Test
        @DisplayName("Push syncs the database without writing migrations")
        void push() {
            PushResult result = engine(EngineOptions.defaults()).push(BLOG);

            assertFalse(result.isInSync());
            assertThat(result.sql()).contains("CREATE TABLE \"Post\"");
            assertFalse(Files.exists(migrations));
            assertTrue(engine(EngineOptions.defaults()).push(BLOG).isInSync());
        }

        @Test
        @DisplayName("Diffing two declarations needs no database")
        void diffDeclarations() {
            MigrationEngine engine = engine(EngineOptions.defaults());

            ChangeSet changes = engine.diff(BLOG, BLOG_PUBLISHED);

            assertThat(changes.findAlteredTable("Post")).isPresent();
            assertEquals("ALTER TABLE \"Post\" ADD COLUMN \"published\" BOOLEAN NOT NULL DEFAULT false;",
                    engine.generateSql(changes));
        }

        @Test
        @DisplayName("Diffing against the database reflects what was applied")
        void diffDatabase() {
            engine("init").dev(BLOG);

            MigrationEngine engine = engine(EngineOptions.defaults());

            assertTrue(engine.diffDatabase(BLOG).isEmpty());
            assertThat(engine.diffDatabase(BLOG_PUBLISHED).findAlteredTable("Post")).isPresent();
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {"1+1", "(1+1)", "(datetime('now'))", "datetime('now')", "( lower(  'X') )"})
        @DisplayName("Raw SQL defaults converge whether or not they are parenthesized")
        void dbGeneratedDefaultsConverge(String sql) {
            Schema schema = SchemaParser.parseOrThrow(Declarations.datasource("sqlite") + """

                    model Gadget {
                      id    Int    @id
                      value String @default(dbgenerated("%s"))
                    }
                    """.formatted(sql));
            MigrationEngine engine = MigrationEngine.forSchema(schema, url, migrations, EngineOptions.defaults());

            engine.push(schema);

            assertTrue(engine.diffDatabase(schema).isEmpty());
            assertTrue(engine.push(schema).isInSync());
        }
    }

    @Nested
    @DisplayName("incomplete diffs")
    class IncompleteDiff {

        private MigrationEngine failingEngine() {
            return new MigrationEngine(new SqliteDialect(), url, new MigrationDirectory(migrations),
                    EngineOptions.builder().migrationName("init").build(), new ConnectionFactory(),
                    new SchemaDiffer(List.of(new FailingDiffer())));
        }

        @Test
        @DisplayName("Push refuses to apply a change set a differ failed on")
        void pushRefuses() {
            assertThatThrownBy(() -> failingEngine().push(BLOG))
                    .isInstanceOfSatisfying(IncompleteDiffException.class,
                            e -> assertThat(e.getFailedDiffers()).containsExactly("FailingDiffer"))
                    .hasMessageContaining("catalog mismatch");
            assertThat(engine(EngineOptions.defaults()).introspect().getTables()).isEmpty();
        }

        @Test
        @DisplayName("Dev refuses to write a migration from a change set a differ failed on")
        void devRefuses() {
            assertThatThrownBy(() -> failingEngine().dev(BLOG))
                    .isInstanceOf(IncompleteDiffException.class);
            assertFalse(Files.exists(migrations) && new MigrationDirectoryView(migrations).names().size() > 0);
        }
    }

    static class FailingDiffer implements Differ {
        @Override
        public void diff(SchemaModel oldSchema, SchemaModel newSchema, ChangeSet result) {
            throw new IllegalStateException("catalog mismatch");
        }
    }

    /**
     * Names of migration directories on disk.
     */
    private record MigrationDirectoryView(Path root) {
        List<String> names() {
            try (var entries = Files.list(root)) {
                return entries.filter(Files::isDirectory).map(p -> p.getFileName().toString()).sorted().toList();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }
    }
}
