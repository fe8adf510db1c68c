package org.keel.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeelCliTest {

    private static final String BLOG = """
            datasource db {
              provider = "sqlite"
              url      = env("DATABASE_URL")
            }

            model User {
              id    Int    @id @default(autoincrement())
              email String @unique
              posts Post[]
            }

            model Post {
              id       Int    @id @default(autoincrement())
              title    String
              author   User   @relation(fields: [authorId], references: [id])
              authorId Int
            }
            """;

    @TempDir
    Path tempDir;

    private Path schema;
    private Path migrations;
    private String url;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        schema = tempDir.resolve("schema.keel");
        migrations = tempDir.resolve("migrations");
        url = "jdbc:sqlite:" + tempDir.resolve("dev.db");
        Files.writeString(schema, BLOG);
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        List<String> all = new ArrayList<>(List.of(args));
        if (!all.contains("--help")) {
            all.addAll(List.of("--schema", schema.toString(), "--migrations", migrations.toString(), "--url", url));
        }
        return new CommandLine(new KeelCli())
                .setOut(new PrintWriter(out, true))
                .setErr(new PrintWriter(err, true))
                .execute(all.toArray(String[]::new));
    }

    private void execute(String sql) throws SQLException {
        try (Connection c = DriverManager.getConnection(url); Statement st = c.createStatement()) {
            st.execute(sql);
        }
    }

    @Test
    @DisplayName("Help lists the command groups")
    void help() {
        int exitCode = run("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("migrate").contains("db");
    }

    @Nested
    @DisplayName("migrate dev")
    class Dev {

        @Test
        @DisplayName("Creates and applies the first migration")
        void firstRun() throws IOException {
            int exitCode = run("migrate", "dev", "--name", "init");

            assertThat(exitCode).isZero();
            assertThat(out.toString())
                    .contains("Applied migration ")
                    .contains("_init")
                    .contains("Your database is now in sync with your schema.");
            try (var dirs = Files.list(migrations)) {
                assertThat(dirs.map(p -> p.getFileName().toString()))
                        .anyMatch(n -> n.endsWith("_init"))
                        .contains("migration_lock.toml");
            }
        }

        @Test
        @DisplayName("Reports when nothing changed")
        void inSync() {
            run("migrate", "dev", "--name", "init");

            int exitCode = run("migrate", "dev");

            assertThat(exitCode).isZero();
            assertThat(out.toString()).contains("Already in sync");
        }

        @Test
        @DisplayName("With --create-only the migration is only written")
        void createOnly() {
            int exitCode = run("migrate", "dev", "--name", "init", "--create-only");

            assertThat(exitCode).isZero();
            assertThat(out.toString()).contains("Created migration").doesNotContain("Applied migration");
        }

        @Test
        @DisplayName("Drift fails with exit code 1 and suggests a reset")
        void drift() throws SQLException {
            run("migrate", "dev", "--name", "init");
            execute("CREATE TABLE \"Audit\" (\"id\" INTEGER NOT NULL PRIMARY KEY)");

            int exitCode = run("migrate", "dev", "--name", "next");

            assertThat(exitCode).isEqualTo(1);
            assertThat(err.toString()).contains("Drift detected").contains("keel migrate reset");
        }

        @Test
        @DisplayName("Dropping a model is refused without --accept-data-loss")
        void dataLoss() throws IOException {
            run("migrate", "dev", "--name", "init");
            Files.writeString(schema, BLOG.substring(0, BLOG.indexOf("model Post"))
                    .replace("  posts Post[]\n", ""));

            int exitCode = run("migrate", "dev", "--name", "drop posts");

            assertThat(exitCode).isEqualTo(1);
            assertThat(err.toString())
                    .contains("Aborted: the change set would lose data.")
                    .contains("`Post` table")
                    .contains("--accept-data-loss");

            assertThat(run("migrate", "dev", "--name", "drop posts", "--accept-data-loss")).isZero();
            assertThat(out.toString()).contains("Warnings:");
        }

        @Test
        @DisplayName("A missing declaration file is an error")
        void missingSchema() throws IOException {
            Files.delete(schema);

            int exitCode = run("migrate", "dev", "--name", "init");

            assertThat(exitCode).isEqualTo(1);
            assertThat(err.toString()).contains("Declaration file not found");
        }
    }

    @Nested
    @DisplayName("other migrate commands")
    class Lifecycle {

        @Test
        @DisplayName("Status shows applied and pending migrations")
        void status() {
            run("migrate", "dev", "--name", "init", "--create-only");

            run("migrate", "status");
            assertThat(out.toString()).contains("pending").contains("1 migration(s) have not yet been applied.");

            run("migrate", "deploy");
            assertThat(out.toString()).contains("1 migration(s) applied.");

            run("migrate", "status");
            assertThat(out.toString()).contains("applied").contains("Database schema is up to date.");
        }

        @Test
        @DisplayName("Deploy without pending migrations does nothing")
        void deployNothing() {
            int exitCode = run("migrate", "deploy");

            assertThat(exitCode).isZero();
            assertThat(out.toString()).contains("No pending migrations to apply.");
        }

        @Test
        @DisplayName("Reset requires --force")
        void resetNeedsForce() throws SQLException {
            run("migrate", "dev", "--name", "init");
            execute("CREATE TABLE \"Audit\" (\"id\" INTEGER NOT NULL PRIMARY KEY)");

            assertThat(run("migrate", "reset")).isEqualTo(2);

            assertThat(run("migrate", "reset", "--force")).isZero();
            assertThat(out.toString()).contains("Database reset.").contains("Applied migration");
            assertThat(run("migrate", "dev")).isZero();
            assertThat(out.toString()).contains("Already in sync");
        }

        @Test
        @DisplayName("Resolve marks migrations and rejects unknown names")
        void resolve() throws IOException {
            run("migrate", "dev", "--name", "init", "--create-only");
            String name;
            try (var dirs = Files.list(migrations)) {
                name = dirs.map(p -> p.getFileName().toString()).filter(n -> n.endsWith("_init")).findFirst().orElseThrow();
            }

            assertThat(run("migrate", "resolve", "--applied", name)).isZero();
            assertThat(out.toString()).contains("marked as applied");

            assertThat(run("migrate", "resolve", "--applied", "20990101000000_nope")).isEqualTo(1);
            assertThat(err.toString()).contains("does not exist locally");
        }
    }

    @Nested
    @DisplayName("migrate diff")
    class Diff {

        @Test
        @DisplayName("From the empty schema the summary lists every table")
        void summary() {
            int exitCode = run("migrate", "diff");

            assertThat(exitCode).isZero();
            assertThat(out.toString()).contains("[+] Added tables").contains("  - User").contains("  - Post");
        }

        @Test
        @DisplayName("--script prints the SQL")
        void script() {
            run("migrate", "diff", "--script");

            assertThat(out.toString()).contains("CREATE TABLE \"User\"");
        }

        @Test
        @DisplayName("--json prints the change set")
        void json() {
            run("migrate", "diff", "--json");

            assertThat(out.toString()).contains("\"createdTables\"");
        }

        @Test
        @DisplayName("Against an up-to-date database there is no difference")
        void fromDatabase() {
            run("migrate", "dev", "--name", "init");

            run("migrate", "diff", "--from-database");

            assertThat(out.toString()).contains("No difference detected.");
        }

        @Test
        @DisplayName("Two identical declarations give an empty script")
        void identical() {
            run("migrate", "diff", "--from", schema.toString(), "--to", schema.toString(), "--script");

            assertThat(out.toString()).contains("-- This is an empty migration.");
        }
    }

    @Test
    @DisplayName("db push syncs without writing migrations")
    void push() {
        int exitCode = run("db", "push");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Your database is now in sync with your schema.");
        assertThat(Files.exists(migrations)).isFalse();

        run("db", "push");
        assertThat(out.toString()).contains("already in sync");
    }
}
