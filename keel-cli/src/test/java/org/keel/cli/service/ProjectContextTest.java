package org.keel.cli.service;

import org.keel.cli.CommonOptions;
import org.keel.config.ConfigurationLoader;
import org.keel.exception.KeelException;
import org.keel.options.EngineOptions;
import org.keel.parser.SchemaParser;
import org.keel.parser.ast.Schema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ProjectContextTest {

    @TempDir
    Path tempDir;

    private static final Schema WITH_ENV_URL = SchemaParser.parseOrThrow("""
            datasource db {
              provider = "postgresql"
              url      = env("DATABASE_URL")
            }
            """);

    private static final Schema WITHOUT_URL = SchemaParser.parseOrThrow("""
            datasource db {
              provider = "postgresql"
            }
            """);

    private static CommonOptions options(String... args) {
        return CommandLine.populateCommand(new CommonOptions(), args);
    }

    private ProjectContext context(CommonOptions options, Map<String, String> env) {
        return new ProjectContext(options, new ConfigurationLoader(tempDir, env::get));
    }

    private void writeConfig() throws IOException {
        Files.writeString(tempDir.resolve("keel.yaml"), """
                profiles:
                  dev:
                    schema: db/schema.keel
                    migrations:
                      directory: db/migrations
                    datasource:
                      url: postgresql://localhost/app
                      shadowUrl: postgresql://localhost/shadow
                    diff:
                      indexColumnOrder: significant
                """);
    }

    @Test
    @DisplayName("Without options or configuration the conventional paths are used")
    void defaults() {
        ProjectContext context = context(options(), Map.of());

        assertEquals(Paths.get("schema.keel"), context.schemaPath());
        assertEquals(Paths.get("migrations"), context.migrationsDirectory());
    }

    @Test
    @DisplayName("Configured values apply when no option is given")
    void configuredValues() throws IOException {
        // given
        writeConfig();

        // when
        ProjectContext context = context(options(), Map.of());
        EngineOptions engineOptions = context.engineOptions().build();

        // then
        assertEquals(Paths.get("db/schema.keel"), context.schemaPath());
        assertEquals(Paths.get("db/migrations"), context.migrationsDirectory());
        assertThat(context.findUrl(WITH_ENV_URL)).contains("postgresql://localhost/app");
        assertEquals("postgresql://localhost/shadow", engineOptions.getShadowDatabaseUrl());
        assertEquals(EngineOptions.IndexColumnOrder.SIGNIFICANT, engineOptions.getIndexColumnOrder());
    }

    @Test
    @DisplayName("Command-line options win over the configuration")
    void optionsWin() throws IOException {
        // given
        writeConfig();

        // when
        ProjectContext context = context(options(
                "--schema", "other.keel",
                "--migrations", "out",
                "--url", "postgresql://cli/app",
                "--shadow-url", "postgresql://cli/shadow"), Map.of());

        // then
        assertEquals(Paths.get("other.keel"), context.schemaPath());
        assertEquals(Paths.get("out"), context.migrationsDirectory());
        assertThat(context.findUrl(WITH_ENV_URL)).contains("postgresql://cli/app");
        assertEquals("postgresql://cli/shadow", context.engineOptions().build().getShadowDatabaseUrl());
    }

    @Test
    @DisplayName("The datasource url is the last resort and may read the environment")
    void datasourceUrl() {
        ProjectContext context = context(options(), Map.of("DATABASE_URL", "postgresql://env/app"));

        assertThat(context.findUrl(WITH_ENV_URL)).contains("postgresql://env/app");
        assertThat(context.findUrl(WITHOUT_URL)).isEmpty();
        assertThatThrownBy(() -> context.requireUrl(WITHOUT_URL))
                .isInstanceOf(KeelException.class)
                .hasMessageContaining("No database URL");
    }

    @Test
    @DisplayName("An invalid declaration is reported with its errors")
    void invalidDeclaration() throws IOException {
        Path schema = tempDir.resolve("broken.keel");
        Files.writeString(schema, "model User {\n  id Int @id\n  owner Missing\n}\n");

        ProjectContext context = context(options(), Map.of());

        assertThatThrownBy(() -> context.loadSchema(schema)).isInstanceOf(KeelException.class);
    }
}
