package org.keel.cli.service;

import lombok.extern.slf4j.Slf4j;
import org.keel.cli.CommonOptions;
import org.keel.config.ConfigurationLoader;
import org.keel.engine.MigrationEngine;
import org.keel.exception.KeelException;
import org.keel.introspect.ConnectionUrl;
import org.keel.options.EngineOptions;
import org.keel.options.KeelOptions;
import org.keel.parser.SchemaParser;
import org.keel.parser.SchemaValidator;
import org.keel.parser.ast.Schema;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the settings of one CLI invocation: command-line options first, then the active
 * {@code keel.yaml} profile, then the declaration's datasource block.
 */
@Slf4j
public class ProjectContext {

    private final CommonOptions options;
    private final Map<String, String> config;
    private final ConfigurationLoader loader;

    public ProjectContext(CommonOptions options, ConfigurationLoader loader) {
        this.options = options;
        this.loader = loader;
        this.config = loader.loadConfiguration(options.getProfile());
    }

    public static ProjectContext load(CommonOptions options) {
        return new ProjectContext(options, new ConfigurationLoader());
    }

    public Path schemaPath() {
        if (options.getSchema() != null) {
            return options.getSchema();
        }
        return Paths.get(config.getOrDefault(KeelOptions.Schema.PATH_KEY, KeelOptions.Schema.DEFAULT_FILE));
    }

    public Path migrationsDirectory() {
        if (options.getMigrations() != null) {
            return options.getMigrations();
        }
        return Paths.get(config.getOrDefault(KeelOptions.Migrations.DIRECTORY_KEY, KeelOptions.Migrations.DEFAULT_DIRECTORY));
    }

    /**
     * Parses and validates the declaration at {@link #schemaPath()}.
     */
    public Schema loadSchema() {
        return loadSchema(schemaPath());
    }

    public Schema loadSchema(Path path) {
        if (!Files.exists(path)) {
            throw new KeelException("Declaration file not found: " + path);
        }
        Schema schema = SchemaParser.parse(path).orThrow();
        return new SchemaValidator().validateOrThrow(schema);
    }

    /**
     * Connection string, or empty when neither the options, the profile nor the declaration
     * name one.
     */
    public Optional<String> findUrl(Schema schema) {
        if (options.getUrl() != null) {
            return Optional.of(options.getUrl());
        }
        String configured = config.get(KeelOptions.Datasource.URL_KEY);
        if (configured != null) {
            return Optional.of(configured);
        }
        return schema.datasources().stream()
                .findFirst()
                .flatMap(ds -> ds.entry("url"))
                .map(value -> value.asString().orElseGet(value::render))
                .map(loader::resolveValue);
    }

    public String requireUrl(Schema schema) {
        return findUrl(schema).orElseThrow(() -> new KeelException(
                "No database URL. Pass --url, set datasource.url in " + KeelOptions.Profile.CONFIG_FILE
                        + " or give the datasource block a url"));
    }

    public EngineOptions.EngineOptionsBuilder engineOptions() {
        String shadow = options.getShadowUrl() != null
                ? options.getShadowUrl()
                : config.get(KeelOptions.Datasource.SHADOW_URL_KEY);
        try {
            return EngineOptions.builder()
                    .shadowDatabaseUrl(shadow)
                    .indexColumnOrder(EngineOptions.IndexColumnOrder.fromConfig(
                            config.get(KeelOptions.Diff.INDEX_COLUMN_ORDER_KEY)));
        } catch (IllegalArgumentException e) {
            throw new KeelException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    public MigrationEngine engine(Schema schema, EngineOptions engineOptions) {
        String url = requireUrl(schema);
        log.debug("Using database {}", ConnectionUrl.redact(url));
        return MigrationEngine.forSchema(schema, url, migrationsDirectory(), engineOptions);
    }

    /**
     * Engine for offline work; the URL only matters for picking the provider.
     */
    public MigrationEngine offlineEngine(Schema schema, EngineOptions engineOptions) {
        return MigrationEngine.forSchema(schema, findUrl(schema).orElse(null), migrationsDirectory(), engineOptions);
    }
}
