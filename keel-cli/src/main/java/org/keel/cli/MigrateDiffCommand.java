package org.keel.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.keel.cli.service.ProjectContext;
import org.keel.dev.DriftReport;
import org.keel.engine.MigrationEngine;
import org.keel.exception.KeelException;
import org.keel.model.ChangeSet;
import org.keel.parser.ast.Schema;
import picocli.CommandLine;

import java.nio.file.Path;

/**
 * Compares two declarations, or the live database with a declaration, and prints the
 * difference. Nothing is written or applied.
 */
@CommandLine.Command(
        name = "diff",
        mixinStandardHelpOptions = true,
        description = "Show the changes between two schema sources"
)
public class MigrateDiffCommand extends AbstractEngineCommand {

    @CommandLine.ArgGroup(exclusive = true)
    private From from = new From();

    static class From {
        @CommandLine.Option(names = "--from", description = "Declaration to start from (default: empty schema)")
        Path declaration;

        @CommandLine.Option(names = "--from-database", description = "Start from the live database")
        boolean database;
    }

    @CommandLine.Option(names = "--to", description = "Target declaration (default: the configured schema)")
    private Path to;

    @CommandLine.ArgGroup(exclusive = true)
    private Format format = new Format();

    static class Format {
        @CommandLine.Option(names = "--script", description = "Print the SQL that performs the changes")
        boolean script;

        @CommandLine.Option(names = "--json", description = "Print the change set as JSON")
        boolean json;
    }

    @Override
    protected int run(ProjectContext context) {
        Schema target = to != null ? context.loadSchema(to) : context.loadSchema();

        ChangeSet changes;
        MigrationEngine engine;
        if (from.database) {
            engine = context.engine(target, context.engineOptions().build());
            changes = engine.diffDatabase(target);
        } else {
            engine = context.offlineEngine(target, context.engineOptions().build());
            Schema source = from.declaration != null ? context.loadSchema(from.declaration) : Schema.empty();
            changes = engine.diff(source, target);
        }

        if (format.json) {
            out().println(toJson(changes));
        } else if (format.script) {
            out().println(changes.isEmpty() ? "-- This is an empty migration." : engine.generateSql(changes));
        } else if (changes.isEmpty()) {
            out().println("No difference detected.");
        } else {
            out().println(new DriftReport(changes).render());
        }
        if (!format.json) {
            printWarnings(changes.getWarnings());
        }
        return 0;
    }

    private static String toJson(ChangeSet changes) {
        try {
            return new ObjectMapper()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(changes);
        } catch (JsonProcessingException e) {
            throw new KeelException("Failed to render change set as JSON: " + e.getOriginalMessage(), e);
        }
    }
}
