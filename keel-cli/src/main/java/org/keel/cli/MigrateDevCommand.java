package org.keel.cli;

import org.keel.cli.service.ProjectContext;
import org.keel.engine.DevResult;
import org.keel.engine.MigrationEngine;
import org.keel.exception.DriftException;
import org.keel.history.Migration;
import org.keel.parser.ast.Schema;
import picocli.CommandLine;

/**
 * Applies pending migrations, then turns the remaining declaration changes into a new
 * migration.
 */
@CommandLine.Command(
        name = "dev",
        mixinStandardHelpOptions = true,
        description = "Create a migration from declaration changes and apply it to the development database"
)
public class MigrateDevCommand extends AbstractEngineCommand {

    @CommandLine.Option(names = {"-n", "--name"}, description = "Name of the new migration")
    private String name;

    @CommandLine.Option(names = "--create-only", description = "Write the migration without applying it")
    private boolean createOnly;

    @CommandLine.Option(names = "--accept-data-loss", description = "Allow changes that drop tables or columns")
    private boolean acceptDataLoss;

    @Override
    protected int run(ProjectContext context) {
        Schema schema = context.loadSchema();
        MigrationEngine engine = context.engine(schema, context.engineOptions()
                .migrationName(name)
                .createOnly(createOnly)
                .acceptDataLoss(acceptDataLoss)
                .build());

        DevResult result;
        try {
            result = engine.dev(schema);
        } catch (DriftException e) {
            err().println(e.getMessage());
            err().println();
            err().println("The database must be reset to continue. Run `keel migrate reset` (all data will be lost).");
            return 1;
        }

        for (Migration m : result.applied()) {
            out().println("Applied migration " + m.name());
        }
        if (result.isInSync()) {
            out().println("Already in sync, no schema change or pending migration was found.");
        } else if (createOnly) {
            out().println("Created migration " + result.created().name()
                    + ". Edit it if needed, then run `keel migrate dev` to apply it.");
        } else {
            out().println("Your database is now in sync with your schema.");
        }
        printWarnings(result.warnings());
        return 0;
    }
}
