package org.keel.cli;

import org.keel.cli.service.ProjectContext;
import org.keel.engine.MigrationEngine;
import org.keel.parser.ast.Schema;
import picocli.CommandLine;

/**
 * Fixes the ledger by hand after a failed or out-of-band migration.
 */
@CommandLine.Command(
        name = "resolve",
        mixinStandardHelpOptions = true,
        description = "Mark a migration as applied or rolled back without running it"
)
public class MigrateResolveCommand extends AbstractEngineCommand {

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    private Target target;

    static class Target {
        @CommandLine.Option(names = "--applied", description = "Record the migration as applied")
        String applied;

        @CommandLine.Option(names = "--rolled-back", description = "Record the migration as rolled back")
        String rolledBack;
    }

    @Override
    protected int run(ProjectContext context) {
        Schema schema = context.loadSchema();
        MigrationEngine engine = context.engine(schema, context.engineOptions().build());

        if (target.applied != null) {
            engine.resolveApplied(target.applied);
            out().println("Migration " + target.applied + " marked as applied.");
        } else {
            engine.resolveRolledBack(target.rolledBack);
            out().println("Migration " + target.rolledBack + " marked as rolled back.");
        }
        return 0;
    }
}
