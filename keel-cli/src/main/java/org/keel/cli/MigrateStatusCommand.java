package org.keel.cli;

import org.keel.cli.service.ProjectContext;
import org.keel.engine.MigrationEngine;
import org.keel.history.MigrationState;
import org.keel.history.MigrationStatus;
import org.keel.parser.ast.Schema;
import picocli.CommandLine;

import java.util.List;

/**
 * Lists every migration known locally or to the database with its state.
 */
@CommandLine.Command(
        name = "status",
        mixinStandardHelpOptions = true,
        description = "Show which migrations are applied, pending or missing locally"
)
public class MigrateStatusCommand extends AbstractEngineCommand {

    @Override
    protected int run(ProjectContext context) {
        Schema schema = context.loadSchema();
        MigrationEngine engine = context.engine(schema, context.engineOptions().build());

        List<MigrationStatus> statuses = engine.status();
        if (statuses.isEmpty()) {
            out().println("No migrations found in " + context.migrationsDirectory());
            return 0;
        }
        for (MigrationStatus s : statuses) {
            out().printf("%-16s %s%n", label(s.state()), s.name());
        }

        long pending = statuses.stream().filter(s -> s.state() == MigrationState.LOCAL_ONLY).count();
        long missing = statuses.stream().filter(s -> s.state() == MigrationState.MISSING_LOCALLY).count();
        out().println();
        if (pending == 0 && missing == 0) {
            out().println("Database schema is up to date.");
        } else {
            if (pending > 0) {
                out().println(pending + " migration(s) have not yet been applied.");
            }
            if (missing > 0) {
                out().println(missing + " applied migration(s) are missing from the migrations directory.");
            }
        }
        return 0;
    }

    private static String label(MigrationState state) {
        return switch (state) {
            case APPLIED -> "applied";
            case LOCAL_ONLY -> "pending";
            case MISSING_LOCALLY -> "missing locally";
        };
    }
}
