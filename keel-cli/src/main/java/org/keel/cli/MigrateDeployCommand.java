package org.keel.cli;

import org.keel.cli.service.ProjectContext;
import org.keel.engine.MigrationEngine;
import org.keel.history.Migration;
import org.keel.parser.ast.Schema;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(
        name = "deploy",
        mixinStandardHelpOptions = true,
        description = "Apply pending migrations. Never creates a migration"
)
public class MigrateDeployCommand extends AbstractEngineCommand {

    @Override
    protected int run(ProjectContext context) {
        Schema schema = context.loadSchema();
        MigrationEngine engine = context.engine(schema, context.engineOptions().build());

        List<Migration> applied = engine.deploy();
        if (applied.isEmpty()) {
            out().println("No pending migrations to apply.");
            return 0;
        }
        applied.forEach(m -> out().println("Applied migration " + m.name()));
        out().println(applied.size() + " migration(s) applied.");
        return 0;
    }
}
