package org.keel.cli;

import org.keel.cli.service.ProjectContext;
import org.keel.engine.MigrationEngine;
import org.keel.history.Migration;
import org.keel.parser.ast.Schema;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(
        name = "reset",
        mixinStandardHelpOptions = true,
        description = "Drop every table and reapply all migrations. All data is lost"
)
public class MigrateResetCommand extends AbstractEngineCommand {

    @CommandLine.Option(names = {"-f", "--force"}, description = "Confirm that all data may be dropped", required = true)
    private boolean force;

    @Override
    protected int run(ProjectContext context) {
        Schema schema = context.loadSchema();
        MigrationEngine engine = context.engine(schema, context.engineOptions().build());

        List<Migration> applied = engine.reset();
        out().println("Database reset.");
        applied.forEach(m -> out().println("Applied migration " + m.name()));
        return 0;
    }
}
