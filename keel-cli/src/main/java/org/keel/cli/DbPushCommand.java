package org.keel.cli;

import org.keel.cli.service.ProjectContext;
import org.keel.engine.MigrationEngine;
import org.keel.engine.PushResult;
import org.keel.parser.ast.Schema;
import picocli.CommandLine;

@CommandLine.Command(
        name = "push",
        mixinStandardHelpOptions = true,
        description = "Bring the database in line with the declaration without creating a migration"
)
public class DbPushCommand extends AbstractEngineCommand {

    @CommandLine.Option(names = "--accept-data-loss", description = "Allow changes that drop tables or columns")
    private boolean acceptDataLoss;

    @Override
    protected int run(ProjectContext context) {
        Schema schema = context.loadSchema();
        MigrationEngine engine = context.engine(schema, context.engineOptions()
                .acceptDataLoss(acceptDataLoss)
                .build());

        PushResult result = engine.push(schema);
        if (result.isInSync()) {
            out().println("The database is already in sync with the schema.");
        } else {
            out().println("Your database is now in sync with your schema.");
        }
        printWarnings(result.warnings());
        return 0;
    }
}
