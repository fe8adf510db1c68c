package org.keel.cli;

import picocli.CommandLine;

@CommandLine.Command(
        name = "migrate",
        description = "Create, apply and inspect migrations",
        subcommands = {
                MigrateDevCommand.class,
                MigrateDeployCommand.class,
                MigrateResetCommand.class,
                MigrateStatusCommand.class,
                MigrateResolveCommand.class,
                MigrateDiffCommand.class
        }
)
public class MigrateCommand {

}
