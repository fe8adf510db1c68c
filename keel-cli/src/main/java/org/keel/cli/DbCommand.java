package org.keel.cli;

import picocli.CommandLine;

@CommandLine.Command(
        name = "db",
        description = "Work on the database directly, without migration files",
        subcommands = {
                DbPushCommand.class
        }
)
public class DbCommand {

}
