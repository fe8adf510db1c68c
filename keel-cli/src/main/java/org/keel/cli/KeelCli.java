package org.keel.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for Keel.
 * Manages database schemas from a declaration file and a directory of SQL migrations.
 */
@CommandLine.Command(
        name = "keel",
        mixinStandardHelpOptions = true,
        version = "keel 0.1.0",
        description = "Declarative schema migrations for PostgreSQL, MySQL and SQLite",
        subcommands = {
                MigrateCommand.class,
                DbCommand.class
        }
)
public class KeelCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new KeelCli()).execute(args);
        System.exit(exitCode);
    }
}
