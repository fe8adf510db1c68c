package org.keel.cli;

import lombok.Getter;
import picocli.CommandLine;

import java.nio.file.Path;

/**
 * Options shared by every command. Values given here win over {@code keel.yaml}.
 */
@Getter
public class CommonOptions {

    @CommandLine.Option(names = "--schema", description = "Declaration file (default: schema.keel)")
    private Path schema;

    @CommandLine.Option(names = "--url", description = "Database connection string")
    private String url;

    @CommandLine.Option(names = "--shadow-url", description = "Scratch database used for drift detection")
    private String shadowUrl;

    @CommandLine.Option(names = "--migrations", description = "Migrations directory (default: migrations)")
    private Path migrations;

    @CommandLine.Option(names = "--profile", description = "Configuration profile (dev, prod, test ...)")
    private String profile;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log executed statements and engine decisions")
    private boolean verbose;
}
