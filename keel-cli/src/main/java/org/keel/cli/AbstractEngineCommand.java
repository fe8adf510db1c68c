package org.keel.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.keel.cli.service.ProjectContext;
import org.keel.exception.DestructiveChangeException;
import org.keel.exception.KeelException;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Base for commands that talk to the engine. Maps engine failures to exit code 1 and prints
 * them on stderr.
 */
public abstract class AbstractEngineCommand implements Callable<Integer> {

    @CommandLine.Mixin
    protected CommonOptions common;

    @CommandLine.Spec
    protected CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        if (common.isVerbose()) {
            Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }
        try {
            return run(ProjectContext.load(common));
        } catch (DestructiveChangeException e) {
            err().println("Aborted: the change set would lose data.");
            e.getReasons().forEach(reason -> err().println("  - " + reason));
            err().println();
            err().println("To proceed anyway, use the --accept-data-loss option.");
            return 1;
        } catch (KeelException e) {
            err().println("Error: " + e.getMessage());
            return 1;
        }
    }

    protected abstract int run(ProjectContext context);

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    protected void printWarnings(List<String> warnings) {
        if (warnings.isEmpty()) {
            return;
        }
        out().println();
        out().println("Warnings:");
        warnings.forEach(w -> out().println("  - " + w));
    }
}
