package com.circuitsync;

import ch.qos.logback.classic.Level;
import com.circuitsync.cli.DiffCommand;
import com.circuitsync.cli.SyncCommand;
import com.circuitsync.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for circuit-sync.
 *
 * <p>circuit-sync keeps a KiCad schematic project in line with a declarative circuit
 * description, editing only what changed.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code sync} - Apply a description to a project</li>
 *   <li>{@code diff} - Show what {@code sync} would change</li>
 *   <li>{@code validate} - Parse every fragment of a project and report format errors</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * circuitsync sync board.yaml hardware/board
 * circuitsync -v diff board.yaml hardware/board
 * circuitsync validate hardware/board
 * }</pre>
 */
@Command(
    name = "circuitsync",
    mixinStandardHelpOptions = true,
    version = "circuit-sync 1.0.0-SNAPSHOT",
    description = "Synchronizes circuit descriptions into KiCad schematic projects",
    subcommands = {
        SyncCommand.class,
        DiffCommand.class,
        ValidateCommand.class
    }
)
public class CircuitSyncCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("circuit-sync - schematic synchronization from circuit descriptions");
        System.out.println();
        System.out.println("Use 'circuitsync --help' to see available commands");
        System.out.println("Use 'circuitsync <command> --help' for command-specific help");
    }

    /**
     * Configures the logging level from the global options. Runs before any subcommand.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Command line with the logging strategy wired in.
     */
    public static CommandLine commandLine() {
        CircuitSyncCLI cli = new CircuitSyncCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
