package com.circuitsync.cli;

import com.circuitsync.core.config.ConfigLoader;
import com.circuitsync.core.config.SyncConfig;
import com.circuitsync.core.description.CircuitDescription;
import com.circuitsync.core.description.DescriptionLoader;
import com.circuitsync.core.sync.ReportWriter;
import com.circuitsync.core.sync.SyncReport;
import com.circuitsync.core.sync.SynchronizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to apply a circuit description to a schematic project.
 *
 * <p>Prints the JSON report on standard output. Exits 0 on success, including runs
 * without changes, and 1 when a format error, an identity conflict or an invalid
 * description aborted the run.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * circuitsync sync board.yaml hardware/board
 * circuitsync sync board.yaml hardware/board --dry-run
 * }</pre>
 */
@Command(
    name = "sync",
    description = "Apply a circuit description to a schematic project",
    mixinStandardHelpOptions = true
)
public class SyncCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SyncCommand.class);

    @Parameters(index = "0", description = "Circuit description (YAML or JSON)")
    private Path descriptionFile;

    @Parameters(index = "1", description = "Project directory (default: current directory)", defaultValue = ".")
    private Path projectDirectory;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--dry-run"}, description = "Plan the run without writing any file")
    private boolean dryRun;

    @Override
    public Integer call() {
        try {
            SyncConfig config = CommandSupport.loadConfiguration(projectDirectory, configPath);
            CircuitDescription description = DescriptionLoader.load(descriptionFile);
            SynchronizationEngine engine = new SynchronizationEngine(config);

            SyncReport report = dryRun
                ? engine.plan(description, projectDirectory)
                : engine.synchronize(description, projectDirectory);
            System.out.println(ReportWriter.toJson(report));

            if (!report.success()) {
                CommandSupport.printIssues(report.issues());
                System.err.println("✗ Sync aborted, no file was written");
                return 1;
            }
            return 0;

        } catch (Exception e) {
            log.error("Sync failed", e);
            System.err.println("✗ Sync failed: " + e.getMessage());
            return 1;
        }
    }
}
