package com.circuitsync.cli;

import com.circuitsync.core.config.ConfigLoader;
import com.circuitsync.core.config.SyncConfig;
import com.circuitsync.core.description.CircuitDescription;
import com.circuitsync.core.description.DescriptionLoader;
import com.circuitsync.core.sync.SyncReport;
import com.circuitsync.core.sync.SyncReport.ChangeCounts;
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
 * Command to show what {@code sync} would change, without writing.
 */
@Command(
    name = "diff",
    description = "Show the changes a sync would make",
    mixinStandardHelpOptions = true
)
public class DiffCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DiffCommand.class);

    @Parameters(index = "0", description = "Circuit description (YAML or JSON)")
    private Path descriptionFile;

    @Parameters(index = "1", description = "Project directory (default: current directory)", defaultValue = ".")
    private Path projectDirectory;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        try {
            SyncConfig config = CommandSupport.loadConfiguration(projectDirectory, configPath);
            CircuitDescription description = DescriptionLoader.load(descriptionFile);
            SyncReport report = new SynchronizationEngine(config).plan(description, projectDirectory);

            if (!report.success()) {
                CommandSupport.printIssues(report.issues());
                System.err.println("✗ Cannot plan: the project or the description is invalid");
                return 1;
            }

            printCounts("Components", report.components());
            printCounts("Nets", report.nets());
            printCounts("Sub-circuits", report.instances());
            System.out.println();
            report.fragmentsWritten().forEach(f -> System.out.println("  would write  " + f));
            report.fragmentsDeleted().forEach(f -> System.out.println("  would delete " + f));
            CommandSupport.printIssues(report.issues());
            System.out.println();
            System.out.println(report.hasChanges() ? "✓ Changes pending" : "✓ Project is up to date");
            return 0;

        } catch (Exception e) {
            log.error("Diff failed", e);
            System.err.println("✗ Diff failed: " + e.getMessage());
            return 1;
        }
    }

    private static void printCounts(String label, ChangeCounts counts) {
        System.out.printf("%-13s +%d -%d ~%d =%d%n", label, counts.added(), counts.removed(), counts.updated(),
            counts.kept());
    }
}
