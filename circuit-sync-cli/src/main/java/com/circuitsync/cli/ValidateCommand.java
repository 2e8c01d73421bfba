package com.circuitsync.cli;

import com.circuitsync.core.config.ConfigLoader;
import com.circuitsync.core.config.SyncConfig;
import com.circuitsync.core.document.ProjectStore;
import com.circuitsync.core.document.ProjectStore.LoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to parse every fragment of a project and report format errors.
 */
@Command(
    name = "validate",
    description = "Parse every fragment of a project and report format errors",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Project directory (default: current directory)", defaultValue = ".")
    private Path projectDirectory;

    @Option(names = {"-p", "--project"}, description = "Project name (default: directory name)")
    private String projectName;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        if (!Files.isDirectory(projectDirectory)) {
            System.err.println("✗ Not a directory: " + projectDirectory);
            return 1;
        }
        SyncConfig config = CommandSupport.loadConfiguration(projectDirectory, configPath);
        String name = projectName != null ? projectName
            : config.sync().projectName() != null ? config.sync().projectName()
            : projectDirectory.toAbsolutePath().normalize().getFileName().toString();
        log.info("Validating project {} in {}", name, projectDirectory);

        LoadResult result = new ProjectStore(config.document()).load(projectDirectory, name);
        CommandSupport.printIssues(result.issues());
        if (result.hasErrors()) {
            System.err.println("✗ " + result.issues().size() + " fragment(s) failed to parse");
            return 1;
        }
        System.out.println("✓ " + result.project().fragments().size() + " fragment(s) parsed");
        return 0;
    }
}
