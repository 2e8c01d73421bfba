package com.circuitsync.cli;

import com.circuitsync.core.config.ConfigLoader;
import com.circuitsync.core.config.SyncConfig;
import com.circuitsync.core.model.SyncIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Helpers shared by the commands.
 */
final class CommandSupport {

    private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

    private CommandSupport() {
        // Utility class
    }

    static SyncConfig loadConfiguration(Path projectDirectory, Path configPath) {
        log.debug("Loading configuration {} for project {}", configPath, projectDirectory);
        return ConfigLoader.forProject(projectDirectory, configPath);
    }

    static void printIssues(List<SyncIssue> issues) {
        for (SyncIssue issue : issues) {
            String marker = issue.isFatal() ? "✗" : "!";
            System.err.println(marker + " " + issue.severity() + " " + issue.kind() + " " + issue.entity()
                + ": " + issue.message());
        }
    }
}
