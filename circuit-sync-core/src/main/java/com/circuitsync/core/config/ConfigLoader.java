package com.circuitsync.core.config;

import com.circuitsync.core.config.SyncConfig.LibrarySettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Loads {@link SyncConfig} from {@code circuitsync.yaml}.
 *
 * <p>A missing, unreadable or malformed file never fails a run: the loader logs why and
 * falls back to {@link SyncConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SyncConfig config = ConfigLoader.forProject(Path.of("hardware/board"), Path.of(ConfigLoader.DEFAULT_FILE_NAME));
 * }</pre>
 */
public class ConfigLoader {

    /** Configuration file name looked up in the project directory. */
    public static final String DEFAULT_FILE_NAME = "circuitsync.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads the configuration of a project.
     *
     * <p>A relative {@code configPath} is taken relative to the project directory. Relative
     * library paths, and paths starting with {@code ~/}, are resolved against the directory
     * holding the configuration file.
     *
     * @param projectDirectory project directory
     * @param configPath configuration file, usually {@link #DEFAULT_FILE_NAME}
     * @return loaded configuration with absolute library paths, or defaults
     */
    public static SyncConfig forProject(Path projectDirectory, Path configPath) {
        Path file = (configPath.isAbsolute() ? configPath : projectDirectory.resolve(configPath))
            .toAbsolutePath()
            .normalize();
        return resolveLibraryPaths(load(file), file.getParent());
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code circuitsync.yaml}
     * @return loaded configuration, or defaults if unavailable
     */
    public static SyncConfig load(Path configPath) {
        return read(configPath).orElseGet(SyncConfig::defaults);
    }

    private static Optional<SyncConfig> read(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return Optional.empty();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return Optional.empty();
        }
        try {
            Optional<SyncConfig> config = Optional.ofNullable(
                YAML_MAPPER.readValue(configPath.toFile(), SyncConfig.class));
            if (config.isEmpty()) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
            } else {
                log.info("Loaded configuration from: {}", configPath);
            }
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return Optional.empty();
        }
    }

    static SyncConfig resolveLibraryPaths(SyncConfig config, Path baseDirectory) {
        if (config.library().paths().isEmpty()) {
            return config;
        }
        List<String> resolved = config.library().paths().stream()
            .map(path -> resolve(path, baseDirectory))
            .toList();
        log.debug("Symbol library paths: {}", resolved);
        return new SyncConfig(config.placement(), config.document(), new LibrarySettings(resolved), config.sync());
    }

    private static String resolve(String path, Path baseDirectory) {
        Path candidate;
        if (path.equals("~") || path.startsWith("~/")) {
            candidate = Path.of(System.getProperty("user.home")).resolve(path.substring(1).replaceFirst("^/", ""));
        } else {
            candidate = Path.of(path);
        }
        if (!candidate.isAbsolute() && baseDirectory != null) {
            candidate = baseDirectory.resolve(candidate);
        }
        return candidate.normalize().toString();
    }
}
