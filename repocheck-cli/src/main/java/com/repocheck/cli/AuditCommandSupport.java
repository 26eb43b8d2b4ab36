package com.repocheck.cli;

import com.repocheck.core.config.AuditConfig;
import com.repocheck.core.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Shared option handling for commands that audit a project checkout.
 */
final class AuditCommandSupport {

    private static final Logger log = LoggerFactory.getLogger(AuditCommandSupport.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_ERROR = 2;

    private AuditCommandSupport() {
        // Utility class
    }

    /**
     * Loads configuration, resolving a relative config path against the project directory.
     *
     * @param projectPath project directory
     * @param configPath configuration file, absolute or relative to the project
     * @return loaded configuration, or defaults when the file does not exist
     * @throws IOException if the file exists but is not valid configuration
     */
    static AuditConfig loadConfiguration(Path projectPath, Path configPath) throws IOException {
        Path absoluteConfigPath = resolveConfigPath(projectPath, configPath);
        log.debug("Loading configuration from: {}", absoluteConfigPath);
        return ConfigLoader.load(absoluteConfigPath);
    }

    static Path resolveConfigPath(Path projectPath, Path configPath) {
        return configPath.isAbsolute() ? configPath : projectPath.resolve(configPath);
    }
}
