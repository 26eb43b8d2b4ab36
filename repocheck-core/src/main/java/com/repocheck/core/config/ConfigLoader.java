package com.repocheck.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading RepoCheck configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code repocheck.yaml} into {@link AuditConfig} records.
 * A missing or blank file yields {@link AuditConfig#defaults()}. A file that exists but
 * cannot be read or parsed is an error: its exception tables would otherwise be replaced
 * by the defaults without notice.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AuditConfig config = ConfigLoader.load(Paths.get("repocheck.yaml"));
 * ExceptionList exceptions = config.exceptionList();
 * }</pre>
 */
public final class ConfigLoader {

    /**
     * Default configuration file name, resolved against the project root.
     */
    public static final String DEFAULT_CONFIG_FILE = "repocheck.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code repocheck.yaml}
     * @return loaded configuration, or defaults if the file does not exist or is blank
     * @throws IOException if the file exists but is not a readable file or is not valid configuration
     */
    public static AuditConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return AuditConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new IOException("Configuration file is not readable: " + configPath);
        }

        log.debug("Loading configuration from: {}", configPath);
        String content = Files.readString(configPath);
        if (content.isBlank()) {
            log.warn("Configuration file is empty: {}. Using defaults.", configPath);
            return AuditConfig.defaults();
        }

        AuditConfig config;
        try {
            config = YAML_MAPPER.readValue(content, AuditConfig.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid configuration file " + configPath + ": " + e.getOriginalMessage(), e);
        }
        if (config == null) {
            log.warn("Configuration file has no settings: {}. Using defaults.", configPath);
            return AuditConfig.defaults();
        }
        log.info("Loaded configuration from: {}", configPath);
        return config;
    }
}
