package com.micaixbrl.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and writes {@code mica-ixbrl.yaml}.
 *
 * <p>Loading never fails: a missing, unreadable or malformed file yields
 * {@link ProjectConfig#defaults()} and a log message.</p>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "mica-ixbrl.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to the configuration file
     * @return loaded configuration, or defaults if unavailable
     */
    public static ProjectConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        try {
            ProjectConfig config = YAML_MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ProjectConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ProjectConfig.defaults();
        }
    }

    /**
     * Serializes a configuration as YAML.
     *
     * @param config configuration
     * @return YAML text
     */
    public static String toYaml(ProjectConfig config) {
        try {
            return YAML_MAPPER.writeValueAsString(config);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize configuration", e);
        }
    }

    /**
     * Writes a configuration file.
     *
     * @param configPath target file
     * @param config configuration
     */
    public static void write(Path configPath, ProjectConfig config) {
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(configPath, toYaml(config));
            log.info("Wrote configuration to: {}", configPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write configuration file: " + configPath, e);
        }
    }
}
