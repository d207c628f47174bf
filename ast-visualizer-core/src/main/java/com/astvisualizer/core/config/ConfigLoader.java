package com.astvisualizer.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading visualizer configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code astviz.yaml} into {@link VisualizerConfig} records.
 * If the config file is missing or invalid, returns {@link VisualizerConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * VisualizerConfig config = ConfigLoader.load(Paths.get("astviz.yaml"));
 * NodeColorScheme colors = config.colorScheme();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "astviz.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs and returns
     * {@link VisualizerConfig#defaults()}.
     *
     * @param configPath path to {@code astviz.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static VisualizerConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return VisualizerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return VisualizerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            VisualizerConfig config = YAML_MAPPER.readValue(configPath.toFile(), VisualizerConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return VisualizerConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return VisualizerConfig.defaults();
        }
    }
}
