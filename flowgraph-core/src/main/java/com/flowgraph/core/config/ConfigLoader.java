package com.flowgraph.core.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Utility for loading flowgraph configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code flowgraph.yaml} into {@link FlowGraphConfig} records.
 * If the config file is missing or invalid, {@link #load(Path)} returns
 * {@link FlowGraphConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FlowGraphConfig config = ConfigLoader.load(Path.of("flowgraph.yaml"));
 * DiagramSettings settings = config.toDiagramSettings();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /** Default config file name, looked up in the working directory */
    public static final String DEFAULT_FILE_NAME = "flowgraph.yaml";

    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link FlowGraphConfig#defaults()}.
     *
     * @param configPath path to {@code flowgraph.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static FlowGraphConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return FlowGraphConfig.defaults();
        }

        try {
            return loadStrict(configPath);
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return FlowGraphConfig.defaults();
        }
    }

    /**
     * Loads configuration from a YAML file, failing on any problem.
     *
     * <p>An empty file yields the defaults.
     *
     * @param configPath path to {@code flowgraph.yaml}
     * @return loaded configuration
     * @throws IOException if the file is missing, unreadable or not valid configuration
     */
    public static FlowGraphConfig loadStrict(Path configPath) throws IOException {
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new NoSuchFileException(configPath.toString(), null, "not a readable file");
        }

        log.debug("Loading configuration from: {}", configPath);
        if (Files.size(configPath) == 0) {
            return FlowGraphConfig.defaults();
        }
        FlowGraphConfig config = YAML_MAPPER.readValue(configPath.toFile(), FlowGraphConfig.class);
        log.info("Loaded configuration from: {}", configPath);
        return config == null ? FlowGraphConfig.defaults() : config;
    }
}
