package com.navgraph.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads NavGraph configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code navgraph.yaml} into {@link AnalysisConfig}.
 * A missing, unreadable or invalid file is not fatal: a warning is logged and
 * {@link AnalysisConfig#defaults()} is returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalysisConfig config = ConfigLoader.load(Paths.get("navgraph.yaml"));
 * EntryPointSet entryPoints = config.analysisOrDefaults().entryPointSet();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code navgraph.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static AnalysisConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return AnalysisConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AnalysisConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            AnalysisConfig config = YAML_MAPPER.readValue(configPath.toFile(), AnalysisConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return AnalysisConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AnalysisConfig.defaults();
        }
    }
}
