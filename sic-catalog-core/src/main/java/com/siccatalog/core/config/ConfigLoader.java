package com.siccatalog.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads catalog configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code siccatalog.yaml} into {@link CatalogConfig}.
 * If the file is missing, unreadable or invalid, returns {@link CatalogConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CatalogConfig config = ConfigLoader.load(Paths.get("siccatalog.yaml"));
 * Path structure = Paths.get(config.sources().structure());
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code siccatalog.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static CatalogConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return CatalogConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CatalogConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            CatalogConfig config = YAML_MAPPER.readValue(configPath.toFile(), CatalogConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return CatalogConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CatalogConfig.defaults();
        }
    }
}
