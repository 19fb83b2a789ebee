package com.msst.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads endpoint configuration files. A missing file falls back to built-in defaults.
 */
@Service
public class EndpointConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(EndpointConfigLoader.class);

    private final ObjectMapper yaml = new YAMLMapper();

    /**
     * Loads {@code path}, or the defaults when it does not exist.
     *
     * @throws ConfigurationException when the file exists but cannot be read or parsed
     */
    public EndpointConfig load(Path path) {
        if (path == null || !Files.exists(path)) {
            log.warn("Configuration file {} not found, using defaults", path);
            return EndpointConfig.defaults();
        }
        try {
            Map<String, Object> values = yaml.readValue(path.toFile(), new TypeReference<Map<String, Object>>() {});
            log.info("Loaded endpoint configuration from {}", path);
            return new EndpointConfig(values != null ? values : Map.of());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + path + ": " + e.getMessage(), e);
        }
    }
}
