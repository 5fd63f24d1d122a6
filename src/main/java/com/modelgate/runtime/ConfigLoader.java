package com.modelgate.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    public static AppConfig load(Path configPath) throws IOException {
        if (configPath == null) {
            throw new ConfigException("--config is required");
        }
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigException("Config file not found: " + configPath.toAbsolutePath().normalize());
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
        AppConfig config;
        try {
            config = mapper.readValue(configPath.toFile(), AppConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Malformed config " + configPath + ": " + e.getOriginalMessage(), e);
        }
        if (config == null) {
            throw new ConfigException("Config file is empty: " + configPath);
        }
        config.validate();
        log.debug("Loaded config from {} experiment={} registry={}",
                configPath,
                config.getTracking().getExperimentName(),
                config.getRegistry().getUri());
        return config;
    }
}
