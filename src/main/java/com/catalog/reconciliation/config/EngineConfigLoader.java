package com.catalog.reconciliation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link EngineConfig} from JSON, either the bundled
 * {@code engine-config.json} resource or an explicit file.
 */
public final class EngineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "engine-config.json";

    private final ObjectMapper objectMapper;

    public EngineConfigLoader() {
        this(new ObjectMapper());
    }

    public EngineConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EngineConfig loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public EngineConfig loadResource(String resource) {
        try (InputStream in = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Engine configuration resource not found: " + resource);
            }
            EngineConfig config = objectMapper.readValue(in, EngineConfig.class);
            log.info("config.loaded source={} orderTags={}", resource, config.orderMapping().keySet());
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read engine configuration: " + resource, e);
        }
    }

    public EngineConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            EngineConfig config = objectMapper.readValue(in, EngineConfig.class);
            log.info("config.loaded source={} orderTags={}", path, config.orderMapping().keySet());
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read engine configuration: " + path, e);
        }
    }
}
