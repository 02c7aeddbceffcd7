package com.ryuqq.moderation.adapter.runner.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration loader for the moderation worker.
 *
 * Supports:
 * - Loading from file system or classpath (file system wins)
 * - Loading from an input stream
 * - Validation of every section before the configuration is handed out
 */
public final class ModerationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ModerationConfigLoader.class);

    public static final String DEFAULT_CONFIG_PATH = "moderation.yaml";

    private final Path configPath;
    private final Yaml yaml;

    public ModerationConfigLoader() {
        this(DEFAULT_CONFIG_PATH);
    }

    public ModerationConfigLoader(String configPath) {
        if (configPath == null || configPath.isBlank()) {
            throw new IllegalArgumentException("configPath cannot be null or blank");
        }
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ModerationProperties.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded and validated configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public ModerationProperties load() {
        return validate(loadFromPath());
    }

    private ModerationProperties loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private ModerationProperties loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     *
     * @throws ConfigurationException if parsing or validation fails
     */
    public ModerationProperties loadFromStream(InputStream inputStream) {
        if (inputStream == null) {
            throw new IllegalArgumentException("inputStream cannot be null");
        }
        return validate(parse(inputStream, "stream"));
    }

    private ModerationProperties parse(InputStream inputStream, String source) {
        try {
            ModerationProperties properties = yaml.load(inputStream);
            // empty document
            return properties == null ? createDefault() : properties;
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    private static ModerationProperties validate(ModerationProperties properties) {
        try {
            properties.toWorkerConfig();
            properties.toTopicConfig();
            properties.toCacheConfig();
            properties.toDeadLetterMonitorConfig();
            properties.toModelWeights();
            if (properties.visibilityTimeoutMs() <= 0) {
                throw new IllegalArgumentException(
                    "bus.visibilityTimeoutMs must be positive (current: " + properties.visibilityTimeoutMs() + ")");
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
        return properties;
    }

    /**
     * Creates a default configuration.
     */
    public static ModerationProperties createDefault() {
        return new ModerationProperties();
    }
}
