package com.patternsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the detection engine settings from YAML.
 *
 * <p>
 * {@link #load()} picks the first available source: the file named by
 * {@value #ENV_CONFIG_PATH}, then {@value #DEFAULT_RESOURCE} on the classpath,
 * then the built-in defaults. Keys missing from a document keep their default
 * value and an empty document is the same as no document. Whatever the source,
 * the returned {@link EngineConfig} has passed {@link EngineConfig#validate()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);

    /** Names a YAML file that takes precedence over the bundled settings. */
    public static final String ENV_CONFIG_PATH = "ENGINE_CONFIG_PATH";

    /** Bundled settings shipped with the engine. */
    public static final String DEFAULT_RESOURCE = "engine.yml";

    private EngineConfigLoader() {
        // utility class — not instantiable
    }

    /**
     * Resolve settings from the environment, the bundled resource or the defaults.
     *
     * @return validated configuration
     * @throws IllegalStateException if the chosen document is malformed or invalid
     */
    public static EngineConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank()) {
            if (Files.isRegularFile(Path.of(envPath))) {
                return fromFile(envPath);
            }
            LOG.warn("{} points at {} which is not a readable file – ignoring it", ENV_CONFIG_PATH, envPath);
        }
        if (EngineConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No engine settings supplied, running with built-in defaults");
        return validated(new EngineConfig(), "built-in defaults");
    }

    /**
     * @param path file system location of the YAML document
     * @return validated configuration
     * @throws IllegalArgumentException if nothing exists at {@code path}
     * @throws IllegalStateException    if the document is malformed or invalid
     */
    public static EngineConfig fromFile(String path) {
        Objects.requireNonNull(path, "path");
        Path file = Path.of(path);
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toAbsolutePath().toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Engine settings file " + path + " not found", e);
        } catch (IOException e) {
            throw new UncheckedIOException("I/O error while reading engine settings from " + path, e);
        }
    }

    /**
     * @param resource name of a resource visible to this class's loader
     * @return validated configuration
     * @throws IllegalArgumentException if the resource cannot be located
     * @throws IllegalStateException    if the document is malformed or invalid
     */
    public static EngineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource");
        InputStream in = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Engine settings resource " + resource + " not found on the classpath");
        }
        try (in) {
            return read(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new UncheckedIOException("I/O error while reading engine settings from classpath:" + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static EngineConfig read(InputStream in, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        EngineConfig config;
        try {
            config = new Yaml(new Constructor(EngineConfig.class, options)).load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed engine settings in " + origin + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Engine settings in {} are empty – using defaults", origin);
            config = new EngineConfig();
        }
        return validated(config, origin);
    }

    private static EngineConfig validated(EngineConfig config, String origin) {
        config.validate();
        LOG.info("Engine settings from {}: {}", origin, config);
        return config;
    }
}
