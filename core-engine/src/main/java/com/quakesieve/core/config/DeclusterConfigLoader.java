package com.quakesieve.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the declustering method, its parameters and the input column names
 * from YAML.
 *
 * <p>
 * A document binds onto {@link DeclusterConfig} by bean property name.
 * Repeated keys and unknown properties are errors, reported together with
 * the source they came from; an empty document means "all defaults". The
 * result has always passed {@link DeclusterConfig#validate()}, so a
 * misconfigured run stops before its catalog is opened.
 * </p>
 *
 * @since 1.0.0
 */
public final class DeclusterConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DeclusterConfigLoader.class);

    /** Names a YAML file to use instead of the bundled defaults. */
    public static final String ENV_CONFIG_PATH = "DECLUSTER_CONFIG_PATH";

    /** Bundled defaults: Gardner-Knopoff formula windows, single claim. */
    public static final String DEFAULT_RESOURCE = "decluster.yml";

    private DeclusterConfigLoader() {
        // utility class — not instantiable
    }

    /**
     * Configuration for a run started without an explicit file: the file
     * named by {@value #ENV_CONFIG_PATH} when it exists, else the bundled
     * {@value #DEFAULT_RESOURCE}.
     *
     * @return validated configuration
     * @throws IllegalStateException if the YAML is malformed or invalid
     */
    public static DeclusterConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading decluster config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading decluster config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Configuration from a YAML file, e.g. the one given to {@code run --config}.
     *
     * @param path the YAML file
     * @return validated configuration
     * @throws IllegalArgumentException if there is no such file
     * @throws IllegalStateException    if the file cannot be read, or its YAML
     *                                  is malformed or invalid
     */
    public static DeclusterConfig fromFile(String path) {
        Objects.requireNonNull(path, "Decluster config path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Decluster config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read decluster config file: " + path, e);
        }
    }

    /**
     * Configuration bundled on the classpath.
     *
     * @param resource resource name, e.g. {@value #DEFAULT_RESOURCE}
     * @return validated configuration
     * @throws IllegalArgumentException if the resource is absent
     * @throws IllegalStateException    if its YAML is malformed or invalid
     */
    public static DeclusterConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Decluster config resource must not be null");
        InputStream is = DeclusterConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Decluster config resource not found on classpath: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read decluster config resource: " + resource, e);
        }
    }

    private static DeclusterConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DeclusterConfig.class, options));

        DeclusterConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed decluster config '" + source + "': " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Decluster config '{}' is empty, using defaults", source);
            config = new DeclusterConfig();
        }
        config.validate();

        LOG.info("Loaded decluster config: method={} claimMode={} scale={}",
                config.getMethod(), config.getClaimMode(), config.getScale());
        return config;
    }
}
