package com.visionsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the alarm rules and algorithm catalog from YAML.
 *
 * <p>
 * {@link #load()} prefers the file named by {@value #ENV_RULES_PATH} and
 * falls back to {@value #DEFAULT_RESOURCE} on the classpath. Every entry
 * point validates the parsed {@link RulesConfig}, so a bad rule or algorithm
 * stops startup with one message listing all problems.
 * </p>
 *
 * <p>
 * Unknown keys and duplicate keys are rejected by the YAML constructor.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RulesLoader.class);

    public static final String ENV_RULES_PATH = "RULES_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "sentinel-rules.yml";

    private RulesLoader() {
    }

    /**
     * @return the configuration from {@value #ENV_RULES_PATH} when it names an
     *         existing file, otherwise from {@value #DEFAULT_RESOURCE}
     */
    public static RulesConfig load() {
        String configured = System.getenv(ENV_RULES_PATH);
        if (configured != null && !configured.isBlank()) {
            Path path = Path.of(configured.trim());
            if (Files.isRegularFile(path)) {
                return fromFile(path);
            }
            LOG.warn("{}={} is not a readable file, using classpath {}",
                    ENV_RULES_PATH, configured, DEFAULT_RESOURCE);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static RulesConfig fromFile(String path) {
        Objects.requireNonNull(path, "path must not be null");
        return fromFile(Path.of(path));
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read, is not
     *                                  valid YAML or fails validation
     */
    public static RulesConfig fromFile(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Rules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read rules file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if no such resource is on the classpath
     * @throws IllegalStateException    if the resource is not valid YAML or
     *                                  fails validation
     */
    public static RulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        InputStream in = RulesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Rules resource not found on classpath: " + resource);
        }
        try (in) {
            return read(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read rules resource " + resource + ": " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static RulesConfig read(InputStream in, String origin) {
        RulesConfig config;
        try {
            config = yaml().load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed rules configuration in " + origin + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("{} holds no rules or algorithms", origin);
            config = new RulesConfig();
        }
        config.validate();

        if (config.getRules().isEmpty()) {
            LOG.warn("No alarm rules defined in {}; detections will never raise alarms", origin);
        }
        LOG.info("Rules loaded from {}: {} rule(s), {} algorithm(s)",
                origin, config.getRules().size(), config.getAlgorithms().size());
        return config;
    }

    private static Yaml yaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new Constructor(RulesConfig.class, options));
    }
}
