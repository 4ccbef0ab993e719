package com.logsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Loads and validates {@link AgentConfig}s from a YAML or JSON source.
 *
 * <p>
 * A file holds either a single agent definition or an {@code agents:} list.
 * JSON files are read by the same parser.
 * </p>
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_AGENT_CONFIG_PATH} (file system
 * path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every definition is converted with {@link AgentDefinition#toConfig()} and
 * agent ids must be unique within one source, so a bad file fails at load
 * time with a {@link ConfigException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AgentConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AgentConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_AGENT_CONFIG_PATH = "AGENT_CONFIG_PATH";

    /** Classpath fallback resource. */
    public static final String DEFAULT_RESOURCE = "agents.yml";

    private AgentConfigLoader() {
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load agents using automatic resolution: {@code AGENT_CONFIG_PATH} if it
     * names an existing file, otherwise {@code agents.yml} on the classpath.
     *
     * @return validated agent configurations
     * @throws ConfigException if any definition is invalid
     */
    public static List<AgentConfig> load() {
        String envPath = System.getenv(ENV_AGENT_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading agents from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading agents from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load agents from a file system path.
     *
     * @param path path to a YAML or JSON file; must not be {@code null}
     * @return validated agent configurations
     * @throws IllegalArgumentException if the file does not exist
     * @throws ConfigException          if reading fails or a definition is
     *                                  invalid
     */
    public static List<AgentConfig> fromFile(String path) {
        Objects.requireNonNull(path, "Agent config path must not be null");
        try {
            return parse(Files.readString(Path.of(path), StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Agent config file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read agent config file: " + path, e);
        }
    }

    /**
     * Load agents from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return validated agent configurations
     * @throws IllegalArgumentException if the resource does not exist
     * @throws ConfigException          if reading fails or a definition is
     *                                  invalid
     */
    public static List<AgentConfig> fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AgentConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Parse agent definitions from YAML or JSON text.
     *
     * @param text document text
     * @return validated agent configurations; empty if the document is empty
     * @throws ConfigException if the document is malformed or a definition is
     *                         invalid
     */
    public static List<AgentConfig> parse(String text) {
        Objects.requireNonNull(text, "Agent config text must not be null");
        List<AgentDefinition> definitions;
        try {
            definitions = readDefinitions(text);
        } catch (YAMLException e) {
            throw new ConfigException("Malformed agent configuration: " + e.getMessage(), e);
        }

        if (definitions.isEmpty()) {
            LOG.warn("No agents defined in configuration");
            return List.of();
        }

        List<AgentConfig> configs = new ArrayList<>(definitions.size());
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < definitions.size(); i++) {
            AgentDefinition def = definitions.get(i);
            if (def == null) {
                errors.add("Agent at index " + i + " is null");
                continue;
            }
            try {
                AgentConfig config = def.toConfig();
                if (!seen.add(config.getId())) {
                    errors.add("Duplicate agentId: '" + config.getId() + "'");
                } else {
                    configs.add(config);
                }
            } catch (ConfigException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigException(
                    "Agent configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }

        LOG.info("Loaded {} agent definition(s)", configs.size());
        return configs;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static List<AgentDefinition> readDefinitions(String text) {
        Object raw = new Yaml(new SafeConstructor(loaderOptions())).load(text);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new ConfigException("Agent configuration must be a mapping, got: "
                    + raw.getClass().getSimpleName());
        }
        if (map.containsKey("agents")) {
            AgentsFile file = new Yaml(new Constructor(AgentsFile.class, loaderOptions())).load(text);
            return file.getAgents();
        }
        AgentDefinition single = new Yaml(new Constructor(AgentDefinition.class, loaderOptions())).load(text);
        return List.of(single);
    }

    private static LoaderOptions loaderOptions() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return options;
    }
}
