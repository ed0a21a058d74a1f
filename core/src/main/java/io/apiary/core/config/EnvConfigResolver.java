package io.apiary.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.apiary.core.error.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link EnvConfig} a connector uses for API keys and proxy settings.
 *
 * <p>
 * The process environment is read first and the settings file is overlaid on top of it, so a
 * key defined in both places takes the file's value. The settings file is a flat YAML mapping:
 *
 * <pre>{@code
 * DOMAINTOOLS_API_KEY: abc123
 * HTTPS_PROXY: http://proxy.internal:3128
 * }</pre>
 *
 * <p>
 * Its location comes from the {@code APIARY_CONFIG} environment variable and defaults to
 * {@code apiary.yaml} in the working directory. A missing file is not an error; a file that
 * cannot be parsed is.
 */
public final class EnvConfigResolver {

    private static final Logger LOG = LoggerFactory.getLogger(EnvConfigResolver.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Environment variable naming the settings file. */
    public static final String CONFIG_PATH_VARIABLE = "APIARY_CONFIG";

    /** Settings file used when {@link #CONFIG_PATH_VARIABLE} is unset. */
    public static final String DEFAULT_CONFIG_FILE = "apiary.yaml";

    private EnvConfigResolver() {
        // utility class
    }

    /**
     * Resolves the configuration from {@link System#getenv()} and the default settings file.
     *
     * @param loadFromFile when {@code false} the result is {@link EnvConfig#EMPTY}
     * @return the merged configuration
     * @throws ConfigurationException if the settings file exists but cannot be parsed
     */
    public static EnvConfig resolve(boolean loadFromFile) {
        if (!loadFromFile) {
            return EnvConfig.EMPTY;
        }
        Map<String, String> environment = System.getenv();
        return resolve(resolveConfigPath(environment), environment);
    }

    /**
     * Merges {@code environment} with the settings file at {@code configPath}.
     *
     * @param configPath  settings file; may not exist
     * @param environment environment variables to start from
     * @return the merged configuration
     * @throws ConfigurationException if the settings file exists but cannot be parsed
     */
    public static EnvConfig resolve(Path configPath, Map<String, String> environment) {
        Map<String, String> merged = new LinkedHashMap<>(environment);
        merged.putAll(readSettingsFile(configPath));
        return new EnvConfig(merged);
    }

    /** Returns the settings file location for the given environment. */
    public static Path resolveConfigPath(Map<String, String> environment) {
        String configured = environment.get(CONFIG_PATH_VARIABLE);
        if (configured != null && !configured.trim().isEmpty()) {
            return Path.of(configured.trim());
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static Map<String, String> readSettingsFile(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            LOG.debug("No settings file at {}", configPath);
            return Map.of();
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse settings file: " + configPath, e);
        }

        if (root == null || root.isMissingNode() || root.isNull()) {
            return Map.of();
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Settings file must contain a key/value mapping: " + configPath);
        }

        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isValueNode() && !value.isNull()) {
                values.put(field.getKey(), value.asText());
            } else {
                LOG.debug("Ignoring non-scalar settings entry '{}' in {}", field.getKey(), configPath);
            }
        }
        LOG.debug("Loaded {} settings from {}", values.size(), configPath);
        return values;
    }
}
