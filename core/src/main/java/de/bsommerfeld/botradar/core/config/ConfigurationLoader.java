package de.bsommerfeld.botradar.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import de.bsommerfeld.botradar.core.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link BotRadarConfig} from YAML. Parsing is strict: unknown keys,
 * explicit nulls for numeric settings, quoted numbers and fractional values for
 * integer counts are rejected instead of being coerced. Keys absent from the
 * file keep their documented defaults.
 *
 * <pre>
 * interval:
 *   interval-threshold-seconds: 30
 *   outlier-threshold-stddev: 2
 * phrases:
 *   repetition-threshold: 5
 * network:
 *   cluster-threshold: 20
 * </pre>
 */
public final class ConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final ObjectMapper MAPPER = YAMLMapper.builder()
            .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .build();

    private ConfigurationLoader() {
    }

    /**
     * Loads and validates the configuration at {@code path}. A missing file is
     * not an error and yields the defaults.
     *
     * @throws ConfigurationException if the file is unreadable, malformed or
     *                                holds an invalid value
     */
    public static BotRadarConfig load(Path path) {
        if (!Files.exists(path)) {
            LOG.info("No configuration at {}, using defaults", path.toAbsolutePath());
            return defaults();
        }
        LOG.info("Loading configuration from: {}", path.toAbsolutePath());
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration file: " + path, e);
        }
    }

    /**
     * Parses and validates YAML content. Blank content yields the defaults.
     */
    public static BotRadarConfig parse(String yaml) {
        if (yaml == null || yaml.isBlank())
            return defaults();

        BotRadarConfig config;
        try {
            config = MAPPER.readValue(yaml, BotRadarConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
        if (config == null)
            return defaults();

        config.validate();
        return config;
    }

    /**
     * @return a validated configuration holding only documented defaults
     */
    public static BotRadarConfig defaults() {
        BotRadarConfig config = new BotRadarConfig();
        config.validate();
        return config;
    }
}
