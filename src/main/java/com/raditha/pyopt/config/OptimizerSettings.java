package com.raditha.pyopt.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Loads optimizer configuration from optimizer.yml with CLI overrides.
 *
 * Configuration priority: CLI arguments > optimizer.yml > defaults
 */
public class OptimizerSettings {

    private static final Logger logger = LoggerFactory.getLogger(OptimizerSettings.class);

    public static final String DEFAULT_RESOURCE = "optimizer.yml";
    private static final String CONFIG_KEY = "optimizer";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private OptimizerSettings() {
        /* this is only a utility class */
    }

    /**
     * Read optimizer.yml from the classpath. A missing resource yields an
     * empty map so that defaults apply.
     */
    public static Map<String, Object> loadConfigMap() throws IOException {
        try (InputStream in = OptimizerSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
                return Map.of();
            }
            return readMap(YAML.readValue(in, new TypeReference<Map<String, Object>>() {}));
        }
    }

    /**
     * Read a configuration file given on the command line.
     *
     * @throws IOException if the file cannot be read or is not valid YAML
     */
    public static Map<String, Object> loadConfigMap(File file) throws IOException {
        logger.debug("Loading configuration from {}", file);
        return readMap(YAML.readValue(file, new TypeReference<Map<String, Object>>() {}));
    }

    private static Map<String, Object> readMap(Map<String, Object> raw) {
        return raw == null ? Map.of() : raw;
    }

    /**
     * Build the configuration from a loaded YAML document, applying CLI
     * overrides where provided.
     *
     * @param root         the whole YAML document
     * @param thresholdCLI CLI threshold (null = use YAML/default)
     * @param outputCLI    CLI output directory (null = use YAML/default)
     * @param pythonCLI    CLI interpreter (null = use YAML/default)
     * @param noProfileCLI true if profiling was disabled on the command line
     * @return complete optimizer configuration
     */
    public static OptimizerConfig loadConfig(Map<String, Object> root, Long thresholdCLI, String outputCLI,
                                             String pythonCLI, boolean noProfileCLI) {
        Object yamlConfigRaw = root.get(CONFIG_KEY);

        Map<String, Object> config = Map.of();
        if (yamlConfigRaw instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> section = (Map<String, Object>) yamlConfigRaw;
            config = section;
        } else if (yamlConfigRaw != null) {
            throw new IllegalArgumentException("'" + CONFIG_KEY + "' must be a mapping, got: " + yamlConfigRaw);
        }

        long threshold = thresholdCLI != null ? thresholdCLI
                : getLong(config, "high_iteration_threshold", OptimizerConfig.DEFAULT_THRESHOLD);
        String output = outputCLI != null ? outputCLI
                : getString(config, "output_path", OptimizerConfig.DEFAULT_OUTPUT_DIRECTORY);
        String python = pythonCLI != null ? pythonCLI
                : getString(config, "python_executable", OptimizerConfig.DEFAULT_PYTHON);
        int timeout = getInt(config, "profile_timeout_seconds", OptimizerConfig.DEFAULT_TIMEOUT_SECONDS);
        boolean profiling = !noProfileCLI && getBoolean(config, "profiling", true);

        Map<String, Object> rules = getMap(config, "rules");
        boolean flatten = getBoolean(rules, "flatten", true);
        boolean vectorize = getBoolean(rules, "vectorize", true);

        List<String> excludePatterns = getListString(config, "exclude_patterns");
        if (excludePatterns.isEmpty()) {
            excludePatterns = OptimizerConfig.defaultExcludePatterns();
        }

        return new OptimizerConfig(threshold, output, python, timeout, profiling, flatten, vectorize,
                excludePatterns);
    }

    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> nested = (Map<String, Object>) value;
            return nested;
        }
        return Map.of();
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        return defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
