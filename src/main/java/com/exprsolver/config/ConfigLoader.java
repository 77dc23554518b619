package com.exprsolver.config;

import com.exprsolver.evaluator.DecimalArithmetic;
import com.exprsolver.exception.ConfigurationException;
import com.exprsolver.export.DivisionStyle;
import com.exprsolver.export.LatexStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Loads solver configuration from YAML files.
 * <p>
 * Example:
 * <pre>
 * solver:
 *   precision: 12
 *   rounding-mode: HALF_UP
 *   latex-style: PLAIN
 *   division-style: FRACTION
 * </pre>
 * Missing keys keep their {@link SolverConfig#defaults() default}.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static SolverConfig load(String path) {
        log.info("Loading solver configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static SolverConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        if (loaded == null) {
            log.warn("Configuration file is empty, using defaults");
            return SolverConfig.defaults();
        }
        if (!(loaded instanceof Map<?, ?>)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // Settings can be at root or under 'solver' key
        Object section = root.getOrDefault("solver", root);
        if (!(section instanceof Map<?, ?>)) {
            throw new ConfigurationException("'solver' must be a mapping");
        }
        Map<String, Object> solver = (Map<String, Object>) section;

        SolverConfig defaults = SolverConfig.defaults();
        int precision = getInt(solver, "precision", defaults.precision());
        if (precision <= 0 || precision > DecimalArithmetic.MAX_DIGITS) {
            throw new ConfigurationException("precision must be between 1 and "
                    + DecimalArithmetic.MAX_DIGITS + ", was " + precision);
        }
        int maxExactExponent = getInt(solver, "max-exact-exponent", defaults.maxExactExponent());
        if (maxExactExponent < 0 || maxExactExponent > DecimalArithmetic.MAX_EXPONENT) {
            throw new ConfigurationException("max-exact-exponent must be between 0 and "
                    + DecimalArithmetic.MAX_EXPONENT + ", was " + maxExactExponent);
        }

        SolverConfig config = new SolverConfig(
                precision,
                getEnum(solver, "rounding-mode", RoundingMode.class, defaults.roundingMode()),
                maxExactExponent,
                getEnum(solver, "latex-style", LatexStyle.class, defaults.latexStyle()),
                getBoolean(solver, "latex-math-delimiters", defaults.latexMathDelimiters()),
                getEnum(solver, "division-style", DivisionStyle.class, defaults.divisionStyle()),
                getBoolean(solver, "validate-tokens", defaults.validateTokens())
        );

        log.info("Loaded solver configuration: precision={}, rounding={}, latex={}, division={}",
                config.precision(), config.roundingMode(), config.latexStyle(), config.divisionStyle());
        return config;
    }

    // Helper methods

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Integer) return (Integer) value;
        if (value instanceof Number) {
            throw new ConfigurationException("'" + key + "' must be an integer in int range, was '" + value + "'");
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, was '" + value + "'", e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static <E extends Enum<E>> E getEnum(Map<String, Object> map, String key, Class<E> type, E defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        String name = value.toString().trim().toUpperCase().replace("-", "_");
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown " + key + " '" + value + "'", e);
        }
    }
}
