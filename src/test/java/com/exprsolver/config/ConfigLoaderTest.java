package com.exprsolver.config;

import com.exprsolver.exception.ConfigurationException;
import com.exprsolver.export.DivisionStyle;
import com.exprsolver.export.LatexStyle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should load every setting from the solver section")
    void shouldLoadSolverSection() {
        SolverConfig config = ConfigLoader.load("classpath:exprsolver-test.yaml");

        assertEquals(4, config.precision());
        assertEquals(RoundingMode.HALF_UP, config.roundingMode());
        assertEquals(50, config.maxExactExponent());
        assertEquals(LatexStyle.PLAIN, config.latexStyle());
        assertTrue(config.latexMathDelimiters());
        assertEquals(DivisionStyle.FRACTION, config.divisionStyle());
        assertFalse(config.validateTokens());
    }

    @Test
    @DisplayName("Should read settings at the root and default the rest")
    void shouldLoadFlatFile() {
        SolverConfig config = ConfigLoader.load("classpath:exprsolver-flat.yaml");
        SolverConfig defaults = SolverConfig.defaults();

        assertEquals(6, config.precision());
        assertEquals(DivisionStyle.FRACTION, config.divisionStyle());
        assertEquals(defaults.roundingMode(), config.roundingMode());
        assertEquals(defaults.latexStyle(), config.latexStyle());
        assertTrue(config.validateTokens());
    }

    @Test
    @DisplayName("Bundled configuration matches the defaults")
    void bundledConfigMatchesDefaults() {
        assertEquals(SolverConfig.defaults(), ConfigLoader.load("classpath:exprsolver.yaml"));
    }

    @Test
    @DisplayName("Empty file yields the defaults")
    void emptyFileYieldsDefaults() {
        assertEquals(SolverConfig.defaults(), ConfigLoader.parseYaml(yaml("")));
    }

    @Test
    @DisplayName("Should reject a non-positive precision")
    void shouldRejectInvalidPrecision() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:exprsolver-invalid.yaml"));
    }

    @ParameterizedTest
    @DisplayName("Should reject malformed values")
    @ValueSource(strings = {
            "solver:\n  latex-style: fancy\n",
            "solver:\n  division-style: stacked\n",
            "solver:\n  rounding-mode: sideways\n",
            "solver:\n  precision: ten\n",
            "solver:\n  max-exact-exponent: -1\n",
            "solver:\n  max-exact-exponent: 1000000000\n",
            "solver:\n  max-exact-exponent: 5000000000\n",
            "solver:\n  precision: 5000000000\n",
            "solver:\n  precision: 12.5\n",
            "solver:\n  precision: 10001\n",
            "solver: 12\n",
            "- just\n- a list\n"
    })
    void shouldRejectMalformedValues(String text) {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml(text)));
    }

    @Test
    @DisplayName("Should accept the bounds of the numeric settings")
    void shouldAcceptNumericBounds() {
        SolverConfig config = ConfigLoader.parseYaml(yaml(
                "solver:\n  precision: 10000\n  max-exact-exponent: 999999999\n"));

        assertEquals(10000, config.precision());
        assertEquals(999_999_999, config.maxExactExponent());
        assertNotNull(config.arithmetic());
    }

    @Test
    @DisplayName("Should fail fast on a missing file")
    void shouldRejectMissingFile() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:does-not-exist.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("/no/such/dir/exprsolver.yaml"));
    }
}
