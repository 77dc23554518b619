package com.exprsolver.config;

import com.exprsolver.evaluator.DecimalArithmetic;
import com.exprsolver.export.DivisionStyle;
import com.exprsolver.export.LatexStyle;

import java.math.RoundingMode;

/**
 * Root configuration for the expression solver.
 *
 * @param precision           Significant digits kept when a step cannot be computed exactly
 * @param roundingMode        Rounding applied at that precision
 * @param maxExactExponent    Largest integer exponent magnitude computed exactly
 * @param latexStyle          Operator spelling in LaTeX output
 * @param latexMathDelimiters Whether LaTeX output is wrapped in $...$
 * @param divisionStyle       Rendering of '/' in MathML output
 * @param validateTokens      Whether token sequences are checked before parsing
 */
public record SolverConfig(
        int precision,
        RoundingMode roundingMode,
        int maxExactExponent,
        LatexStyle latexStyle,
        boolean latexMathDelimiters,
        DivisionStyle divisionStyle,
        boolean validateTokens
) {
    /**
     * Create the default configuration.
     */
    public static SolverConfig defaults() {
        return new SolverConfig(
                DecimalArithmetic.DEFAULT_PRECISION,
                DecimalArithmetic.DEFAULT_ROUNDING,
                DecimalArithmetic.DEFAULT_MAX_EXACT_EXPONENT,
                LatexStyle.SYMBOLIC,
                false,
                DivisionStyle.INLINE,
                true
        );
    }

    /**
     * Build the decimal arithmetic described by this configuration.
     */
    public DecimalArithmetic arithmetic() {
        return new DecimalArithmetic(precision, roundingMode, maxExactExponent);
    }
}
