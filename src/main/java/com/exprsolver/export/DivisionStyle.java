package com.exprsolver.export;

/**
 * Rendering of '/' in MathML output.
 */
public enum DivisionStyle {
    /** {@code <mo>÷</mo>} between the operands. */
    INLINE,
    /** {@code <mfrac>} with numerator over denominator. */
    FRACTION
}
