package com.exprsolver.exception;

/**
 * Reasons a reduction step can fail.
 */
public enum ArithmeticErrorKind {
    DIVISION_BY_ZERO,
    COMPLEX_RESULT,
    OVERFLOW
}
