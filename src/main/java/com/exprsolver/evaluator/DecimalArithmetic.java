package com.exprsolver.evaluator;

import com.exprsolver.ast.Operator;
import com.exprsolver.exception.ArithmeticErrorKind;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Decimal operations used for every reduction step.
 * <p>
 * Rounding rule:
 * <ul>
 *   <li>+, - and * are exact</li>
 *   <li>/ is exact when the quotient terminates, otherwise rounded to {@code precision} significant digits</li>
 *   <li>^ with an integer exponent whose magnitude is at most {@code maxExactExponent} is exact
 *       (negative exponents divide as above); larger integer exponents are rounded, and so is any
 *       power whose exact digits would exceed {@link #MAX_DIGITS}</li>
 *   <li>^ with a fractional exponent is computed in double precision and rounded to at most
 *       {@link #DOUBLE_DIGITS} significant digits, even when {@code precision} is larger</li>
 * </ul>
 * Rounding is applied to the value produced by each step, so intermediate values shown in a
 * derivation are the ones used by later steps.
 * <p>
 * A result with more than {@link #MAX_DIGITS} digits before or after the decimal point is an
 * {@link ArithmeticErrorKind#OVERFLOW}.
 */
public final class DecimalArithmetic {

    public static final int DEFAULT_PRECISION = 10;
    public static final RoundingMode DEFAULT_ROUNDING = RoundingMode.HALF_EVEN;
    public static final int DEFAULT_MAX_EXACT_EXPONENT = 999;

    /** Largest exponent magnitude {@link BigDecimal#pow(int, MathContext)} accepts. */
    public static final int MAX_EXPONENT = 999_999_999;

    /** Largest number of integer or fraction digits a step may produce. */
    public static final int MAX_DIGITS = 10_000;

    /** Significant decimal digits a double carries reliably. */
    public static final int DOUBLE_DIGITS = 15;

    private final MathContext mathContext;
    private final MathContext doubleContext;
    private final int maxExactExponent;

    public DecimalArithmetic(int precision, RoundingMode roundingMode, int maxExactExponent) {
        if (precision <= 0 || precision > MAX_DIGITS) {
            throw new IllegalArgumentException("precision out of range: " + precision);
        }
        if (maxExactExponent < 0 || maxExactExponent > MAX_EXPONENT) {
            throw new IllegalArgumentException("maxExactExponent out of range: " + maxExactExponent);
        }
        this.mathContext = new MathContext(precision, roundingMode);
        this.doubleContext = new MathContext(Math.min(precision, DOUBLE_DIGITS), roundingMode);
        this.maxExactExponent = maxExactExponent;
    }

    public static DecimalArithmetic defaults() {
        return new DecimalArithmetic(DEFAULT_PRECISION, DEFAULT_ROUNDING, DEFAULT_MAX_EXACT_EXPONENT);
    }

    public MathContext mathContext() {
        return mathContext;
    }

    /**
     * Apply a binary operator.
     *
     * @throws UndefinedResultException when the result is not a finite real number or has more
     *                                  than {@link #MAX_DIGITS} integer or fraction digits
     */
    BigDecimal apply(Operator operator, BigDecimal left, BigDecimal right) {
        BigDecimal result = switch (operator) {
            case ADD -> left.add(right);
            case SUBTRACT -> left.subtract(right);
            case MULTIPLY -> left.multiply(right);
            case DIVIDE -> divide(left, right);
            case POWER -> power(left, right);
        };
        return checkMagnitude(result);
    }

    BigDecimal negate(BigDecimal value) {
        return value.negate();
    }

    private BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        if (divisor.signum() == 0) {
            throw new UndefinedResultException(ArithmeticErrorKind.DIVISION_BY_ZERO);
        }
        try {
            return dividend.divide(divisor);
        } catch (ArithmeticException nonTerminating) {
            return dividend.divide(divisor, mathContext);
        }
    }

    private BigDecimal power(BigDecimal base, BigDecimal exponent) {
        if (base.signum() == 0 && exponent.signum() < 0) {
            throw new UndefinedResultException(ArithmeticErrorKind.DIVISION_BY_ZERO);
        }
        if (isInteger(exponent)) {
            return integerPower(base, exponent);
        }
        if (base.signum() < 0) {
            throw new UndefinedResultException(ArithmeticErrorKind.COMPLEX_RESULT);
        }
        double result = Math.pow(base.doubleValue(), exponent.doubleValue());
        if (Double.isInfinite(result) || Double.isNaN(result)) {
            throw new UndefinedResultException(ArithmeticErrorKind.OVERFLOW);
        }
        return BigDecimal.valueOf(result).round(doubleContext);
    }

    private BigDecimal integerPower(BigDecimal base, BigDecimal exponent) {
        if (exponent.abs().compareTo(BigDecimal.valueOf(MAX_EXPONENT)) > 0) {
            throw new UndefinedResultException(ArithmeticErrorKind.OVERFLOW);
        }
        int n = exponent.intValueExact();
        // digits of the exact power grow with the base's digits times the exponent
        long exactDigits = (long) base.precision() * Math.abs(n);
        try {
            if (Math.abs(n) <= maxExactExponent && exactDigits <= MAX_DIGITS) {
                BigDecimal magnitude = base.pow(Math.abs(n));
                return n < 0 ? divide(BigDecimal.ONE, magnitude) : magnitude;
            }
            return base.pow(n, mathContext);
        } catch (ArithmeticException e) {
            // scale out of int range
            throw new UndefinedResultException(ArithmeticErrorKind.OVERFLOW, e);
        }
    }

    private static BigDecimal checkMagnitude(BigDecimal value) {
        if (value.signum() == 0) {
            return value;
        }
        BigDecimal stripped = value.stripTrailingZeros();
        long integerDigits = (long) stripped.precision() - stripped.scale();
        if (integerDigits > MAX_DIGITS || stripped.scale() > MAX_DIGITS) {
            throw new UndefinedResultException(ArithmeticErrorKind.OVERFLOW);
        }
        return value;
    }

    private static boolean isInteger(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }
}
