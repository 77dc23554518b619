package com.exprsolver.ast;

import java.math.BigDecimal;

/**
 * Canonical text form of decimal values: no exponent, no trailing fractional zeros.
 */
public final class DecimalFormatting {

    private DecimalFormatting() {
    }

    public static String toPlainString(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }
}
