package com.payments.engine.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Helpers for monetary values.
 *
 * Amounts are plain {@link BigDecimal}s: addition, subtraction and negation are exact,
 * and comparisons always go through {@code compareTo} so that 100.0 and 100.00 are equal.
 * Rounding happens only when a value leaves the ledger for display.
 */
public final class Amounts {

    public static final int DISPLAY_SCALE = 4;

    private Amounts() {
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    public static boolean isLessThan(BigDecimal left, BigDecimal right) {
        return left.compareTo(right) < 0;
    }

    public static BigDecimal roundForDisplay(BigDecimal amount) {
        return roundForDisplay(amount, DISPLAY_SCALE);
    }

    /**
     * Round to at most {@code scale} decimal places using banker's rounding.
     * Values that already fit are returned untouched, so 100.0 stays 100.0.
     */
    public static BigDecimal roundForDisplay(BigDecimal amount, int scale) {
        if (amount.scale() <= scale) {
            return amount;
        }
        return amount.setScale(scale, RoundingMode.HALF_EVEN);
    }
}
