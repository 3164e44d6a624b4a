package com.document.verification.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Rounding and formatting helpers for percentage scores.
 */
public final class Scores {

    public static final double MIN = 0.0;
    public static final double MAX = 100.0;

    private Scores() {
    }

    /**
     * Rounds to two decimals, half up.
     */
    public static double round2(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Clamps into [0, 100].
     */
    public static double clamp(double value) {
        return Math.max(MIN, Math.min(MAX, value));
    }

    /**
     * Formats a score with exactly two decimals, e.g. {@code "85.50"}.
     */
    public static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", round2(value));
    }
}
