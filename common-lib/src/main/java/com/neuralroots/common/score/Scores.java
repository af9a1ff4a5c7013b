package com.neuralroots.common.score;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Clamping and rounding helpers shared by the stages.
 */
public final class Scores {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 100.0;

    private Scores() {}

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /** Clamps to [0, 100]. NaN collapses to 0. */
    public static double clampScore(double value) {
        if (Double.isNaN(value)) return MIN_SCORE;
        return clamp(value, MIN_SCORE, MAX_SCORE);
    }

    /** Half-up rounding to two decimals. */
    public static double round2(double value) {
        return round(value, 2);
    }

    public static double round(double value, int scale) {
        if (!Double.isFinite(value)) return value;
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
