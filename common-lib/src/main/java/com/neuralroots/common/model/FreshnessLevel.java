package com.neuralroots.common.model;

/**
 * Five-band classification of a 0–100 freshness score.
 *
 * <pre>
 *   score >= 80 → EXCELLENT
 *   score >= 60 → GOOD
 *   score >= 40 → FAIR
 *   score >= 20 → POOR
 *   otherwise   → CRITICAL
 * </pre>
 */
public enum FreshnessLevel {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR,
    CRITICAL;

    public static FreshnessLevel fromScore(double score) {
        if (score >= 80) return EXCELLENT;
        if (score >= 60) return GOOD;
        if (score >= 40) return FAIR;
        if (score >= 20) return POOR;
        return CRITICAL;
    }

    public boolean atRisk() {
        return this == POOR || this == CRITICAL;
    }
}
