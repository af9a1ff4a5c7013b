package com.neuralroots.common.model;

/**
 * Weather risk band for the transit window.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel fromScore(int riskScore) {
        if (riskScore >= 70) return CRITICAL;
        if (riskScore >= 50) return HIGH;
        if (riskScore >= 30) return MEDIUM;
        return LOW;
    }

    public boolean elevated() {
        return this == HIGH || this == CRITICAL;
    }
}
