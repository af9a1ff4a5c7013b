package com.neuralroots.common.model;

/**
 * How quickly the operator needs the batch sold. Feeds the urgency price multiplier.
 */
public enum Urgency {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
