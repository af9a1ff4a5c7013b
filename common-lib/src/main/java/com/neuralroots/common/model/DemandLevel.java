package com.neuralroots.common.model;

/**
 * Demand label attached to a comparable market listing.
 */
public enum DemandLevel {
    HIGH,
    MEDIUM,
    LOW
}
