package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Transport tiers ordered from least to most temperature control.
 */
public enum DeliveryMode {
    STANDARD("standard", false),
    REFRIGERATED("refrigerated", true),
    COLD_CHAIN("cold_chain", true);

    private final String wireName;
    private final boolean temperatureControlled;

    DeliveryMode(String wireName, boolean temperatureControlled) {
        this.wireName = wireName;
        this.temperatureControlled = temperatureControlled;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean temperatureControlled() {
        return temperatureControlled;
    }

    /** Next tier up; {@code COLD_CHAIN} is already the top tier. */
    public DeliveryMode escalate() {
        return switch (this) {
            case STANDARD     -> REFRIGERATED;
            case REFRIGERATED -> COLD_CHAIN;
            case COLD_CHAIN   -> COLD_CHAIN;
        };
    }

    /** True when a vehicle offering {@code this} capability can carry a load requiring {@code required}. */
    public boolean satisfies(DeliveryMode required) {
        return this.ordinal() >= required.ordinal();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DeliveryMode fromWire(String value) {
        if (value == null) return null;
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (DeliveryMode mode : values()) {
            if (mode.wireName.equals(normalized)) return mode;
        }
        throw new IllegalArgumentException("Unknown delivery mode: " + value);
    }
}
