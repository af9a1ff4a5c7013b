package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the forecast used by the weather stage came from.
 */
public enum ForecastSource {
    FETCHED("fetched"),
    SIMULATED("simulated");

    private final String wireName;

    ForecastSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
