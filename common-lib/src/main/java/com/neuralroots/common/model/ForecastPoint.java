package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ForecastPoint(
    @JsonProperty("timestamp")     Instant timestamp,
    @JsonProperty("temperature")   double temperature,    // °C
    @JsonProperty("humidity")      double humidity,       // %
    @JsonProperty("precipitation") double precipitation,  // mm
    @JsonProperty("windSpeed")     double windSpeed       // km/h
) {}
