package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FreshnessResult(
    @JsonProperty("score")            double score,
    @JsonProperty("level")            FreshnessLevel level,
    @JsonProperty("temperatureScore") double temperatureScore,
    @JsonProperty("humidityScore")    double humidityScore,
    @JsonProperty("ageScore")         double ageScore,
    @JsonProperty("cropType")         String cropType,
    @JsonProperty("notes")            List<String> notes
) {
    public FreshnessResult {
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
