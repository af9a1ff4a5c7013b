package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SynthesisResult(
    @JsonProperty("finalScore")        double finalScore,
    @JsonProperty("finalLevel")        FreshnessLevel finalLevel,
    @JsonProperty("baseScore")         double baseScore,
    @JsonProperty("weatherLoss")       double weatherLoss,
    @JsonProperty("preservationBonus") double preservationBonus,
    @JsonProperty("actionItems")       List<ActionItem> actionItems,
    @JsonProperty("recommendations")   List<String> recommendations
) {
    public SynthesisResult {
        actionItems     = actionItems == null ? List.of() : List.copyOf(actionItems);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
