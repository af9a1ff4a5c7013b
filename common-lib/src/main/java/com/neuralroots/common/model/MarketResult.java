package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MarketResult(
    @JsonProperty("basePrice")          double basePrice,
    @JsonProperty("multipliers")        PriceMultipliers multipliers,
    @JsonProperty("combinedMultiplier") double combinedMultiplier,
    @JsonProperty("recommendedPrice")   double recommendedPrice,
    @JsonProperty("strategy")           PricingStrategy strategy,
    @JsonProperty("marketTrend")        String marketTrend,
    @JsonProperty("comparableCount")    int comparableCount,
    @JsonProperty("minObservedPrice")   double minObservedPrice,
    @JsonProperty("maxObservedPrice")   double maxObservedPrice,
    @JsonProperty("recommendations")    List<String> recommendations,
    @JsonProperty("status")             StageStatus status,
    @JsonProperty("degradedReason")     String degradedReason
) implements StageResult {
    public MarketResult {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
