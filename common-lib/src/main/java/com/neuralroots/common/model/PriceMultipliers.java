package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The four independently clamped multipliers applied to the base price.
 */
public record PriceMultipliers(
    @JsonProperty("freshness") double freshness,   // [0.50, 1.20]
    @JsonProperty("demand")    double demand,      // [0.85, 1.15]
    @JsonProperty("urgency")   double urgency,     // [0.92, 1.15]
    @JsonProperty("quantity")  double quantity     // [0.95, 1.00]
) {
    public double combined() {
        return freshness * demand * urgency * quantity;
    }
}
