package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * A carrier as returned by the data store. {@code location} may be {@code null}
 * when the store has no position for it.
 */
public record Carrier(
    @JsonProperty("id")             String id,
    @JsonProperty("capacityKg")     double capacityKg,
    @JsonProperty("rating")         double rating,          // 0–5
    @JsonProperty("vehicleType")    DeliveryMode vehicleType,
    @JsonProperty("availableHours") double availableHours,
    @JsonProperty("capabilities")   Set<DeliveryMode> capabilities,
    @JsonProperty("location")       String location
) {
    public Carrier {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public boolean supports(DeliveryMode required) {
        if (required == DeliveryMode.STANDARD) return true;
        if (vehicleType != null && vehicleType.satisfies(required)) return true;
        return capabilities.stream().anyMatch(c -> c.satisfies(required));
    }
}
