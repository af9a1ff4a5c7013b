package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable description of the batch being assessed.
 *
 * <p>Numeric fields are boxed so that an absent value can be told apart from zero during
 * validation. {@link #withDefaults()} fills the optional fields before the stages run.
 */
public record ShipmentRequest(
    @JsonProperty("cropName")     String cropName,
    @JsonProperty("temperature")  Double temperature,   // °C
    @JsonProperty("humidity")     Double humidity,      // %
    @JsonProperty("ageHours")     Double ageHours,
    @JsonProperty("quantity")     Double quantity,      // kg
    @JsonProperty("origin")       String origin,
    @JsonProperty("destination")  String destination,
    @JsonProperty("distanceKm")   Double distanceKm,
    @JsonProperty("urgency")      Urgency urgency,
    @JsonProperty("targetMarket") String targetMarket
) {
    public static final double DEFAULT_QUANTITY_KG = 10.0;
    public static final double DEFAULT_DISTANCE_KM = 100.0;
    public static final String DEFAULT_LOCATION    = "default";

    public ShipmentRequest withDefaults() {
        return new ShipmentRequest(
            cropName != null ? cropName.trim() : null,
            temperature,
            humidity,
            ageHours != null ? ageHours : 0.0,
            quantity != null ? quantity : DEFAULT_QUANTITY_KG,
            isBlank(origin) ? DEFAULT_LOCATION : origin.trim(),
            isBlank(destination) ? "market" : destination.trim(),
            distanceKm != null ? distanceKm : DEFAULT_DISTANCE_KM,
            urgency != null ? urgency : Urgency.MEDIUM,
            isBlank(targetMarket) ? null : targetMarket.trim());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
