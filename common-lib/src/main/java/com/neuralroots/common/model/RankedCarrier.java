package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RankedCarrier(
    @JsonProperty("rank")        int rank,
    @JsonProperty("carrierId")   String carrierId,
    @JsonProperty("vehicleType") DeliveryMode vehicleType,
    @JsonProperty("rating")      double rating,
    @JsonProperty("suitability") double suitability
) {}
