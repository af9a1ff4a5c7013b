package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A recent listing of the same crop near the target market.
 */
public record MarketComparable(
    @JsonProperty("price")     double price,
    @JsonProperty("demand")    DemandLevel demand,
    @JsonProperty("timestamp") Instant timestamp
) {}
