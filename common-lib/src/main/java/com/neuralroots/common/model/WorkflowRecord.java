package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One completed assessment: the input snapshot, every stage result (real or fallback)
 * and the synthesis built from them.
 */
public record WorkflowRecord(
    @JsonProperty("id")        String id,
    @JsonProperty("input")     ShipmentRequest input,
    @JsonProperty("freshness") FreshnessResult freshness,
    @JsonProperty("market")    MarketResult market,
    @JsonProperty("logistics") LogisticsResult logistics,
    @JsonProperty("weather")   WeatherResult weather,
    @JsonProperty("synthesis") SynthesisResult synthesis,
    @JsonProperty("status")    WorkflowStatus status,
    @JsonProperty("createdAt") Instant createdAt
) {}
