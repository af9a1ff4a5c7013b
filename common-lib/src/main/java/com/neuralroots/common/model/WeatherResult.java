package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record WeatherResult(
    @JsonProperty("riskLevel")        RiskLevel riskLevel,
    @JsonProperty("riskScore")        int riskScore,
    @JsonProperty("degradationRate")  double degradationRate,   // % per hour
    @JsonProperty("transitHours")     double transitHours,
    @JsonProperty("estimatedLoss")    double estimatedLoss,
    @JsonProperty("source")           ForecastSource source,
    @JsonProperty("avgTemperature")   double avgTemperature,
    @JsonProperty("avgHumidity")      double avgHumidity,
    @JsonProperty("maxPrecipitation") double maxPrecipitation,
    @JsonProperty("maxWindSpeed")     double maxWindSpeed,
    @JsonProperty("forecast")         List<ForecastPoint> forecast,
    @JsonProperty("recommendations")  List<String> recommendations,
    @JsonProperty("status")           StageStatus status,
    @JsonProperty("degradedReason")   String degradedReason
) implements StageResult {
    public WeatherResult {
        forecast        = forecast == null ? List.of() : List.copyOf(forecast);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
