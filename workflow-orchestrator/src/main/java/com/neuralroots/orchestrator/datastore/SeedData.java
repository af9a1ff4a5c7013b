package com.neuralroots.orchestrator.datastore;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neuralroots.common.model.Carrier;
import com.neuralroots.common.model.DemandLevel;

import java.util.List;

/**
 * JSON shape of the data-store seed file. Listing and forecast times are relative to the
 * moment of each query, so a seed never goes stale.
 */
public record SeedData(
    @JsonProperty("listings")  List<Listing> listings,
    @JsonProperty("carriers")  List<Carrier> carriers,
    @JsonProperty("forecasts") List<Forecast> forecasts
) {
    public SeedData {
        listings  = listings == null ? List.of() : List.copyOf(listings);
        carriers  = carriers == null ? List.of() : List.copyOf(carriers);
        forecasts = forecasts == null ? List.of() : List.copyOf(forecasts);
    }

    public static SeedData empty() {
        return new SeedData(List.of(), List.of(), List.of());
    }

    public record Listing(
        @JsonProperty("crop")     String crop,
        @JsonProperty("market")   String market,
        @JsonProperty("price")    double price,
        @JsonProperty("demand")   DemandLevel demand,
        @JsonProperty("ageHours") double ageHours
    ) {}

    public record Forecast(
        @JsonProperty("location")      String location,
        @JsonProperty("hoursAhead")    double hoursAhead,
        @JsonProperty("temperature")   double temperature,
        @JsonProperty("humidity")      double humidity,
        @JsonProperty("precipitation") double precipitation,
        @JsonProperty("windSpeed")     double windSpeed
    ) {}
}
