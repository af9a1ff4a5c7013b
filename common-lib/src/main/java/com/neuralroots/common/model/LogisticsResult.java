package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Delivery plan for the batch. Cost and hours are always populated from the mode table,
 * even when no carrier is eligible.
 */
public record LogisticsResult(
    @JsonProperty("deliveryMode")         DeliveryMode deliveryMode,
    @JsonProperty("feasible")             boolean feasible,
    @JsonProperty("estimatedCost")        double estimatedCost,
    @JsonProperty("estimatedHours")       double estimatedHours,
    @JsonProperty("dispatchUrgency")      String dispatchUrgency,
    @JsonProperty("temperatureControlled") boolean temperatureControlled,
    @JsonProperty("alternativeModes")     List<DeliveryMode> alternativeModes,
    @JsonProperty("carriers")             List<RankedCarrier> carriers,
    @JsonProperty("feasibilityNotes")     List<String> feasibilityNotes,
    @JsonProperty("status")               StageStatus status,
    @JsonProperty("degradedReason")       String degradedReason
) implements StageResult {
    public LogisticsResult {
        alternativeModes = alternativeModes == null ? List.of() : List.copyOf(alternativeModes);
        carriers         = carriers == null ? List.of() : List.copyOf(carriers);
        feasibilityNotes = feasibilityNotes == null ? List.of() : List.copyOf(feasibilityNotes);
    }
}
