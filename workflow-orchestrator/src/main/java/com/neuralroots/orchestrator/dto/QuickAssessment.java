package com.neuralroots.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neuralroots.common.model.DeliveryMode;
import com.neuralroots.common.model.FreshnessLevel;
import com.neuralroots.common.model.RiskLevel;
import com.neuralroots.common.model.WorkflowRecord;
import com.neuralroots.common.model.WorkflowStatus;

import java.util.List;

/**
 * Summary projection of a {@link WorkflowRecord} for callers that only need the headline numbers.
 */
public record QuickAssessment(
    @JsonProperty("workflowId")       String workflowId,
    @JsonProperty("status")           WorkflowStatus status,
    @JsonProperty("finalScore")       double finalScore,
    @JsonProperty("finalLevel")       FreshnessLevel finalLevel,
    @JsonProperty("recommendedPrice") double recommendedPrice,
    @JsonProperty("deliveryMode")     DeliveryMode deliveryMode,
    @JsonProperty("feasible")         boolean feasible,
    @JsonProperty("weatherRisk")      RiskLevel weatherRisk,
    @JsonProperty("recommendations")  List<String> recommendations
) {
    public static QuickAssessment from(WorkflowRecord record) {
        return new QuickAssessment(
            record.id(),
            record.status(),
            record.synthesis().finalScore(),
            record.synthesis().finalLevel(),
            record.market().recommendedPrice(),
            record.logistics().deliveryMode(),
            record.logistics().feasible(),
            record.weather().riskLevel(),
            record.synthesis().recommendations().stream().limit(5).toList());
    }
}
