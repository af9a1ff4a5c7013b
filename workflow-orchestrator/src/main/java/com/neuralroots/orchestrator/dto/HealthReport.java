package com.neuralroots.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record HealthReport(
    @JsonProperty("status")            String status,
    @JsonProperty("stagesLoaded")      int stagesLoaded,
    @JsonProperty("stages")            List<String> stages,
    @JsonProperty("workflowsExecuted") long workflowsExecuted,
    @JsonProperty("historySize")       int historySize
) {}
