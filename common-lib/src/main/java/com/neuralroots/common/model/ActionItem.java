package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ActionItem(
    @JsonProperty("priority") ActionPriority priority,
    @JsonProperty("action")   String action,
    @JsonProperty("detail")   String detail
) {}
