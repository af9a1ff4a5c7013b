package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkflowStatus {
    COMPLETED("completed"),
    COMPLETED_DEGRADED("completed_degraded");

    private final String wireName;

    WorkflowStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
