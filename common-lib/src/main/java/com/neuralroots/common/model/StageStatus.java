package com.neuralroots.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-stage outcome. {@code DEGRADED} means the stage substituted a documented fallback
 * instead of failing the workflow.
 */
public enum StageStatus {
    OK("ok"),
    DEGRADED("degraded");

    private final String wireName;

    StageStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
