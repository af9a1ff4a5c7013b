package com.neuralroots.common.model;

public enum ActionPriority {
    CRITICAL,
    HIGH,
    IMPORTANT,
    NORMAL
}
