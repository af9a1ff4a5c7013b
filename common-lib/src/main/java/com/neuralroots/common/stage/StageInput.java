package com.neuralroots.common.stage;

import com.neuralroots.common.model.FreshnessResult;
import com.neuralroots.common.model.ShipmentRequest;

/**
 * Input to the fan-out stages: the validated request plus the freshness result they all depend on.
 */
public record StageInput(ShipmentRequest request, FreshnessResult freshness) {}
