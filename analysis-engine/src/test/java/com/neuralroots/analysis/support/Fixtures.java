package com.neuralroots.analysis.support;

import com.neuralroots.common.model.FreshnessLevel;
import com.neuralroots.common.model.FreshnessResult;
import com.neuralroots.common.model.ShipmentRequest;
import com.neuralroots.common.model.Urgency;
import com.neuralroots.common.stage.StageInput;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/** Shared request and clock builders for stage tests. */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2026-01-18T06:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private Fixtures() {}

    public static ShipmentRequest request(String crop, double temp, double humidity, double ageHours,
                                          double quantity, double distanceKm) {
        return new ShipmentRequest(crop, temp, humidity, ageHours, quantity,
            "Pune, Maharashtra", "Mumbai", distanceKm, Urgency.MEDIUM, null).withDefaults();
    }

    public static ShipmentRequest tomato() {
        return request("tomato", 22.0, 85.0, 8.0, 200.0, 150.0);
    }

    public static FreshnessResult freshness(double score) {
        return new FreshnessResult(score, FreshnessLevel.fromScore(score),
            100.0, 100.0, 100.0, "tomato", List.of());
    }

    public static StageInput input(ShipmentRequest request, double freshnessScore) {
        return new StageInput(request, freshness(freshnessScore));
    }
}
