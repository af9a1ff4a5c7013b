package com.neuralroots.analysis.stage;

import java.time.Duration;

/**
 * @param bulkThresholdKg  quantities strictly above this get the bulk discount
 * @param comparableWindow how far back comparable listings are considered
 */
public record MarketSettings(double bulkThresholdKg, Duration comparableWindow) {

    public static MarketSettings defaults() {
        return new MarketSettings(500.0, Duration.ofDays(7));
    }
}
