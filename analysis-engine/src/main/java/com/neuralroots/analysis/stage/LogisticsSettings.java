package com.neuralroots.analysis.stage;

/**
 * @param longHaulKm          distances strictly above this escalate the delivery mode one tier
 * @param deliveryWindowHours transit longer than this makes the plan infeasible
 * @param maxRankedCarriers   length of the ranked carrier list
 */
public record LogisticsSettings(double longHaulKm, double deliveryWindowHours, int maxRankedCarriers) {

    public static LogisticsSettings defaults() {
        return new LogisticsSettings(500.0, 24.0, 5);
    }
}
