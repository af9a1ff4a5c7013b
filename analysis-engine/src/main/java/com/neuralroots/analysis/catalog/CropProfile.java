package com.neuralroots.analysis.catalog;

/**
 * Storage conditions under which a crop keeps best, plus its nominal shelf life.
 */
public record CropProfile(
    String cropType,
    double tempMin,
    double tempMax,
    double humidityMin,
    double humidityMax,
    int shelfLifeDays
) {
    public double shelfLifeHours() {
        return shelfLifeDays * 24.0;
    }
}
