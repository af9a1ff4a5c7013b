package com.neuralroots.analysis.stage;

/**
 * @param transitSpeedKmh average road speed used to turn distance into transit hours
 */
public record WeatherSettings(double transitSpeedKmh) {

    public static WeatherSettings defaults() {
        return new WeatherSettings(50.0);
    }
}
