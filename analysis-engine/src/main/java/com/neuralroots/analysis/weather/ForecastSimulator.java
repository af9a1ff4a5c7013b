package com.neuralroots.analysis.weather;

import com.neuralroots.common.model.ForecastPoint;
import com.neuralroots.common.score.Scores;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Generates an hourly forecast when the data store has none for the transit window.
 *
 * <p>The generator is seeded from (location, calendar day), so the same location on the same day
 * always yields the same forecast. Points are anchored at the start of that day (UTC), not at
 * the time of the call. A longer transit only appends points: the first {@code n} points of a
 * forecast do not depend on how many were requested.
 */
public final class ForecastSimulator {

    public static final int MAX_POINTS = 24;

    private static final double PRECIPITATION_CHANCE = 0.15;

    private ForecastSimulator() {}

    public static List<ForecastPoint> simulate(String location, LocalDate day, double transitHours) {
        Random random = new Random(seedFor(location, day));
        int points = pointCount(transitHours);
        Instant start = day.atStartOfDay(ZoneOffset.UTC).toInstant();

        double baseTemp     = 22.0 + random.nextDouble() * 10.0;   // 22–32 °C
        double baseHumidity = 55.0 + random.nextDouble() * 30.0;   // 55–85 %

        List<ForecastPoint> forecast = new ArrayList<>(points);
        for (int i = 0; i < points; i++) {
            double diurnal = i < 6 ? -4.0 : (i < 12 ? 3.0 : (i < 18 ? 1.0 : -2.0));
            double temperature = baseTemp + diurnal + random.nextGaussian();
            double humidity = Scores.clamp(
                baseHumidity + (i % 4 == 0 ? 5.0 : -3.0) + random.nextGaussian() * 2.0, 30.0, 100.0);
            double precipitation = random.nextDouble() < PRECIPITATION_CHANCE
                ? 1.0 + random.nextDouble() * 7.0 : 0.0;
            double wind = 5.0 + random.nextDouble() * 15.0;

            forecast.add(new ForecastPoint(
                start.plus(Duration.ofHours(i)),
                Scores.round(temperature, 1),
                Scores.round(humidity, 1),
                Scores.round(precipitation, 1),
                Scores.round(wind, 1)));
        }
        return forecast;
    }

    /** Stable across JVMs: built from {@link String#hashCode()} semantics and the epoch day. */
    static long seedFor(String location, LocalDate day) {
        String key = location == null ? "" : location.trim().toLowerCase(Locale.ROOT);
        long h = 1125899906842597L;
        for (int i = 0; i < key.length(); i++) {
            h = 31 * h + key.charAt(i);
        }
        return h ^ (day.toEpochDay() * 0x9E3779B97F4A7C15L);
    }

    static int pointCount(double transitHours) {
        int hours = (int) Math.ceil(transitHours);
        return Math.max(1, Math.min(MAX_POINTS, hours));
    }
}
