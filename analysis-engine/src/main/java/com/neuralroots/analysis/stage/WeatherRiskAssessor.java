package com.neuralroots.analysis.stage;

import com.neuralroots.analysis.catalog.CropCatalog;
import com.neuralroots.analysis.weather.ForecastSimulator;
import com.neuralroots.common.datastore.DataStore;
import com.neuralroots.common.exception.DataStoreUnavailableException;
import com.neuralroots.common.model.ForecastPoint;
import com.neuralroots.common.model.ForecastSource;
import com.neuralroots.common.model.RiskLevel;
import com.neuralroots.common.model.ShipmentRequest;
import com.neuralroots.common.model.StageStatus;
import com.neuralroots.common.model.TimeWindow;
import com.neuralroots.common.model.WeatherResult;
import com.neuralroots.common.score.Scores;
import com.neuralroots.common.stage.DegradableStage;
import com.neuralroots.common.stage.StageInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rates weather risk over the transit window and converts it into a freshness degradation rate.
 *
 * <h3>Risk score</h3>
 * <pre>
 *   avg temperature  < 5 or > 35 → +40,  < 10 or > 30 → +20
 *   avg humidity     < 60 or > 95 → +25
 *   any precipitation            → +20
 *   max wind         > 40 km/h   → +15
 *   >= 70 CRITICAL, >= 50 HIGH, >= 30 MEDIUM, else LOW
 * </pre>
 * {@code degradationRate = baseRate[risk] × cropSensitivity}, with base rates 0.5 / 1.0 / 2.0 / 4.0 %/h.
 *
 * <p>When the store has no forecast the stage uses {@link ForecastSimulator}; when the store is
 * unavailable it does the same and reports DEGRADED.
 */
public class WeatherRiskAssessor implements DegradableStage<WeatherResult> {

    private static final Logger log = LoggerFactory.getLogger(WeatherRiskAssessor.class);

    private static final int EXCERPT_POINTS = 6;

    private static final Map<RiskLevel, Double> BASE_RATE = Map.of(
        RiskLevel.LOW,      0.5,
        RiskLevel.MEDIUM,   1.0,
        RiskLevel.HIGH,     2.0,
        RiskLevel.CRITICAL, 4.0
    );

    private final DataStore dataStore;
    private final Clock clock;
    private final WeatherSettings settings;

    public WeatherRiskAssessor(DataStore dataStore, Clock clock, WeatherSettings settings) {
        this.dataStore = dataStore;
        this.clock     = clock;
        this.settings  = settings;
    }

    @Override
    public String stageName() { return "WeatherRiskAssessor"; }

    @Override
    public WeatherResult evaluate(StageInput input) {
        ShipmentRequest request = input.request();
        double transitHours = transitHours(request.distanceKm());
        long windowMinutes = Math.max(60L, (long) Math.ceil(transitHours * 60.0));
        TimeWindow window = TimeWindow.ahead(clock.instant(), Duration.ofMinutes(windowMinutes));

        List<ForecastPoint> forecast;
        try {
            forecast = dataStore.findForecast(request.origin(), window);
        } catch (DataStoreUnavailableException e) {
            log.warn("[WeatherRiskAssessor] Data store unavailable for location={}: {}",
                     request.origin(), e.getMessage());
            return assess(request, simulate(request, transitHours), ForecastSource.SIMULATED,
                transitHours, "data store unavailable: " + e.getMessage());
        }

        List<ForecastPoint> usable = forecast == null ? List.of() : forecast.stream()
            .filter(Objects::nonNull)
            .limit(ForecastSimulator.MAX_POINTS)
            .toList();
        if (usable.isEmpty()) {
            log.info("[WeatherRiskAssessor] No forecast for location={}; simulating", request.origin());
            return assess(request, simulate(request, transitHours), ForecastSource.SIMULATED, transitHours, null);
        }
        return assess(request, usable, ForecastSource.FETCHED, transitHours, null);
    }

    @Override
    public WeatherResult fallback(StageInput input, String reason) {
        ShipmentRequest request = input.request();
        double transitHours = transitHours(request.distanceKm());
        return assess(request, simulate(request, transitHours), ForecastSource.SIMULATED, transitHours, reason);
    }

    double transitHours(double distanceKm) {
        return Scores.round2(distanceKm / settings.transitSpeedKmh());
    }

    private List<ForecastPoint> simulate(ShipmentRequest request, double transitHours) {
        return ForecastSimulator.simulate(request.origin(), LocalDate.now(clock), transitHours);
    }

    private WeatherResult assess(ShipmentRequest request, List<ForecastPoint> forecast, ForecastSource source,
                                 double transitHours, String degradedReason) {
        double avgTemp     = forecast.stream().mapToDouble(ForecastPoint::temperature).average().orElse(0.0);
        double avgHumidity = forecast.stream().mapToDouble(ForecastPoint::humidity).average().orElse(0.0);
        double maxPrecip   = forecast.stream().mapToDouble(ForecastPoint::precipitation).max().orElse(0.0);
        double maxWind     = forecast.stream().mapToDouble(ForecastPoint::windSpeed).max().orElse(0.0);

        int riskScore = riskScore(avgTemp, avgHumidity, maxPrecip, maxWind);
        RiskLevel risk = RiskLevel.fromScore(riskScore);
        double rate = Scores.round2(BASE_RATE.get(risk) * CropCatalog.sensitivityFor(request.cropName()));
        double loss = Scores.round2(rate * transitHours);
        StageStatus status = degradedReason == null ? StageStatus.OK : StageStatus.DEGRADED;

        log.info("[WeatherRiskAssessor] location={} source={} riskScore={} risk={} rate={} transitHours={} status={}",
                 request.origin(), source, riskScore, risk, rate, transitHours, status);

        return new WeatherResult(risk, riskScore, rate, transitHours, loss, source,
            Scores.round(avgTemp, 1), Scores.round(avgHumidity, 1),
            Scores.round(maxPrecip, 1), Scores.round(maxWind, 1),
            forecast.subList(0, Math.min(EXCERPT_POINTS, forecast.size())),
            recommendations(risk, avgTemp, maxPrecip),
            status, degradedReason);
    }

    static int riskScore(double avgTemp, double avgHumidity, double maxPrecipitation, double maxWind) {
        int score = 0;
        if (avgTemp < 5 || avgTemp > 35)        score += 40;
        else if (avgTemp < 10 || avgTemp > 30)  score += 20;

        if (avgHumidity < 60 || avgHumidity > 95) score += 25;
        if (maxPrecipitation > 0)                 score += 20;
        if (maxWind > 40)                         score += 15;
        return score;
    }

    private static List<String> recommendations(RiskLevel risk, double avgTemp, double maxPrecipitation) {
        List<String> lines = new ArrayList<>();
        if (risk == RiskLevel.CRITICAL) {
            lines.add("URGENT: Use insulated/refrigerated transport");
            lines.add("Consider delaying shipment");
            lines.add("Monitor temperature closely");
        } else if (risk == RiskLevel.HIGH) {
            lines.add("Refrigerated transport recommended");
            lines.add("Increase monitoring frequency");
            lines.add("Plan for possible delays");
        }
        if (avgTemp > 30) {
            lines.add("Temperature high - keep in shade/cool environment");
        } else if (avgTemp < 10) {
            lines.add("Temperature low - consider insulation");
        }
        if (maxPrecipitation > 0) {
            lines.add("Waterproof packaging required");
        }
        if (lines.isEmpty()) {
            lines.add("Weather conditions favorable for transport");
        }
        return lines;
    }
}
