package com.neuralroots.analysis.stage;

import com.neuralroots.analysis.catalog.CropCatalog;
import com.neuralroots.analysis.catalog.CropProfile;
import com.neuralroots.common.exception.FreshnessComputationException;
import com.neuralroots.common.exception.ValidationException;
import com.neuralroots.common.model.FreshnessLevel;
import com.neuralroots.common.model.FreshnessResult;
import com.neuralroots.common.model.ShipmentRequest;
import com.neuralroots.common.score.Scores;
import com.neuralroots.common.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Scores the current condition of a batch from storage temperature, humidity and age.
 *
 * <h3>Formula</h3>
 * <pre>
 *   factorScore = 100 inside the crop's optimal band,
 *                 100 − 5 × distanceOutsideBand otherwise, floored at 0
 *   ageScore    = 100 − ageHours × 100 / shelfLifeHours, floored at 0
 *   score       = temp × 0.30 + humidity × 0.40 + age × 0.30, clamped [0, 100]
 * </pre>
 *
 * <p>This stage is required: every downstream stage depends on its output, so it throws
 * instead of degrading.
 */
public class FreshnessScorer implements Stage<ShipmentRequest, FreshnessResult> {

    private static final Logger log = LoggerFactory.getLogger(FreshnessScorer.class);

    static final double TEMPERATURE_WEIGHT = 0.30;
    static final double HUMIDITY_WEIGHT    = 0.40;
    static final double AGE_WEIGHT         = 0.30;

    private static final double PENALTY_PER_UNIT = 5.0;

    private static final Map<FreshnessLevel, List<String>> NOTES = Map.of(
        FreshnessLevel.EXCELLENT, List.of(
            "Ready for immediate market distribution",
            "Maintain current storage conditions",
            "Can withstand longer transportation"),
        FreshnessLevel.GOOD, List.of(
            "Suitable for distribution",
            "Monitor storage conditions closely",
            "Prioritize sales within 2-3 days"),
        FreshnessLevel.FAIR, List.of(
            "Use priority shipping",
            "Increase market urgency",
            "Consider discounted pricing",
            "Check for visible deterioration"),
        FreshnessLevel.POOR, List.of(
            "Immediate distribution required",
            "High discount pricing",
            "Risk of waste within 24-48 hours",
            "Local markets preferred"),
        FreshnessLevel.CRITICAL, List.of(
            "Do not distribute - risk of spoilage",
            "Consider compost or waste processing",
            "Investigate storage failure")
    );

    @Override
    public String stageName() { return "FreshnessScorer"; }

    @Override
    public FreshnessResult evaluate(ShipmentRequest request) {
        requireFinite("temperature", request.temperature());
        requireFinite("humidity", request.humidity());
        requireFinite("ageHours", request.ageHours());
        if (request.cropName() == null || request.cropName().isBlank()) {
            throw new ValidationException("cropName", "cropName is required");
        }

        String cropType = CropCatalog.resolveCropType(request.cropName());
        CropProfile profile = CropCatalog.profileFor(request.cropName());

        double tempScore     = bandScore(request.temperature(), profile.tempMin(), profile.tempMax());
        double humidityScore = bandScore(request.humidity(), profile.humidityMin(), profile.humidityMax());
        double ageScore      = ageScore(request.ageHours(), profile.shelfLifeHours());

        double raw = tempScore * TEMPERATURE_WEIGHT
                   + humidityScore * HUMIDITY_WEIGHT
                   + ageScore * AGE_WEIGHT;
        if (!Double.isFinite(raw)) {
            throw new FreshnessComputationException(
                "Non-finite freshness score for crop=" + request.cropName());
        }

        double score = Scores.round2(Scores.clampScore(raw));
        FreshnessLevel level = FreshnessLevel.fromScore(score);

        log.info("[FreshnessScorer] crop={} cropType={} score={} level={} temp={} humidity={} age={}",
                 request.cropName(), cropType, score, level, tempScore, humidityScore, ageScore);

        return new FreshnessResult(score, level,
            Scores.round2(tempScore), Scores.round2(humidityScore), Scores.round2(ageScore),
            cropType, NOTES.get(level));
    }

    static double bandScore(double value, double optimalMin, double optimalMax) {
        if (value >= optimalMin && value <= optimalMax) {
            return 100.0;
        }
        double distance = value < optimalMin ? optimalMin - value : value - optimalMax;
        return Math.max(0.0, 100.0 - distance * PENALTY_PER_UNIT);
    }

    static double ageScore(double ageHours, double shelfLifeHours) {
        if (shelfLifeHours <= 0) {
            throw new FreshnessComputationException("Shelf life must be positive");
        }
        return Math.max(0.0, 100.0 - ageHours * (100.0 / shelfLifeHours));
    }

    private static void requireFinite(String field, Double value) {
        if (value == null || !Double.isFinite(value)) {
            throw new ValidationException(field, field + " must be a finite number");
        }
    }
}
