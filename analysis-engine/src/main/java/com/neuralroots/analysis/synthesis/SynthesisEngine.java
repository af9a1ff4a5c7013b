package com.neuralroots.analysis.synthesis;

import com.neuralroots.common.model.ActionItem;
import com.neuralroots.common.model.ActionPriority;
import com.neuralroots.common.model.DeliveryMode;
import com.neuralroots.common.model.FreshnessLevel;
import com.neuralroots.common.model.FreshnessResult;
import com.neuralroots.common.model.LogisticsResult;
import com.neuralroots.common.model.MarketResult;
import com.neuralroots.common.model.PricingStrategy;
import com.neuralroots.common.model.RiskLevel;
import com.neuralroots.common.model.StageResult;
import com.neuralroots.common.model.SynthesisResult;
import com.neuralroots.common.model.WeatherResult;
import com.neuralroots.common.score.Scores;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Folds the four stage results into the final score, level, action items and recommendations.
 *
 * <pre>
 *   finalScore = clamp(freshness.score − weather.estimatedLoss + preservationBonus[mode], 0, 100)
 *   preservationBonus: cold_chain 5, refrigerated 3, standard 0
 * </pre>
 *
 * <h3>Action rules, evaluated in this order</h3>
 * <ol>
 *   <li>weather risk HIGH or CRITICAL</li>
 *   <li>logistics infeasible</li>
 *   <li>extreme pricing strategy (PREMIUM_PRICING or CLEARANCE_PRICING)</li>
 *   <li>routine confirmations, then one verification item per degraded stage</li>
 * </ol>
 * Output order follows the rule list only.
 *
 * <p>Stateless and thread-safe.
 */
public class SynthesisEngine {

    private static final Map<DeliveryMode, Double> PRESERVATION_BONUS = Map.of(
        DeliveryMode.COLD_CHAIN,   5.0,
        DeliveryMode.REFRIGERATED, 3.0,
        DeliveryMode.STANDARD,     0.0
    );

    public SynthesisResult synthesize(FreshnessResult freshness, MarketResult market,
                                      LogisticsResult logistics, WeatherResult weather) {
        double baseScore = freshness.score();
        double weatherLoss = weather.estimatedLoss();
        double bonus = PRESERVATION_BONUS.getOrDefault(logistics.deliveryMode(), 0.0);

        double finalScore = Scores.round2(Scores.clampScore(baseScore - weatherLoss + bonus));
        FreshnessLevel finalLevel = FreshnessLevel.fromScore(finalScore);

        return new SynthesisResult(finalScore, finalLevel, baseScore, weatherLoss, bonus,
            actionItems(finalLevel, market, logistics, weather),
            recommendations(finalScore, finalLevel, freshness, market, logistics, weather));
    }

    List<ActionItem> actionItems(FreshnessLevel finalLevel, MarketResult market,
                                 LogisticsResult logistics, WeatherResult weather) {
        List<ActionItem> items = new ArrayList<>();

        // 1. weather
        if (weather.riskLevel().elevated()) {
            ActionPriority priority = weather.riskLevel() == RiskLevel.CRITICAL
                ? ActionPriority.CRITICAL : ActionPriority.HIGH;
            items.add(new ActionItem(priority, "Mitigate weather exposure",
                String.format(Locale.ROOT, "%s weather risk: ~%.1f%% freshness loss over %.1fh transit",
                    weather.riskLevel(), weather.estimatedLoss(), weather.transitHours())));
        }

        // 2. logistics
        if (!logistics.feasible()) {
            List<String> notes = logistics.feasibilityNotes();
            items.add(new ActionItem(ActionPriority.HIGH, "Address logistics constraints",
                notes.isEmpty() ? "No feasible delivery plan"
                                : String.join("; ", notes.subList(0, Math.min(2, notes.size())))));
        }

        // 3. pricing
        if (market.strategy().extreme()) {
            String action = market.strategy() == PricingStrategy.PREMIUM_PRICING
                ? "Confirm premium buyers" : "Arrange clearance sale";
            items.add(new ActionItem(ActionPriority.IMPORTANT, action,
                String.format(Locale.ROOT, "Rs. %.2f/kg (%s, %.2fx base)",
                    market.recommendedPrice(), market.strategy(), market.combinedMultiplier())));
        }

        // 4. routine
        items.add(new ActionItem(routinePriority(finalLevel), "Confirm delivery arrangements",
            String.format(Locale.ROOT, "Recommended mode: %s, est. Rs. %.2f, %.1fh",
                logistics.deliveryMode().wireName(), logistics.estimatedCost(), logistics.estimatedHours())));
        items.add(new ActionItem(ActionPriority.IMPORTANT, "Set market price",
            String.format(Locale.ROOT, "Rs. %.2f/kg based on %s", market.recommendedPrice(), market.strategy())));
        addVerification(items, "market", market);
        addVerification(items, "logistics", logistics);
        addVerification(items, "weather", weather);

        return items;
    }

    private static void addVerification(List<ActionItem> items, String stage, StageResult result) {
        if (result.degraded()) {
            items.add(new ActionItem(ActionPriority.NORMAL, "Verify " + stage + " data",
                result.degradedReason() != null ? result.degradedReason() : "stage used fallback values"));
        }
    }

    private static ActionPriority routinePriority(FreshnessLevel level) {
        if (level.atRisk()) return ActionPriority.CRITICAL;
        if (level == FreshnessLevel.FAIR) return ActionPriority.HIGH;
        return ActionPriority.NORMAL;
    }

    /** Concatenated from every stage, first occurrence kept. */
    List<String> recommendations(double finalScore, FreshnessLevel finalLevel, FreshnessResult freshness,
                                 MarketResult market, LogisticsResult logistics, WeatherResult weather) {
        Set<String> lines = new LinkedHashSet<>();
        if (weather.estimatedLoss() > 0) {
            lines.add(String.format(Locale.ROOT, "Weather will degrade freshness by ~%.1f%% during transport",
                weather.estimatedLoss()));
        }
        lines.add(String.format(Locale.ROOT, "Current status: %s (score: %.0f/100)", finalLevel, finalScore));
        lines.addAll(freshness.notes());
        lines.addAll(market.recommendations());
        lines.add("Use " + logistics.deliveryMode().wireName().toUpperCase(Locale.ROOT) + " delivery");
        lines.addAll(logistics.feasibilityNotes());
        lines.addAll(weather.recommendations());

        if (finalLevel.atRisk()) {
            lines.add("URGENT: Initiate immediate distribution to prevent total loss");
        } else if (finalLevel == FreshnessLevel.FAIR) {
            lines.add("HIGH PRIORITY: Schedule delivery within 24 hours");
        }
        return new ArrayList<>(lines);
    }
}
