package com.neuralroots.analysis.stage;

import com.neuralroots.analysis.catalog.CropCatalog;
import com.neuralroots.common.datastore.DataStore;
import com.neuralroots.common.exception.DataStoreUnavailableException;
import com.neuralroots.common.model.DemandLevel;
import com.neuralroots.common.model.MarketComparable;
import com.neuralroots.common.model.MarketResult;
import com.neuralroots.common.model.PriceMultipliers;
import com.neuralroots.common.model.PricingStrategy;
import com.neuralroots.common.model.ShipmentRequest;
import com.neuralroots.common.model.StageStatus;
import com.neuralroots.common.model.TimeWindow;
import com.neuralroots.common.model.Urgency;
import com.neuralroots.common.score.Scores;
import com.neuralroots.common.stage.DegradableStage;
import com.neuralroots.common.stage.StageInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Recommends a selling price from comparable listings, freshness, urgency and quantity.
 *
 * <h3>Multipliers (each clamped independently)</h3>
 * <pre>
 *   freshness  score >= 80 → 1.20, >= 60 → 1.10, >= 40 → 0.95, >= 20 → 0.75, else 0.50
 *   demand     majority label HIGH → 1.15, LOW → 0.85, MEDIUM or tie → 1.00
 *   urgency    CRITICAL → 1.15, HIGH → 1.08, MEDIUM → 1.00, LOW → 0.92
 *   quantity   above bulk threshold → 0.95, else 1.00
 * </pre>
 * {@code recommendedPrice = basePrice × Π(multipliers)}, clamped to [0.5, 1.5] × basePrice.
 *
 * <p>With no comparables the base price comes from {@link CropCatalog#defaultPriceFor} and the
 * result is DEGRADED. The stage never throws for missing data.
 */
public class MarketPricer implements DegradableStage<MarketResult> {

    private static final Logger log = LoggerFactory.getLogger(MarketPricer.class);

    private static final double MIN_FRESHNESS_MULT = 0.50;
    private static final double MAX_FRESHNESS_MULT = 1.20;
    private static final double MIN_DEMAND_MULT    = 0.85;
    private static final double MAX_DEMAND_MULT    = 1.15;
    private static final double MIN_URGENCY_MULT   = 0.92;
    private static final double MAX_URGENCY_MULT   = 1.15;
    private static final double BULK_DISCOUNT      = 0.95;

    private static final double MIN_PRICE_FACTOR = 0.5;
    private static final double MAX_PRICE_FACTOR = 1.5;

    private static final double TREND_THRESHOLD = 0.05;  // ±5% between older and newer halves

    private final DataStore dataStore;
    private final Clock clock;
    private final MarketSettings settings;

    public MarketPricer(DataStore dataStore, Clock clock, MarketSettings settings) {
        this.dataStore = dataStore;
        this.clock     = clock;
        this.settings  = settings;
    }

    @Override
    public String stageName() { return "MarketPricer"; }

    @Override
    public MarketResult evaluate(StageInput input) {
        ShipmentRequest request = input.request();
        TimeWindow window = TimeWindow.lookback(clock.instant(), settings.comparableWindow());

        List<MarketComparable> comparables;
        try {
            comparables = dataStore.findComparables(request.cropName(), request.targetMarket(), window);
        } catch (DataStoreUnavailableException e) {
            log.warn("[MarketPricer] Data store unavailable for crop={} market={}: {}",
                     request.cropName(), request.targetMarket(), e.getMessage());
            return price(input, List.of(), "data store unavailable: " + e.getMessage());
        }

        List<MarketComparable> usable = comparables == null ? List.of() : comparables.stream()
            .filter(Objects::nonNull)
            .filter(c -> Double.isFinite(c.price()) && c.price() > 0)
            .toList();

        if (usable.isEmpty()) {
            log.warn("[MarketPricer] No comparable listings for crop={} market={}; using default price table",
                     request.cropName(), request.targetMarket());
            return price(input, List.of(), "no comparable listings for " + request.cropName());
        }
        return price(input, usable, null);
    }

    @Override
    public MarketResult fallback(StageInput input, String reason) {
        return price(input, List.of(), reason);
    }

    private MarketResult price(StageInput input, List<MarketComparable> comparables, String degradedReason) {
        ShipmentRequest request = input.request();
        boolean fromDefaults = comparables.isEmpty();

        double basePrice = fromDefaults
            ? CropCatalog.defaultPriceFor(request.cropName())
            : Scores.round2(comparables.stream().mapToDouble(MarketComparable::price).average().orElse(0.0));

        PriceMultipliers multipliers = new PriceMultipliers(
            freshnessMultiplier(input.freshness().score()),
            demandMultiplier(comparables),
            urgencyMultiplier(request.urgency()),
            quantityMultiplier(request.quantity()));

        double combined = Scores.round(multipliers.combined(), 4);
        double recommended = Scores.round2(Scores.clamp(basePrice * combined,
            basePrice * MIN_PRICE_FACTOR, basePrice * MAX_PRICE_FACTOR));
        PricingStrategy strategy = PricingStrategy.fromMultiplier(combined);

        double minObserved = fromDefaults ? basePrice
            : comparables.stream().mapToDouble(MarketComparable::price).min().orElse(basePrice);
        double maxObserved = fromDefaults ? basePrice
            : comparables.stream().mapToDouble(MarketComparable::price).max().orElse(basePrice);

        StageStatus status = degradedReason == null ? StageStatus.OK : StageStatus.DEGRADED;

        log.info("[MarketPricer] crop={} base={} combined={} price={} strategy={} comparables={} status={}",
                 request.cropName(), basePrice, combined, recommended, strategy, comparables.size(), status);

        return new MarketResult(basePrice, multipliers, combined, recommended, strategy,
            marketTrend(comparables), comparables.size(),
            Scores.round2(minObserved), Scores.round2(maxObserved),
            recommendations(recommended, strategy, multipliers, request, fromDefaults),
            status, degradedReason);
    }

    static double freshnessMultiplier(double score) {
        double m;
        if (score >= 80)      m = 1.20;
        else if (score >= 60) m = 1.10;
        else if (score >= 40) m = 0.95;
        else if (score >= 20) m = 0.75;
        else                  m = 0.50;
        return Scores.clamp(m, MIN_FRESHNESS_MULT, MAX_FRESHNESS_MULT);
    }

    /** Most frequent label wins; a tie between top labels is neutral. */
    static double demandMultiplier(List<MarketComparable> comparables) {
        Map<DemandLevel, Integer> counts = new EnumMap<>(DemandLevel.class);
        for (MarketComparable c : comparables) {
            if (c.demand() != null) counts.merge(c.demand(), 1, Integer::sum);
        }
        if (counts.isEmpty()) return 1.0;

        int top = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        List<DemandLevel> leaders = counts.entrySet().stream()
            .filter(e -> e.getValue() == top)
            .map(Map.Entry::getKey)
            .toList();
        if (leaders.size() != 1) return 1.0;

        double m = switch (leaders.get(0)) {
            case HIGH   -> 1.15;
            case LOW    -> 0.85;
            case MEDIUM -> 1.00;
        };
        return Scores.clamp(m, MIN_DEMAND_MULT, MAX_DEMAND_MULT);
    }

    static double urgencyMultiplier(Urgency urgency) {
        double m = switch (urgency != null ? urgency : Urgency.MEDIUM) {
            case CRITICAL -> 1.15;
            case HIGH     -> 1.08;
            case MEDIUM   -> 1.00;
            case LOW      -> 0.92;
        };
        return Scores.clamp(m, MIN_URGENCY_MULT, MAX_URGENCY_MULT);
    }

    double quantityMultiplier(double quantityKg) {
        return quantityKg > settings.bulkThresholdKg() ? BULK_DISCOUNT : 1.0;
    }

    /** Compares the mean price of the older half of listings against the newer half. */
    static String marketTrend(List<MarketComparable> comparables) {
        List<MarketComparable> dated = comparables.stream()
            .filter(c -> c.timestamp() != null)
            .sorted(Comparator.comparing(MarketComparable::timestamp))
            .toList();
        if (dated.size() < 2) return "stable";

        int mid = dated.size() / 2;
        double older = dated.subList(0, mid).stream().mapToDouble(MarketComparable::price).average().orElse(0);
        double newer = dated.subList(mid, dated.size()).stream().mapToDouble(MarketComparable::price).average().orElse(0);
        if (older <= 0) return "stable";

        double change = (newer - older) / older;
        if (change > TREND_THRESHOLD)  return "up";
        if (change < -TREND_THRESHOLD) return "down";
        return "stable";
    }

    private List<String> recommendations(double price, PricingStrategy strategy, PriceMultipliers m,
                                         ShipmentRequest request, boolean fromDefaults) {
        List<String> lines = new ArrayList<>();
        lines.add(String.format(Locale.ROOT, "Recommended price: Rs. %.2f/kg (%s)", price, strategy));
        if (m.quantity() < 1.0) {
            lines.add(String.format(Locale.ROOT, "Bulk discount applied for quantity above %.0f kg", settings.bulkThresholdKg()));
        }
        if (request.urgency() == Urgency.CRITICAL || request.urgency() == Urgency.HIGH) {
            lines.add("Urgent sale: prioritise buyers who can collect immediately");
        } else if (request.urgency() == Urgency.LOW) {
            lines.add("Low urgency: hold for better offers if storage allows");
        }
        if (fromDefaults) {
            lines.add("Price based on reference table; verify with local market before listing");
        }
        return lines;
    }
}
