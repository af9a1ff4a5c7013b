package com.neuralroots.analysis.stage;

import com.neuralroots.common.datastore.DataStore;
import com.neuralroots.common.exception.DataStoreUnavailableException;
import com.neuralroots.common.model.Carrier;
import com.neuralroots.common.model.DeliveryMode;
import com.neuralroots.common.model.FreshnessLevel;
import com.neuralroots.common.model.FreshnessResult;
import com.neuralroots.common.model.LogisticsResult;
import com.neuralroots.common.model.RankedCarrier;
import com.neuralroots.common.model.ShipmentRequest;
import com.neuralroots.common.model.StageStatus;
import com.neuralroots.common.score.Scores;
import com.neuralroots.common.stage.DegradableStage;
import com.neuralroots.common.stage.StageInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Picks a delivery mode for the batch, estimates cost and transit time, and ranks eligible carriers.
 *
 * <h3>Mode selection</h3>
 * <pre>
 *   POOR, CRITICAL → cold_chain
 *   FAIR, GOOD     → refrigerated
 *   EXCELLENT      → standard
 *   distance above the long-haul threshold escalates one tier
 * </pre>
 *
 * <h3>Carrier suitability (0–100)</h3>
 * <pre>
 *   capacity match      30   min(30, capacity / quantity × 10)
 *   rating              20   rating / 5 × 20
 *   vehicle suitability 20   exact mode 20, higher tier 15, otherwise 10
 *   availability        10   min(availableHours, 12) / 12 × 10
 *   proximity           10   same pickup location 10, else 0
 * </pre>
 * When either side has no location the first four factors are rescaled to 100.
 * Ranking is by suitability desc, then rating desc, then carrier id asc.
 */
public class LogisticsSelector implements DegradableStage<LogisticsResult> {

    private static final Logger log = LoggerFactory.getLogger(LogisticsSelector.class);

    private static final double CAPACITY_WEIGHT     = 30.0;
    private static final double RATING_WEIGHT       = 20.0;
    private static final double VEHICLE_WEIGHT      = 20.0;
    private static final double AVAILABILITY_WEIGHT = 10.0;
    private static final double PROXIMITY_WEIGHT    = 10.0;

    private static final double MAX_RATING              = 5.0;
    private static final double FULL_AVAILABILITY_HOURS = 12.0;

    private static final double CRITICAL_SCORE          = 20.0;
    private static final double CRITICAL_MAX_HOURS      = 6.0;

    private static final Map<DeliveryMode, ModeProfile> MODE_TABLE = new EnumMap<>(Map.of(
        DeliveryMode.STANDARD,     new ModeProfile(3.0, 1.0, 80.0),
        DeliveryMode.REFRIGERATED, new ModeProfile(3.5, 1.3, 70.0),
        DeliveryMode.COLD_CHAIN,   new ModeProfile(4.0, 1.5, 60.0)
    ));

    private static final Comparator<ScoredCarrier> RANKING = Comparator
        .comparingDouble(ScoredCarrier::suitability).reversed()
        .thenComparing(Comparator.comparingDouble((ScoredCarrier s) -> s.carrier().rating()).reversed())
        .thenComparing(s -> s.carrier().id(), Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final DataStore dataStore;
    private final LogisticsSettings settings;

    public LogisticsSelector(DataStore dataStore, LogisticsSettings settings) {
        this.dataStore = dataStore;
        this.settings  = settings;
    }

    @Override
    public String stageName() { return "LogisticsSelector"; }

    @Override
    public LogisticsResult evaluate(StageInput input) {
        ShipmentRequest request = input.request();
        DeliveryMode mode = selectMode(input.freshness().level(), request.distanceKm());
        String pickup = ShipmentRequest.DEFAULT_LOCATION.equals(request.origin()) ? null : request.origin();

        List<Carrier> available;
        try {
            available = dataStore.findAvailableCarriers(pickup, mode);
        } catch (DataStoreUnavailableException e) {
            log.warn("[LogisticsSelector] Data store unavailable for location={} mode={}: {}",
                     pickup, mode, e.getMessage());
            return build(input, mode, List.of(), "data store unavailable: " + e.getMessage());
        }

        List<RankedCarrier> ranked = rank(available == null ? List.of() : available, request, mode);
        return build(input, mode, ranked, null);
    }

    @Override
    public LogisticsResult fallback(StageInput input, String reason) {
        DeliveryMode mode = selectMode(input.freshness().level(), input.request().distanceKm());
        return build(input, mode, List.of(), reason);
    }

    DeliveryMode selectMode(FreshnessLevel level, double distanceKm) {
        DeliveryMode mode = switch (level) {
            case CRITICAL, POOR -> DeliveryMode.COLD_CHAIN;
            case FAIR, GOOD     -> DeliveryMode.REFRIGERATED;
            case EXCELLENT      -> DeliveryMode.STANDARD;
        };
        return distanceKm > settings.longHaulKm() ? mode.escalate() : mode;
    }

    static double estimateCost(DeliveryMode mode, double distanceKm) {
        ModeProfile p = MODE_TABLE.get(mode);
        return Scores.round2(p.ratePerKm() * distanceKm * p.costMultiplier());
    }

    static double estimateHours(DeliveryMode mode, double distanceKm) {
        return Scores.round2(distanceKm / MODE_TABLE.get(mode).avgSpeedKmh());
    }

    List<RankedCarrier> rank(List<Carrier> carriers, ShipmentRequest request, DeliveryMode mode) {
        double quantity = request.quantity();
        List<ScoredCarrier> scored = carriers.stream()
            .filter(Objects::nonNull)
            .filter(c -> c.capacityKg() >= quantity && c.supports(mode))
            .map(c -> new ScoredCarrier(c, suitability(c, quantity, mode, request.origin())))
            .sorted(RANKING)
            .limit(settings.maxRankedCarriers())
            .toList();

        List<RankedCarrier> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            ScoredCarrier s = scored.get(i);
            ranked.add(new RankedCarrier(i + 1, s.carrier().id(), s.carrier().vehicleType(),
                s.carrier().rating(), s.suitability()));
        }
        return ranked;
    }

    static double suitability(Carrier carrier, double quantity, DeliveryMode mode, String origin) {
        double capacity     = Math.min(CAPACITY_WEIGHT, (carrier.capacityKg() / quantity) * 10.0);
        double rating       = Scores.clamp(carrier.rating(), 0.0, MAX_RATING) / MAX_RATING * RATING_WEIGHT;
        double vehicle      = vehicleSuitability(carrier.vehicleType(), mode);
        double availability = Scores.clamp(carrier.availableHours(), 0.0, FULL_AVAILABILITY_HOURS)
                              / FULL_AVAILABILITY_HOURS * AVAILABILITY_WEIGHT;
        double base = capacity + rating + vehicle + availability;

        String carrierKey = locationKey(carrier.location());
        String originKey  = ShipmentRequest.DEFAULT_LOCATION.equals(origin) ? null : locationKey(origin);
        double total;
        if (carrierKey == null || originKey == null) {
            total = base * 100.0 / (100.0 - PROXIMITY_WEIGHT);
        } else {
            total = base + (carrierKey.equals(originKey) ? PROXIMITY_WEIGHT : 0.0);
        }
        return Scores.round2(Scores.clampScore(total));
    }

    static double vehicleSuitability(DeliveryMode vehicle, DeliveryMode required) {
        if (vehicle == required) return VEHICLE_WEIGHT;
        if (vehicle != null && vehicle.satisfies(required)) return 15.0;
        return 10.0;
    }

    /** "Pune, Maharashtra" and "pune" compare equal. */
    static String locationKey(String location) {
        if (location == null || location.isBlank()) return null;
        int comma = location.indexOf(',');
        String head = comma >= 0 ? location.substring(0, comma) : location;
        return head.trim().toLowerCase(Locale.ROOT);
    }

    private LogisticsResult build(StageInput input, DeliveryMode mode, List<RankedCarrier> ranked,
                                  String degradedReason) {
        ShipmentRequest request = input.request();
        FreshnessResult freshness = input.freshness();
        double distance = request.distanceKm();
        double cost  = estimateCost(mode, distance);
        double hours = estimateHours(mode, distance);

        List<String> notes = new ArrayList<>();
        if (ranked.isEmpty()) {
            notes.add(degradedReason != null
                ? "Carrier availability unknown (" + degradedReason + ")"
                : String.format(Locale.ROOT, "No available carriers for %s delivery of %.0f kg", mode.wireName(), request.quantity()));
        }
        if (hours > settings.deliveryWindowHours()) {
            notes.add(String.format(Locale.ROOT, "Estimated delivery time %.1fh exceeds %.0fh window", hours, settings.deliveryWindowHours()));
        }
        if (freshness.score() < CRITICAL_SCORE && hours > CRITICAL_MAX_HOURS) {
            notes.add("Freshness critical - delivery must be within 6 hours");
        }
        boolean feasible = notes.isEmpty();
        StageStatus status = degradedReason == null ? StageStatus.OK : StageStatus.DEGRADED;

        log.info("[LogisticsSelector] mode={} distanceKm={} cost={} hours={} carriers={} feasible={} status={}",
                 mode, distance, cost, hours, ranked.size(), feasible, status);

        return new LogisticsResult(mode, feasible, cost, hours,
            dispatchUrgency(freshness.level()), mode.temperatureControlled(),
            alternatives(mode), ranked, notes, status, degradedReason);
    }

    private static String dispatchUrgency(FreshnessLevel level) {
        return switch (level) {
            case POOR, CRITICAL -> "IMMEDIATE";
            case FAIR           -> "HIGH";
            default             -> "NORMAL";
        };
    }

    private static List<DeliveryMode> alternatives(DeliveryMode mode) {
        return switch (mode) {
            case COLD_CHAIN   -> List.of(DeliveryMode.REFRIGERATED, DeliveryMode.STANDARD);
            case REFRIGERATED -> List.of(DeliveryMode.COLD_CHAIN, DeliveryMode.STANDARD);
            case STANDARD     -> List.of(DeliveryMode.REFRIGERATED, DeliveryMode.COLD_CHAIN);
        };
    }

    private record ModeProfile(double ratePerKm, double costMultiplier, double avgSpeedKmh) {}

    private record ScoredCarrier(Carrier carrier, double suitability) {}
}
