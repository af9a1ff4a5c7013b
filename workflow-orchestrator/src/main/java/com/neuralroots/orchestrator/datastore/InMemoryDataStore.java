package com.neuralroots.orchestrator.datastore;

import com.neuralroots.analysis.catalog.CropCatalog;
import com.neuralroots.common.datastore.DataStore;
import com.neuralroots.common.model.Carrier;
import com.neuralroots.common.model.DeliveryMode;
import com.neuralroots.common.model.ForecastPoint;
import com.neuralroots.common.model.MarketComparable;
import com.neuralroots.common.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * {@link DataStore} backed by a seed loaded once at startup. Read-only after construction,
 * so concurrent stage calls need no locking.
 *
 * <p>Locations are compared on their first comma-separated segment, case-insensitively:
 * {@code "Pune, Maharashtra"} matches {@code "pune"}. Carriers without a location are treated
 * as roaming and are offered for every pickup location.
 *
 * <p>Seed listings and forecast points keep their offsets relative to "now"; timestamps are
 * resolved against the clock on every query.
 */
public class InMemoryDataStore implements DataStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDataStore.class);

    private final List<StoredListing> listings;
    private final List<Carrier> carriers;
    private final List<StoredForecast> forecasts;
    private final Clock clock;

    public InMemoryDataStore(SeedData seed, Clock clock) {
        this.clock = clock;
        this.listings = seed.listings().stream()
            .map(l -> new StoredListing(
                CropCatalog.resolveCropType(l.crop()), locationKey(l.market()), l))
            .toList();
        this.carriers = List.copyOf(seed.carriers());
        this.forecasts = seed.forecasts().stream()
            .map(f -> new StoredForecast(locationKey(f.location()), f))
            .toList();
        log.info("[DataStore] loaded listings={} carriers={} forecastPoints={}",
            listings.size(), carriers.size(), forecasts.size());
    }

    @Override
    public List<MarketComparable> findComparables(String crop, String market, TimeWindow window) {
        String cropType = CropCatalog.resolveCropType(crop);
        String marketKey = locationKey(market);
        Instant now = clock.instant();
        return listings.stream()
            .filter(l -> l.cropType().equals(cropType))
            .filter(l -> marketKey == null || marketKey.equals(l.marketKey()))
            .map(l -> l.comparableAt(now))
            .filter(c -> window.contains(c.timestamp()))
            .sorted(Comparator.comparing(MarketComparable::timestamp))
            .toList();
    }

    @Override
    public List<Carrier> findAvailableCarriers(String location, DeliveryMode capabilityFilter) {
        String key = locationKey(location);
        return carriers.stream()
            .filter(c -> capabilityFilter == null || c.supports(capabilityFilter))
            .filter(c -> key == null || c.location() == null || key.equals(locationKey(c.location())))
            .toList();
    }

    @Override
    public List<ForecastPoint> findForecast(String location, TimeWindow window) {
        String key = locationKey(location);
        if (key == null) return List.of();
        Instant now = clock.instant();
        return forecasts.stream()
            .filter(f -> key.equals(f.locationKey()))
            .map(f -> f.pointAt(now))
            .filter(p -> window.contains(p.timestamp()))
            .sorted(Comparator.comparing(ForecastPoint::timestamp))
            .toList();
    }

    static String locationKey(String location) {
        if (location == null || location.isBlank()) return null;
        return location.split(",")[0].trim().toLowerCase(Locale.ROOT);
    }

    private static Duration hours(double hours) {
        return Duration.ofSeconds(Math.round(hours * 3600));
    }

    private record StoredListing(String cropType, String marketKey, SeedData.Listing listing) {
        MarketComparable comparableAt(Instant now) {
            return new MarketComparable(listing.price(), listing.demand(), now.minus(hours(listing.ageHours())));
        }
    }

    private record StoredForecast(String locationKey, SeedData.Forecast forecast) {
        ForecastPoint pointAt(Instant now) {
            return new ForecastPoint(now.plus(hours(forecast.hoursAhead())),
                forecast.temperature(), forecast.humidity(), forecast.precipitation(), forecast.windSpeed());
        }
    }
}
