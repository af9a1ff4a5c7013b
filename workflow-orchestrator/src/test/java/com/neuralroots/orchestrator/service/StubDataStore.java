package com.neuralroots.orchestrator.service;

import com.neuralroots.common.datastore.DataStore;
import com.neuralroots.common.model.Carrier;
import com.neuralroots.common.model.DeliveryMode;
import com.neuralroots.common.model.ForecastPoint;
import com.neuralroots.common.model.MarketComparable;
import com.neuralroots.common.model.TimeWindow;

import java.time.Duration;
import java.util.List;

/**
 * {@link DataStore} with fixed answers and an optional delay or failure on the carrier lookup.
 */
class StubDataStore implements DataStore {

    private final List<MarketComparable> comparables;
    private final List<Carrier> carriers;
    private Duration carrierDelay = Duration.ZERO;
    private RuntimeException carrierFailure;

    StubDataStore(List<MarketComparable> comparables, List<Carrier> carriers) {
        this.comparables = comparables;
        this.carriers = carriers;
    }

    StubDataStore slowCarriers(Duration delay) {
        this.carrierDelay = delay;
        return this;
    }

    StubDataStore failingCarriers(RuntimeException failure) {
        this.carrierFailure = failure;
        return this;
    }

    @Override
    public List<MarketComparable> findComparables(String crop, String market, TimeWindow window) {
        return comparables;
    }

    @Override
    public List<Carrier> findAvailableCarriers(String location, DeliveryMode capabilityFilter) {
        if (carrierFailure != null) throw carrierFailure;
        if (!carrierDelay.isZero()) {
            try {
                Thread.sleep(carrierDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return carriers;
    }

    @Override
    public List<ForecastPoint> findForecast(String location, TimeWindow window) {
        return List.of();
    }
}
