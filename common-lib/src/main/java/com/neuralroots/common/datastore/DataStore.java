package com.neuralroots.common.datastore;

import com.neuralroots.common.model.Carrier;
import com.neuralroots.common.model.DeliveryMode;
import com.neuralroots.common.model.ForecastPoint;
import com.neuralroots.common.model.MarketComparable;
import com.neuralroots.common.model.TimeWindow;

import java.util.List;

/**
 * Read-only collaborator the fan-out stages query.
 *
 * <p>Every method returns an empty list when there is simply no data and throws
 * {@link com.neuralroots.common.exception.DataStoreUnavailableException} when the store cannot
 * answer. Callers handle the two differently. The core never retries or caches these calls.
 */
public interface DataStore {

    List<MarketComparable> findComparables(String crop, String market, TimeWindow window);

    /**
     * @param location         pickup location, or {@code null} for any
     * @param capabilityFilter mode the carrier must be able to run
     */
    List<Carrier> findAvailableCarriers(String location, DeliveryMode capabilityFilter);

    List<ForecastPoint> findForecast(String location, TimeWindow window);
}
