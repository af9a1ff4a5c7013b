package com.neuralroots.orchestrator.datastore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.neuralroots.common.model.Carrier;
import com.neuralroots.common.model.DeliveryMode;
import com.neuralroots.common.model.MarketComparable;
import com.neuralroots.common.model.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDataStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-18T06:00:00Z");

    private InMemoryDataStore store;
    private MovableClock clock;

    @BeforeEach
    void loadSeed() throws IOException {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        try (InputStream in = getClass().getResourceAsStream("/seed-data.json")) {
            assertNotNull(in, "seed-data.json must be on the classpath");
            clock = new MovableClock(NOW);
            store = new InMemoryDataStore(mapper.readValue(in, SeedData.class), clock);
        }
    }

    private static List<String> ids(List<Carrier> carriers) {
        return carriers.stream().map(Carrier::id).sorted().toList();
    }

    @Nested
    @DisplayName("findComparables()")
    class Comparables {

        private final TimeWindow lastWeek = TimeWindow.lookback(NOW, Duration.ofDays(7));

        @Test
        @DisplayName("filters by crop and market, oldest first")
        void byMarket() {
            List<MarketComparable> pune = store.findComparables("Tomato", "Pune, Maharashtra", lastWeek);
            assertEquals(3, pune.size());
            assertEquals(36.0, pune.get(0).price());
            assertEquals(38.0, pune.get(2).price());
        }

        @Test
        @DisplayName("no market → every market")
        void anyMarket() {
            assertEquals(4, store.findComparables("tomato", null, lastWeek).size());
        }

        @Test
        @DisplayName("listings outside the window are excluded")
        void window() {
            assertEquals(1, store.findComparables("tomato", "Pune", TimeWindow.lookback(NOW, Duration.ofHours(24))).size());
        }

        @Test
        @DisplayName("crop aliases match the canonical crop")
        void alias() {
            assertEquals(2, store.findComparables("Alphonso", "Mumbai", lastWeek).size());
            assertTrue(store.findComparables("dragonfruit", null, lastWeek).isEmpty());
        }
    }

    @Nested
    @DisplayName("findAvailableCarriers()")
    class Carriers {

        @Test
        @DisplayName("local carriers plus roaming ones that can run the mode")
        void local() {
            assertEquals(List.of("CR-PUN-01", "CR-ROAM-01"),
                ids(store.findAvailableCarriers("Pune", DeliveryMode.REFRIGERATED)));
        }

        @Test
        @DisplayName("no capable carrier at the location → empty")
        void none() {
            assertTrue(store.findAvailableCarriers("Pune", DeliveryMode.COLD_CHAIN).isEmpty());
        }

        @Test
        @DisplayName("no location → every capable carrier")
        void anyLocation() {
            assertEquals(List.of("CR-MUM-01", "CR-NSK-01"),
                ids(store.findAvailableCarriers(null, DeliveryMode.COLD_CHAIN)));
        }

        @Test
        @DisplayName("capabilities are read from wire names")
        void capabilities() {
            Carrier nashik = store.findAvailableCarriers("Nashik", DeliveryMode.COLD_CHAIN).get(0);
            assertEquals(DeliveryMode.COLD_CHAIN, nashik.vehicleType());
            assertTrue(nashik.capabilities().contains(DeliveryMode.REFRIGERATED));
        }
    }

    @Nested
    @DisplayName("findForecast()")
    class Forecast {

        @Test
        @DisplayName("points inside the window for the location")
        void window() {
            assertEquals(4, store.findForecast("Pune, Maharashtra", TimeWindow.ahead(NOW, Duration.ofHours(3))).size());
        }

        @Test
        @DisplayName("unknown location → empty")
        void unknown() {
            assertTrue(store.findForecast("Nashik", TimeWindow.ahead(NOW, Duration.ofHours(3))).isEmpty());
            assertTrue(store.findForecast(null, TimeWindow.ahead(NOW, Duration.ofHours(3))).isEmpty());
        }
    }

    @Nested
    @DisplayName("long uptime")
    class Uptime {

        @Test
        @DisplayName("comparables stay inside the lookback window after eight days")
        void comparables() {
            clock.advance(Duration.ofDays(8));
            Instant later = clock.instant();
            List<MarketComparable> pune = store.findComparables("tomato", "Pune", TimeWindow.lookback(later, Duration.ofDays(7)));
            assertEquals(3, pune.size());
            assertTrue(pune.get(2).timestamp().isAfter(NOW));
        }

        @Test
        @DisplayName("forecast points stay ahead of the clock after a day")
        void forecast() {
            clock.advance(Duration.ofDays(1));
            assertEquals(4, store.findForecast("Pune", TimeWindow.ahead(clock.instant(), Duration.ofHours(3))).size());
        }
    }

    @Test
    @DisplayName("locationKey() keeps the first comma segment, lower-cased")
    void locationKey() {
        assertEquals("pune", InMemoryDataStore.locationKey(" Pune , Maharashtra"));
        assertNull(InMemoryDataStore.locationKey("  "));
    }

    private static final class MovableClock extends Clock {

        private Instant now;

        MovableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
