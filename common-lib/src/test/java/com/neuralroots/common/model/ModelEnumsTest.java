package com.neuralroots.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModelEnumsTest {

    @Nested
    @DisplayName("FreshnessLevel.fromScore()")
    class FreshnessLevelTests {

        @Test
        @DisplayName("band boundaries are inclusive on the lower edge")
        void boundaries() {
            assertEquals(FreshnessLevel.EXCELLENT, FreshnessLevel.fromScore(80.0));
            assertEquals(FreshnessLevel.GOOD,      FreshnessLevel.fromScore(79.99));
            assertEquals(FreshnessLevel.GOOD,      FreshnessLevel.fromScore(60.0));
            assertEquals(FreshnessLevel.FAIR,      FreshnessLevel.fromScore(40.0));
            assertEquals(FreshnessLevel.POOR,      FreshnessLevel.fromScore(20.0));
            assertEquals(FreshnessLevel.CRITICAL,  FreshnessLevel.fromScore(19.99));
        }

        @Test
        @DisplayName("only POOR and CRITICAL are at risk")
        void atRisk() {
            assertTrue(FreshnessLevel.POOR.atRisk());
            assertTrue(FreshnessLevel.CRITICAL.atRisk());
            assertFalse(FreshnessLevel.FAIR.atRisk());
        }
    }

    @Nested
    @DisplayName("RiskLevel.fromScore()")
    class RiskLevelTests {

        @Test
        @DisplayName("70/50/30 thresholds")
        void thresholds() {
            assertEquals(RiskLevel.CRITICAL, RiskLevel.fromScore(70));
            assertEquals(RiskLevel.HIGH,     RiskLevel.fromScore(69));
            assertEquals(RiskLevel.HIGH,     RiskLevel.fromScore(50));
            assertEquals(RiskLevel.MEDIUM,   RiskLevel.fromScore(30));
            assertEquals(RiskLevel.LOW,      RiskLevel.fromScore(29));
        }
    }

    @Nested
    @DisplayName("PricingStrategy.fromMultiplier()")
    class PricingStrategyTests {

        @Test
        @DisplayName("maps combined multiplier to strategy label")
        void mapping() {
            assertEquals(PricingStrategy.PREMIUM_PRICING,      PricingStrategy.fromMultiplier(1.38));
            assertEquals(PricingStrategy.ABOVE_MARKET,         PricingStrategy.fromMultiplier(1.10));
            assertEquals(PricingStrategy.MARKET_RATE_PLUS,     PricingStrategy.fromMultiplier(1.0));
            assertEquals(PricingStrategy.MARKET_RATE,          PricingStrategy.fromMultiplier(0.95));
            assertEquals(PricingStrategy.COMPETITIVE_DISCOUNT, PricingStrategy.fromMultiplier(0.75));
            assertEquals(PricingStrategy.CLEARANCE_PRICING,    PricingStrategy.fromMultiplier(0.40));
        }

        @Test
        @DisplayName("premium and clearance are extreme")
        void extreme() {
            assertTrue(PricingStrategy.PREMIUM_PRICING.extreme());
            assertTrue(PricingStrategy.CLEARANCE_PRICING.extreme());
            assertFalse(PricingStrategy.MARKET_RATE.extreme());
        }
    }

    @Nested
    @DisplayName("DeliveryMode")
    class DeliveryModeTests {

        @Test
        @DisplayName("escalate() moves one tier up and saturates at cold_chain")
        void escalate() {
            assertEquals(DeliveryMode.REFRIGERATED, DeliveryMode.STANDARD.escalate());
            assertEquals(DeliveryMode.COLD_CHAIN,   DeliveryMode.REFRIGERATED.escalate());
            assertEquals(DeliveryMode.COLD_CHAIN,   DeliveryMode.COLD_CHAIN.escalate());
        }

        @Test
        @DisplayName("fromWire() accepts wire names case-insensitively and with hyphens")
        void fromWire() {
            assertEquals(DeliveryMode.COLD_CHAIN, DeliveryMode.fromWire("Cold-Chain"));
            assertEquals(DeliveryMode.STANDARD,   DeliveryMode.fromWire("standard"));
            assertThrows(IllegalArgumentException.class, () -> DeliveryMode.fromWire("drone"));
        }

        @Test
        @DisplayName("only refrigerated and cold_chain are temperature controlled")
        void temperatureControlled() {
            assertFalse(DeliveryMode.STANDARD.temperatureControlled());
            assertTrue(DeliveryMode.REFRIGERATED.temperatureControlled());
            assertTrue(DeliveryMode.COLD_CHAIN.temperatureControlled());
        }
    }

    @Nested
    @DisplayName("Carrier.supports()")
    class CarrierTests {

        @Test
        @DisplayName("every carrier supports standard delivery")
        void standardAlwaysSupported() {
            Carrier c = new Carrier("C1", 100, 4, DeliveryMode.STANDARD, 8, Set.of(), null);
            assertTrue(c.supports(DeliveryMode.STANDARD));
            assertFalse(c.supports(DeliveryMode.REFRIGERATED));
        }

        @Test
        @DisplayName("a declared capability at or above the required tier qualifies")
        void capability() {
            Carrier c = new Carrier("C2", 100, 4, DeliveryMode.STANDARD, 8,
                Set.of(DeliveryMode.COLD_CHAIN), "Pune");
            assertTrue(c.supports(DeliveryMode.REFRIGERATED));
            assertTrue(c.supports(DeliveryMode.COLD_CHAIN));
        }

        @Test
        @DisplayName("null capabilities become an empty set")
        void nullCapabilities() {
            Carrier c = new Carrier("C3", 100, 4, DeliveryMode.REFRIGERATED, 8, null, null);
            assertTrue(c.capabilities().isEmpty());
            assertTrue(c.supports(DeliveryMode.REFRIGERATED));
        }
    }
}
