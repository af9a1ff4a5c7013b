package com.neuralroots.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ShipmentRequestTest {

    @Test
    @DisplayName("withDefaults() fills every optional field")
    void fillsDefaults() {
        ShipmentRequest r = new ShipmentRequest("  tomato ", 22.0, 85.0,
            null, null, " ", null, null, null, "   ").withDefaults();

        assertEquals("tomato", r.cropName());
        assertEquals(0.0, r.ageHours());
        assertEquals(ShipmentRequest.DEFAULT_QUANTITY_KG, r.quantity());
        assertEquals(ShipmentRequest.DEFAULT_LOCATION, r.origin());
        assertEquals("market", r.destination());
        assertEquals(ShipmentRequest.DEFAULT_DISTANCE_KM, r.distanceKm());
        assertEquals(Urgency.MEDIUM, r.urgency());
        assertNull(r.targetMarket());
    }

    @Test
    @DisplayName("withDefaults() keeps supplied values")
    void keepsValues() {
        ShipmentRequest r = new ShipmentRequest("mango", 28.0, 55.0,
            72.0, 100.0, "Nashik", "Mumbai", 1200.0, Urgency.HIGH, "Mumbai").withDefaults();

        assertEquals(72.0, r.ageHours());
        assertEquals(100.0, r.quantity());
        assertEquals("Nashik", r.origin());
        assertEquals(1200.0, r.distanceKm());
        assertEquals(Urgency.HIGH, r.urgency());
        assertEquals("Mumbai", r.targetMarket());
    }
}
