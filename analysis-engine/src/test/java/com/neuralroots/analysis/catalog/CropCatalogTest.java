package com.neuralroots.analysis.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CropCatalogTest {

    @Test
    @DisplayName("aliases and compound names resolve to the canonical crop type")
    void resolve() {
        assertEquals("tomato", CropCatalog.resolveCropType("Cherry Tomatoes"));
        assertEquals("mango", CropCatalog.resolveCropType("Alphonso"));
        assertEquals("onion", CropCatalog.resolveCropType("kanda"));
        assertEquals("leafy_greens", CropCatalog.resolveCropType("baby spinach"));
        assertEquals(CropCatalog.GENERIC, CropCatalog.resolveCropType("dragonfruit"));
        assertEquals(CropCatalog.GENERIC, CropCatalog.resolveCropType(null));
    }

    @Test
    @DisplayName("unknown crops fall back to the generic profile")
    void profiles() {
        assertEquals(168.0, CropCatalog.profileFor("tomato").shelfLifeHours());
        assertEquals(CropCatalog.GENERIC, CropCatalog.profileFor("dragonfruit").cropType());
        assertFalse(CropCatalog.isKnown("dragonfruit"));
        assertTrue(CropCatalog.isKnown("Potatoes"));
    }

    @Test
    @DisplayName("default price: exact name, alias, partial match, then 50")
    void defaultPrices() {
        assertEquals(80.0, CropCatalog.defaultPriceFor("Tomato"));
        assertEquals(150.0, CropCatalog.defaultPriceFor("hapus"));
        assertEquals(40.0, CropCatalog.defaultPriceFor("red onion"));
        assertEquals(CropCatalog.DEFAULT_BASE_PRICE, CropCatalog.defaultPriceFor("dragonfruit"));
    }

    @Test
    @DisplayName("weather sensitivity per crop type, 1.0 otherwise")
    void sensitivity() {
        assertEquals(1.5, CropCatalog.sensitivityFor("lettuce"));
        assertEquals(0.4, CropCatalog.sensitivityFor("onion"));
        assertEquals(CropCatalog.DEFAULT_SENSITIVITY, CropCatalog.sensitivityFor("carrot"));
    }
}
