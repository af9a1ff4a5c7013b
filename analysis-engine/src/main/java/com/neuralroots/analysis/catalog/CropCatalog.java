package com.neuralroots.analysis.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static crop reference data: optimal storage bands, default market prices and
 * weather sensitivity.
 *
 * <p>Crop names are resolved case-insensitively. Aliases (plurals, regional names, leafy
 * vegetables) map onto a canonical crop type; anything unresolved falls back to
 * {@link #GENERIC}.
 */
public final class CropCatalog {

    public static final String GENERIC = "generic";

    public static final double DEFAULT_BASE_PRICE  = 50.0;
    public static final double DEFAULT_SENSITIVITY = 1.0;

    private static final CropProfile GENERIC_PROFILE = new CropProfile(GENERIC, 10, 20, 80, 90, 7);

    private static final Map<String, CropProfile> PROFILES = Map.of(
        "tomato",       new CropProfile("tomato",       20, 25, 90, 95, 7),
        "onion",        new CropProfile("onion",         0,  5, 65, 70, 60),
        "mango",        new CropProfile("mango",        13, 18, 80, 90, 14),
        "potato",       new CropProfile("potato",        4, 10, 85, 95, 90),
        "carrot",       new CropProfile("carrot",        0,  4, 90, 95, 60),
        "cucumber",     new CropProfile("cucumber",     10, 15, 85, 90, 5),
        "leafy_greens", new CropProfile("leafy_greens",  0,  5, 90, 95, 3)
    );

    // Insertion order matters: first substring match wins.
    private static final Map<String, String> ALIASES = new LinkedHashMap<>();
    static {
        ALIASES.put("tomato",       "tomato");
        ALIASES.put("tamatar",      "tomato");
        ALIASES.put("onion",        "onion");
        ALIASES.put("kanda",        "onion");
        ALIASES.put("mango",        "mango");
        ALIASES.put("alphonso",     "mango");
        ALIASES.put("potato",       "potato");
        ALIASES.put("aloo",         "potato");
        ALIASES.put("carrot",       "carrot");
        ALIASES.put("cucumber",     "cucumber");
        ALIASES.put("lettuce",      "leafy_greens");
        ALIASES.put("spinach",      "leafy_greens");
        ALIASES.put("kale",         "leafy_greens");
        ALIASES.put("leafy",        "leafy_greens");
    }

    /** Rs/kg used when no comparable listing exists. Keys are canonical names; aliases follow. */
    private static final List<PriceEntry> DEFAULT_PRICES = List.of(
        new PriceEntry("tomato",       80,  "tomatoes", "tamatar"),
        new PriceEntry("onion",        40,  "onions", "kanda", "pyaz"),
        new PriceEntry("potato",       30,  "potatoes", "aloo", "batata"),
        new PriceEntry("mango",        150, "mangoes", "alphonso", "hapus", "aam"),
        new PriceEntry("carrot",       40,  "carrots", "gajar"),
        new PriceEntry("cucumber",     35,  "cucumbers", "kheera"),
        new PriceEntry("spinach",      40,  "palak"),
        new PriceEntry("leafy_greens", 40,  "lettuce", "kale"),
        new PriceEntry("cauliflower",  50,  "gobi"),
        new PriceEntry("cabbage",      25),
        new PriceEntry("brinjal",      35,  "eggplant", "baingan"),
        new PriceEntry("okra",         45,  "lady finger", "bhindi"),
        new PriceEntry("capsicum",     70,  "bell pepper"),
        new PriceEntry("banana",       40,  "bananas", "kela"),
        new PriceEntry("grape",        120, "grapes", "angoor"),
        new PriceEntry("orange",       60,  "oranges", "santra"),
        new PriceEntry("apple",        150, "apples"),
        new PriceEntry("pomegranate",  180, "anar"),
        new PriceEntry("papaya",       35),
        new PriceEntry("guava",        50,  "amrud", "peru")
    );

    private static final Map<String, Double> SENSITIVITY = Map.of(
        "tomato",       1.2,
        "leafy_greens", 1.5,
        "mango",        0.8,
        "potato",       0.5,
        "onion",        0.4
    );

    private CropCatalog() {}

    /** Canonical crop type for {@code cropName}, or {@link #GENERIC}. */
    public static String resolveCropType(String cropName) {
        if (cropName == null) return GENERIC;
        String lower = cropName.toLowerCase(Locale.ROOT).trim();
        for (Map.Entry<String, String> alias : ALIASES.entrySet()) {
            if (lower.contains(alias.getKey())) {
                return alias.getValue();
            }
        }
        return GENERIC;
    }

    public static boolean isKnown(String cropName) {
        return !GENERIC.equals(resolveCropType(cropName));
    }

    public static CropProfile profileFor(String cropName) {
        return PROFILES.getOrDefault(resolveCropType(cropName), GENERIC_PROFILE);
    }

    public static double sensitivityFor(String cropName) {
        return SENSITIVITY.getOrDefault(resolveCropType(cropName), DEFAULT_SENSITIVITY);
    }

    /**
     * Default base price in Rs/kg: exact name, then alias, then partial match, then
     * {@link #DEFAULT_BASE_PRICE}.
     */
    public static double defaultPriceFor(String cropName) {
        if (cropName == null) return DEFAULT_BASE_PRICE;
        String lower = cropName.toLowerCase(Locale.ROOT).trim();
        for (PriceEntry e : DEFAULT_PRICES) {
            if (e.name().equals(lower)) return e.price();
        }
        for (PriceEntry e : DEFAULT_PRICES) {
            if (e.aliases().contains(lower)) return e.price();
        }
        for (PriceEntry e : DEFAULT_PRICES) {
            if (lower.contains(e.name()) || e.aliases().stream().anyMatch(lower::contains)) {
                return e.price();
            }
        }
        return DEFAULT_BASE_PRICE;
    }

    private record PriceEntry(String name, double price, List<String> aliases) {
        PriceEntry(String name, double price, String... aliases) {
            this(name, price, List.of(aliases));
        }
    }
}
