package com.neuralroots.common.model;

/**
 * Pricing strategy label chosen from the combined price multiplier.
 *
 * <pre>
 *   combined >= 1.15 → PREMIUM_PRICING
 *   combined >= 1.05 → ABOVE_MARKET
 *   combined >= 0.98 → MARKET_RATE_PLUS
 *   combined >= 0.90 → MARKET_RATE
 *   combined >= 0.70 → COMPETITIVE_DISCOUNT
 *   otherwise        → CLEARANCE_PRICING
 * </pre>
 */
public enum PricingStrategy {
    PREMIUM_PRICING,
    ABOVE_MARKET,
    MARKET_RATE_PLUS,
    MARKET_RATE,
    COMPETITIVE_DISCOUNT,
    CLEARANCE_PRICING;

    public static PricingStrategy fromMultiplier(double combined) {
        if (combined >= 1.15) return PREMIUM_PRICING;
        if (combined >= 1.05) return ABOVE_MARKET;
        if (combined >= 0.98) return MARKET_RATE_PLUS;
        if (combined >= 0.90) return MARKET_RATE;
        if (combined >= 0.70) return COMPETITIVE_DISCOUNT;
        return CLEARANCE_PRICING;
    }

    public boolean extreme() {
        return this == PREMIUM_PRICING || this == CLEARANCE_PRICING;
    }
}
