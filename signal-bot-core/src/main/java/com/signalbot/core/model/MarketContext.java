package com.signalbot.core.model;

/**
 * Descriptive labels over a short candle window, fed to the AI prompt.
 */
public record MarketContext(String trend, double volatilityPercent, String volumeProfile) {

    public static MarketContext unknown() {
        return new MarketContext("Unknown", 0.0, "Unknown");
    }
}
