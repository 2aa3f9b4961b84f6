package com.signalbot.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One OHLCV bar. Uniquely identified by (instrument, timeframe, openTime).
 */
public record Candle(
    String instrument,
    Timeframe timeframe,
    Instant openTime,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    public Candle {
        Objects.requireNonNull(instrument, "instrument");
        Objects.requireNonNull(timeframe, "timeframe");
        Objects.requireNonNull(openTime, "openTime");
        if (volume < 0) {
            throw new IllegalArgumentException("Volume cannot be negative: " + volume);
        }
    }

    /** Absolute candle body as a percentage of the open price. */
    public double bodyPercent() {
        if (open == 0) {
            return 0.0;
        }
        return Math.abs(close - open) / open * 100.0;
    }
}
