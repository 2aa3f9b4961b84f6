package com.signalbot.core.model;

import java.time.Duration;
import java.util.Arrays;

/**
 * Candle intervals supported by the exchange market-data API.
 * Month is treated as a nominal 30 days when stepping sync cursors.
 */
public enum Timeframe {
    M1("1m", Duration.ofMinutes(1)),
    M3("3m", Duration.ofMinutes(3)),
    M5("5m", Duration.ofMinutes(5)),
    M15("15m", Duration.ofMinutes(15)),
    M30("30m", Duration.ofMinutes(30)),
    H1("1h", Duration.ofHours(1)),
    H2("2h", Duration.ofHours(2)),
    H4("4h", Duration.ofHours(4)),
    H6("6h", Duration.ofHours(6)),
    H8("8h", Duration.ofHours(8)),
    H12("12h", Duration.ofHours(12)),
    D1("1d", Duration.ofDays(1)),
    D3("3d", Duration.ofDays(3)),
    W1("1w", Duration.ofDays(7)),
    MO1("1M", Duration.ofDays(30));

    private final String code;
    private final Duration duration;

    Timeframe(String code, Duration duration) {
        this.code = code;
        this.duration = duration;
    }

    public String code() {
        return code;
    }

    public Duration duration() {
        return duration;
    }

    /**
     * Resolve an exchange code such as {@code 1h} or {@code 1M}. Codes are case sensitive
     * because {@code 1m} and {@code 1M} mean different things.
     */
    public static Timeframe fromCode(String code) {
        return Arrays.stream(values())
            .filter(tf -> tf.code.equals(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unsupported timeframe: " + code));
    }

    @Override
    public String toString() {
        return code;
    }
}
