package com.signalbot.core.analysis;

/**
 * Indicator periods. {@link #requiredHistory()} is the longest period plus a warm-up buffer.
 */
public record IndicatorSettings(
    int rsiPeriod,
    int macdFastPeriod,
    int macdSlowPeriod,
    int macdSignalPeriod,
    int volumeMaPeriod,
    int warmupBuffer
) {
    public IndicatorSettings {
        if (rsiPeriod < 2 || macdFastPeriod < 1 || macdSignalPeriod < 1 || volumeMaPeriod < 1) {
            throw new IllegalArgumentException("Indicator periods must be positive");
        }
        if (macdFastPeriod >= macdSlowPeriod) {
            throw new IllegalArgumentException("MACD fast period must be shorter than slow period");
        }
        if (warmupBuffer < 0) {
            throw new IllegalArgumentException("Warm-up buffer cannot be negative");
        }
    }

    /** RSI 14, MACD 12/26/9, volume MA 20, buffer 10. */
    public static IndicatorSettings defaults() {
        return new IndicatorSettings(14, 12, 26, 9, 20, 10);
    }

    public int requiredHistory() {
        int longest = Math.max(rsiPeriod, Math.max(macdSlowPeriod, volumeMaPeriod));
        // MACD signal needs slow + signal - 1 closes before its first value
        int macdMinimum = macdSlowPeriod + macdSignalPeriod - 1;
        // RSI needs period + 1 closes for its first change window
        int rsiMinimum = rsiPeriod + 1;
        return Math.max(longest + warmupBuffer, Math.max(macdMinimum, rsiMinimum));
    }
}
