package com.signalbot.core.analysis;

/**
 * Thresholds of the deterministic pre-filter.
 */
public record HardFilterCriteria(
    double oversoldRsi,
    double overboughtRsi,
    double minVolumeRatio,
    double minBodyPercent
) {
    /** RSI below 30 / above 70, volume 1.2x average, body 0.5%. */
    public static HardFilterCriteria defaults() {
        return new HardFilterCriteria(30.0, 70.0, 1.2, 0.5);
    }
}
