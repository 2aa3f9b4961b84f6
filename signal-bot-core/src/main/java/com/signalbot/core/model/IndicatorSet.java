package com.signalbot.core.model;

/**
 * Indicator values for the most recent candle of a series.
 *
 * @param rsi       relative strength index in [0, 100]
 * @param macd      MACD line, signal and histogram
 * @param volumeMA  simple moving average of volume
 */
public record IndicatorSet(double rsi, Macd macd, double volumeMA) {

    public record Macd(double line, double signal, double histogram) {
        public static Macd of(double line, double signal) {
            return new Macd(line, signal, line - signal);
        }
    }
}
