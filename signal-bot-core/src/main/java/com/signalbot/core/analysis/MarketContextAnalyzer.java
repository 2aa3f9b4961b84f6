package com.signalbot.core.analysis;

import com.signalbot.core.model.Candle;
import com.signalbot.core.model.MarketContext;

import java.util.List;

/**
 * Trend, volatility and volume labels over the most recent candles (ascending input).
 */
public final class MarketContextAnalyzer {

    public static final int DEFAULT_WINDOW = 10;

    private final int window;

    public MarketContextAnalyzer(int window) {
        this.window = window;
    }

    public MarketContextAnalyzer() {
        this(DEFAULT_WINDOW);
    }

    public MarketContext analyze(List<Candle> candles) {
        if (candles.size() < 2) {
            return MarketContext.unknown();
        }
        List<Candle> recent = candles.subList(Math.max(0, candles.size() - window), candles.size());

        double first = recent.get(0).close();
        double last = recent.get(recent.size() - 1).close();
        double changePercent = first == 0 ? 0.0 : (last - first) / first * 100.0;

        return new MarketContext(trendLabel(changePercent), volatility(recent), volumeLabel(recent));
    }

    static String trendLabel(double changePercent) {
        if (changePercent > 2) {
            return "Strong Uptrend";
        } else if (changePercent > 0.5) {
            return "Uptrend";
        } else if (changePercent < -2) {
            return "Strong Downtrend";
        } else if (changePercent < -0.5) {
            return "Downtrend";
        }
        return "Sideways";
    }

    private static double volatility(List<Candle> candles) {
        double mean = candles.stream().mapToDouble(Candle::close).average().orElse(0.0);
        if (mean == 0) {
            return 0.0;
        }
        double variance = candles.stream()
            .mapToDouble(c -> Math.pow(c.close() - mean, 2))
            .average()
            .orElse(0.0);
        return Math.sqrt(variance) / mean * 100.0;
    }

    private static String volumeLabel(List<Candle> candles) {
        double latest = candles.get(candles.size() - 1).volume();
        double previousAverage = candles.subList(0, candles.size() - 1).stream()
            .mapToDouble(Candle::volume)
            .average()
            .orElse(0.0);
        if (previousAverage == 0) {
            return "Normal Volume";
        }
        double ratio = latest / previousAverage;
        if (ratio > 1.5) {
            return "High Volume";
        } else if (ratio < 0.7) {
            return "Low Volume";
        }
        return "Normal Volume";
    }
}
