package com.signalbot.core.support;

import com.signalbot.core.model.Candle;
import com.signalbot.core.model.Timeframe;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Hourly candle fixtures. */
public final class Candles {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private Candles() {
    }

    /** Each candle opens at the previous close; volume 1000. */
    public static List<Candle> fromCloses(String instrument, double... closes) {
        double[] volumes = new double[closes.length];
        Arrays.fill(volumes, 1000.0);
        return fromClosesAndVolumes(instrument, closes, volumes);
    }

    public static List<Candle> fromClosesAndVolumes(String instrument, double[] closes, double[] volumes) {
        List<Candle> candles = new ArrayList<>();
        double previous = closes[0];
        for (int i = 0; i < closes.length; i++) {
            double open = previous;
            double close = closes[i];
            candles.add(new Candle(instrument, Timeframe.H1, START.plusSeconds(3600L * i),
                open, Math.max(open, close) + 0.5, Math.min(open, close) - 0.5, close, volumes[i]));
            previous = close;
        }
        return candles;
    }

    public static List<Candle> linear(String instrument, int count, double start, double step) {
        double[] closes = new double[count];
        for (int i = 0; i < count; i++) {
            closes[i] = start + step * i;
        }
        return fromCloses(instrument, closes);
    }

    public static Candle single(String instrument, double open, double close, double volume) {
        return new Candle(instrument, Timeframe.H1, START,
            open, Math.max(open, close), Math.min(open, close), close, volume);
    }
}
