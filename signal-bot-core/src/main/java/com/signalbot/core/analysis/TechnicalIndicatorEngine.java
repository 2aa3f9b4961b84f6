package com.signalbot.core.analysis;

import com.signalbot.core.exception.InsufficientHistoryException;
import com.signalbot.core.model.Candle;
import com.signalbot.core.model.IndicatorSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * RSI (Wilder smoothing), MACD (EMA based, SMA seeded) and volume SMA for the latest candle.
 * Stateless and thread-safe.
 */
public final class TechnicalIndicatorEngine {
    private static final Logger logger = LoggerFactory.getLogger(TechnicalIndicatorEngine.class);

    private final IndicatorSettings settings;

    public TechnicalIndicatorEngine(IndicatorSettings settings) {
        this.settings = settings;
    }

    public TechnicalIndicatorEngine() {
        this(IndicatorSettings.defaults());
    }

    public IndicatorSettings getSettings() {
        return settings;
    }

    /**
     * Compute indicators for the most recent candle.
     *
     * @param candles candles of one instrument and timeframe, any order
     * @throws InsufficientHistoryException if fewer than {@link IndicatorSettings#requiredHistory()} candles
     */
    public IndicatorSet compute(List<Candle> candles) {
        int required = settings.requiredHistory();
        if (candles.size() < required) {
            throw new InsufficientHistoryException(required, candles.size());
        }

        List<Candle> ordered = new ArrayList<>(candles);
        ordered.sort(Comparator.comparing(Candle::openTime));

        double[] closes = ordered.stream().mapToDouble(Candle::close).toArray();
        double[] volumes = ordered.stream().mapToDouble(Candle::volume).toArray();

        double rsi = rsi(closes, settings.rsiPeriod());
        IndicatorSet.Macd macd = macd(closes);
        double volumeMA = sma(volumes, settings.volumeMaPeriod());

        logger.debug("Indicators for {} {}: RSI={}, MACD={}/{}, VolMA={}",
            ordered.get(0).instrument(), ordered.get(0).timeframe(),
            String.format("%.2f", rsi), String.format("%.4f", macd.line()),
            String.format("%.4f", macd.signal()), String.format("%.2f", volumeMA));

        return new IndicatorSet(rsi, macd, volumeMA);
    }

    static double rsi(double[] closes, int period) {
        double avgGain = 0;
        double avgLoss = 0;
        for (int i = 1; i <= period; i++) {
            double change = closes[i] - closes[i - 1];
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss -= change;
            }
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < closes.length; i++) {
            double change = closes[i] - closes[i - 1];
            double gain = Math.max(change, 0);
            double loss = Math.max(-change, 0);
            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
        }

        if (avgLoss == 0) {
            // flat series has no momentum either way
            return avgGain == 0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        double value = 100.0 - 100.0 / (1.0 + rs);
        return Math.max(0.0, Math.min(100.0, value));
    }

    private IndicatorSet.Macd macd(double[] closes) {
        double[] fast = ema(closes, settings.macdFastPeriod());
        double[] slow = ema(closes, settings.macdSlowPeriod());

        // MACD line exists from the first index where the slow EMA is defined
        int start = settings.macdSlowPeriod() - 1;
        double[] line = new double[closes.length - start];
        for (int i = start; i < closes.length; i++) {
            line[i - start] = fast[i] - slow[i];
        }
        double[] signal = ema(line, settings.macdSignalPeriod());
        return IndicatorSet.Macd.of(line[line.length - 1], signal[signal.length - 1]);
    }

    /**
     * Exponential moving average seeded with the SMA of the first {@code period} values.
     * Entries before the seed index are NaN.
     */
    static double[] ema(double[] values, int period) {
        double[] result = new double[values.length];
        if (values.length < period) {
            Arrays.fill(result, Double.NaN);
            return result;
        }
        double k = 2.0 / (period + 1);
        double seed = 0;
        for (int i = 0; i < period; i++) {
            seed += values[i];
            result[i] = Double.NaN;
        }
        double ema = seed / period;
        result[period - 1] = ema;
        for (int i = period; i < values.length; i++) {
            ema = values[i] * k + ema * (1 - k);
            result[i] = ema;
        }
        return result;
    }

    static double sma(double[] values, int period) {
        double sum = 0;
        for (int i = values.length - period; i < values.length; i++) {
            sum += values[i];
        }
        return sum / period;
    }
}
