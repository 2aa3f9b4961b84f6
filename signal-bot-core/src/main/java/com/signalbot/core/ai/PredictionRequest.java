package com.signalbot.core.ai;

import com.signalbot.core.model.Candle;
import com.signalbot.core.model.HardFilterResult;
import com.signalbot.core.model.IndicatorSet;
import com.signalbot.core.model.MarketContext;
import com.signalbot.core.model.Timeframe;

import java.util.List;

/**
 * Everything an AI provider sees for one decision.
 *
 * @param candles most recent candles, ascending, latest last
 */
public record PredictionRequest(
    String instrument,
    Timeframe timeframe,
    List<Candle> candles,
    IndicatorSet indicators,
    HardFilterResult hardFilter,
    MarketContext marketContext
) {
    public PredictionRequest {
        if (candles.isEmpty()) {
            throw new IllegalArgumentException("Prediction request needs at least one candle");
        }
        candles = List.copyOf(candles);
    }

    public Candle latest() {
        return candles.get(candles.size() - 1);
    }
}
