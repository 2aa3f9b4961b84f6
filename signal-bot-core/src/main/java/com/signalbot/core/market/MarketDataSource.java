package com.signalbot.core.market;

import com.signalbot.core.model.Candle;
import com.signalbot.core.model.Timeframe;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Exchange market data. Instruments use {@code BASE/QUOTE} form, e.g. {@code BTC/USDT}.
 */
public interface MarketDataSource {

    /**
     * @param since inclusive lower bound on open time, or null for the most recent candles
     * @param limit maximum number of candles
     * @return candles in ascending open-time order
     */
    CompletableFuture<List<Candle>> fetchCandles(String instrument, Timeframe timeframe, Instant since, int limit);

    /** Latest traded price. */
    CompletableFuture<Double> fetchPrice(String instrument);
}
