package com.signalbot.market;

import com.signalbot.core.market.MarketDataSource;
import com.signalbot.core.model.Candle;
import com.signalbot.core.model.Timeframe;
import com.signalbot.core.resilience.RetryPolicy;
import com.signalbot.persistence.CandleDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Pulls candles from the exchange into the local candle store.
 */
public final class CandleSyncService {
    private static final Logger logger = LoggerFactory.getLogger(CandleSyncService.class);

    private final MarketDataSource marketData;
    private final CandleDatabase candleDatabase;

    public CandleSyncService(MarketDataSource marketData, CandleDatabase candleDatabase) {
        this.marketData = marketData;
        this.candleDatabase = candleDatabase;
    }

    /**
     * Fetch candles newer than the latest stored one, or the latest {@code limit} candles
     * when nothing is stored yet.
     *
     * @return number of candles written
     */
    public CompletableFuture<Integer> sync(String instrument, Timeframe timeframe, int limit) {
        Instant since;
        try {
            since = candleDatabase.latestOpenTime(instrument, timeframe)
                .map(latest -> latest.plus(timeframe.duration()))
                .orElse(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        return marketData.fetchCandles(instrument, timeframe, since, limit)
            .thenApply(candles -> {
                int written = candleDatabase.upsert(candles);
                if (written > 0) {
                    logger.info("📥 Synced {} {} candles for {}", written, timeframe, instrument);
                } else {
                    logger.debug("No new {} candles for {}", timeframe, instrument);
                }
                return written;
            });
    }

    /**
     * Sync every instrument/timeframe pair concurrently. A failed pair is reported as -1
     * and does not affect the others.
     *
     * @return counts keyed by {@code instrument:timeframe}
     */
    public CompletableFuture<Map<String, Integer>> syncAll(List<String> instruments, List<Timeframe> timeframes,
                                                           int limit) {
        Map<String, CompletableFuture<Integer>> pending = new LinkedHashMap<>();
        for (String instrument : instruments) {
            for (Timeframe timeframe : timeframes) {
                String key = instrument + ":" + timeframe.code();
                pending.put(key, sync(instrument, timeframe, limit)
                    .exceptionally(error -> {
                        logger.error("❌ Candle sync failed for {}: {}", key, RetryPolicy.unwrap(error).getMessage());
                        return -1;
                    }));
            }
        }

        return CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]))
            .thenApply(ignored -> {
                Map<String, Integer> results = new LinkedHashMap<>();
                pending.forEach((key, future) -> results.put(key, future.join()));
                return results;
            });
    }

    /** Most recent {@code count} stored candles, ascending. */
    public List<Candle> recentCandles(String instrument, Timeframe timeframe, int count) {
        return new ArrayList<>(candleDatabase.recent(instrument, timeframe, count));
    }
}
