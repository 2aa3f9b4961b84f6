package com.signalbot.persistence;

import com.signalbot.core.model.Candle;
import com.signalbot.core.model.Timeframe;
import com.signalbot.support.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Candle database")
class CandleDatabaseTest {

    @TempDir
    Path tempDir;

    private CandleDatabase database;

    @BeforeEach
    void setUp() {
        database = new CandleDatabase(tempDir.resolve("candles.db").toString());
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    @DisplayName("Empty store has no latest candle")
    void emptyStore() {
        assertThat(database.latestOpenTime("BTC/USDT", Timeframe.H1)).isEmpty();
        assertThat(database.count("BTC/USDT", Timeframe.H1)).isZero();
        assertThat(database.recent("BTC/USDT", Timeframe.H1, 10)).isEmpty();
    }

    @Test
    @DisplayName("Upsert overwrites candles with the same open time")
    void upsertOverwrites() {
        List<Candle> candles = Fixtures.hourly("BTC/USDT", 3, 100, 1);
        database.upsert(candles);

        Candle last = candles.get(2);
        Candle revised = new Candle(last.instrument(), last.timeframe(), last.openTime(),
            last.open(), 110, last.low(), 109, 5000);
        assertThat(database.upsert(List.of(revised))).isEqualTo(1);

        assertThat(database.count("BTC/USDT", Timeframe.H1)).isEqualTo(3);
        assertThat(database.recent("BTC/USDT", Timeframe.H1, 1)).containsExactly(revised);
    }

    @Test
    @DisplayName("Recent candles come back ascending and limited")
    void recentAscending() {
        List<Candle> candles = Fixtures.hourly("BTC/USDT", 10, 100, 1);
        database.upsert(candles);

        List<Candle> recent = database.recent("BTC/USDT", Timeframe.H1, 4);

        assertThat(recent).containsExactlyElementsOf(candles.subList(6, 10));
        assertThat(database.latestOpenTime("BTC/USDT", Timeframe.H1)).contains(candles.get(9).openTime());
    }

    @Test
    @DisplayName("Instruments and timeframes are kept apart")
    void keysAreIsolated() {
        database.upsert(Fixtures.hourly("BTC/USDT", 3, 100, 1));
        database.upsert(Fixtures.hourly("ETH/USDT", 2, 10, 1));

        assertThat(database.count("ETH/USDT", Timeframe.H1)).isEqualTo(2);
        assertThat(database.count("BTC/USDT", Timeframe.H4)).isZero();
    }
}
