package com.signalbot.support;

import com.signalbot.ai.AIServiceType;
import com.signalbot.config.ProviderSettings;
import com.signalbot.core.ai.PredictionRequest;
import com.signalbot.core.model.CandidateAction;
import com.signalbot.core.model.Candle;
import com.signalbot.core.model.HardFilterResult;
import com.signalbot.core.model.IndicatorSet;
import com.signalbot.core.model.MarketContext;
import com.signalbot.core.model.Timeframe;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class Fixtures {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    public static final String BUY_DECISION_JSON = """
        {"action": "BUY", "confidence": 87, "reason": "Oversold bounce with volume",
         "riskLevel": "MEDIUM", "suggestedStopLoss": 41000, "suggestedTakeProfit": 45000}
        """;

    private Fixtures() {
    }

    public static ProviderSettings settings(AIServiceType service) {
        return settings(service, Duration.ofSeconds(5));
    }

    public static ProviderSettings settings(AIServiceType service, Duration timeout) {
        return new ProviderSettings(service, "test-key", service.defaultModel(), "https://ai.example.test",
            0.3, 500, service.defaultCostPerCall(), 30, timeout);
    }

    /** Hourly candles with closes start, start + step, ... and volume 1000. */
    public static List<Candle> hourly(String instrument, int count, double start, double step) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double open = start + step * Math.max(0, i - 1);
            double close = start + step * i;
            candles.add(new Candle(instrument, Timeframe.H1, START.plusSeconds(3600L * i),
                open, Math.max(open, close) + 1, Math.min(open, close) - 1, close, 1000));
        }
        return candles;
    }

    public static PredictionRequest buyRequest() {
        List<Candle> candles = hourly("BTC/USDT", 5, 42000, -100);
        HardFilterResult filter = new HardFilterResult(CandidateAction.BUY, "oversold",
            new HardFilterResult.Metrics(25.0, 1.5, 1.8, 0.9));
        return new PredictionRequest("BTC/USDT", Timeframe.H1, candles,
            new IndicatorSet(25.0, IndicatorSet.Macd.of(-10, -11.5), 800),
            filter, new MarketContext("Downtrend", 1.2, "High Volume"));
    }

    public static String geminiEnvelope(String text) {
        return "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":" + quote(text) + "}]}}]}";
    }

    public static String claudeEnvelope(String text) {
        return "{\"content\":[{\"type\":\"text\",\"text\":" + quote(text) + "}]}";
    }

    public static String openAiEnvelope(String text) {
        return "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":" + quote(text) + "}}]}";
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
}
