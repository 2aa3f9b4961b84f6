package com.signalbot.core.ai;

import com.signalbot.core.model.Candle;
import com.signalbot.core.model.IndicatorSet;
import com.signalbot.core.model.MarketContext;

import java.util.List;
import java.util.Locale;

/**
 * Renders the analyst prompt shared by all providers. The reply contract is a single
 * JSON object, which {@link AIResponseParser} enforces.
 */
public final class PromptBuilder {

    static final int PRICE_ACTION_CANDLES = 5;

    private PromptBuilder() {
    }

    public static String build(PredictionRequest request) {
        Candle latest = request.latest();
        IndicatorSet indicators = request.indicators();
        MarketContext context = request.marketContext();
        List<Candle> candles = request.candles();

        double priceChange = 0.0;
        double volumeChange = 0.0;
        if (candles.size() > 1) {
            Candle previous = candles.get(candles.size() - 2);
            priceChange = percentChange(previous.close(), latest.close());
            volumeChange = percentChange(previous.volume(), latest.volume());
        }

        StringBuilder sb = new StringBuilder();
        sb.append("You are a professional cryptocurrency trading analyst. ")
          .append("Validate the following technical setup and decide whether to act.\n\n");

        sb.append(String.format(Locale.ROOT, "Instrument: %s (%s timeframe)%n",
            request.instrument(), request.timeframe().code()));
        sb.append(String.format(Locale.ROOT,
            "Latest candle: open=%.4f high=%.4f low=%.4f close=%.4f volume=%.2f%n",
            latest.open(), latest.high(), latest.low(), latest.close(), latest.volume()));
        sb.append(String.format(Locale.ROOT, "Price change: %.2f%%, volume change: %.2f%%%n%n",
            priceChange, volumeChange));

        sb.append("Technical indicators:\n");
        sb.append(String.format(Locale.ROOT, "- RSI(14): %.2f (%s)%n", indicators.rsi(), rsiLabel(indicators.rsi())));
        sb.append(String.format(Locale.ROOT, "- MACD line: %.6f, signal: %.6f, histogram: %.6f%n",
            indicators.macd().line(), indicators.macd().signal(), indicators.macd().histogram()));
        sb.append(String.format(Locale.ROOT, "- Volume MA(20): %.2f%n%n", indicators.volumeMA()));

        if (request.hardFilter() != null) {
            sb.append("Rule-based pre-filter proposes: ").append(request.hardFilter().candidate())
              .append(" (").append(request.hardFilter().reason()).append(")\n\n");
        }

        sb.append("Market context:\n");
        sb.append("- Trend: ").append(context.trend()).append('\n');
        sb.append(String.format(Locale.ROOT, "- Volatility: %.2f%%%n", context.volatilityPercent()));
        sb.append("- Volume: ").append(context.volumeProfile()).append("\n\n");

        sb.append("Recent price action:\n");
        for (Candle c : candles.subList(Math.max(0, candles.size() - PRICE_ACTION_CANDLES), candles.size())) {
            sb.append(String.format(Locale.ROOT, "- %s O=%.4f H=%.4f L=%.4f C=%.4f V=%.2f%n",
                c.openTime(), c.open(), c.high(), c.low(), c.close(), c.volume()));
        }

        sb.append("""

            Respond with ONLY a JSON object, no other text:
            {
              "action": "BUY" | "SELL" | "WAIT",
              "confidence": number between 0 and 100,
              "reason": "short explanation",
              "riskLevel": "LOW" | "MEDIUM" | "HIGH",
              "suggestedStopLoss": number (optional),
              "suggestedTakeProfit": number (optional)
            }
            """);
        return sb.toString();
    }

    static String rsiLabel(double rsi) {
        if (rsi > 70) {
            return "Overbought";
        } else if (rsi < 30) {
            return "Oversold";
        } else if (rsi > 50) {
            return "Bullish momentum";
        }
        return "Bearish momentum";
    }

    private static double percentChange(double from, double to) {
        return from == 0 ? 0.0 : (to - from) / from * 100.0;
    }
}
