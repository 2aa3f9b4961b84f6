package com.signalbot.core.decision;

import com.signalbot.core.ai.AIOutcome;
import com.signalbot.core.ai.AIProviderManager;
import com.signalbot.core.ai.PredictionRequest;
import com.signalbot.core.analysis.HardFilterEvaluator;
import com.signalbot.core.analysis.MarketContextAnalyzer;
import com.signalbot.core.analysis.TechnicalIndicatorEngine;
import com.signalbot.core.exception.InsufficientHistoryException;
import com.signalbot.core.model.Candle;
import com.signalbot.core.model.HardFilterResult;
import com.signalbot.core.model.IndicatorSet;
import com.signalbot.core.model.Timeframe;
import com.signalbot.core.model.TradingSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * indicators -> hard filter -> AI (only when the filter passes) -> decision.
 * Never fails: every problem ends in a WAIT signal with a reason.
 */
public final class SignalPipeline {
    private static final Logger logger = LoggerFactory.getLogger(SignalPipeline.class);

    /** Candles handed to the AI prompt. */
    public static final int AI_CONTEXT_CANDLES = 20;

    private final TechnicalIndicatorEngine indicatorEngine;
    private final HardFilterEvaluator hardFilter;
    private final MarketContextAnalyzer contextAnalyzer;
    private final AIProviderManager aiManager;
    private final SignalDecisionEngine decisionEngine;

    public SignalPipeline(TechnicalIndicatorEngine indicatorEngine, HardFilterEvaluator hardFilter,
                          MarketContextAnalyzer contextAnalyzer, AIProviderManager aiManager,
                          SignalDecisionEngine decisionEngine) {
        this.indicatorEngine = indicatorEngine;
        this.hardFilter = hardFilter;
        this.contextAnalyzer = contextAnalyzer;
        this.aiManager = aiManager;
        this.decisionEngine = decisionEngine;
    }

    public int requiredHistory() {
        return indicatorEngine.getSettings().requiredHistory();
    }

    public CompletableFuture<TradingSignal> evaluate(String instrument, Timeframe timeframe, List<Candle> candles) {
        List<Candle> ordered = new ArrayList<>(candles);
        ordered.sort(Comparator.comparing(Candle::openTime));

        IndicatorSet indicators;
        try {
            indicators = indicatorEngine.compute(ordered);
        } catch (InsufficientHistoryException e) {
            logger.info("{} {}: {}", instrument, timeframe, e.getMessage());
            return CompletableFuture.completedFuture(
                decisionEngine.insufficientHistory(instrument, timeframe, e.getMessage()));
        }

        Candle latest = ordered.get(ordered.size() - 1);
        HardFilterResult filter = hardFilter.evaluate(latest, indicators);
        logger.debug("{} {} hard filter: {} ({})", instrument, timeframe, filter.candidate(), filter.reason());

        if (!filter.passed()) {
            return CompletableFuture.completedFuture(decisionEngine.decide(instrument, timeframe, filter, null));
        }

        List<Candle> recent = ordered.subList(Math.max(0, ordered.size() - AI_CONTEXT_CANDLES), ordered.size());
        PredictionRequest request = new PredictionRequest(instrument, timeframe, recent, indicators,
            filter, contextAnalyzer.analyze(recent));

        return aiManager.consult(request)
            .exceptionally(failure -> new AIOutcome.Unavailable(failure.getMessage()))
            .thenApply(outcome -> {
                TradingSignal signal = decisionEngine.decide(instrument, timeframe, filter, outcome);
                logger.atInfo()
                    .addKeyValue("instrument", instrument)
                    .addKeyValue("timeframe", timeframe.code())
                    .addKeyValue("candidate", filter.candidate())
                    .addKeyValue("action", signal.action())
                    .addKeyValue("confidence", signal.confidence())
                    .log("🎯 Signal decided: {} {} -> {} ({})", instrument, timeframe, signal.action(), signal.reason());
                return signal;
            });
    }

    /**
     * Evaluate several series concurrently. Keys are {@code instrument:timeframe}.
     */
    public CompletableFuture<Map<String, TradingSignal>> evaluateAll(Map<String, List<Candle>> seriesByKey,
                                                                     Timeframe timeframe) {
        Map<String, CompletableFuture<TradingSignal>> pending = new LinkedHashMap<>();
        seriesByKey.forEach((instrument, candles) ->
            pending.put(instrument + ":" + timeframe.code(), evaluate(instrument, timeframe, candles)));

        return CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]))
            .thenApply(ignored -> {
                Map<String, TradingSignal> results = new LinkedHashMap<>();
                pending.forEach((key, future) -> results.put(key, future.join()));
                return results;
            });
    }
}
