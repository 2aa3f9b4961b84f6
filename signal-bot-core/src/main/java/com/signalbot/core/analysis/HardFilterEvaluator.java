package com.signalbot.core.analysis;

import com.signalbot.core.model.CandidateAction;
import com.signalbot.core.model.Candle;
import com.signalbot.core.model.HardFilterResult;
import com.signalbot.core.model.IndicatorSet;

/**
 * Deterministic candidate selection. Pure: same inputs always give the same result.
 *
 * <ul>
 *   <li>BUY: RSI below the oversold level, positive histogram, volume ratio and body percent
 *       at or above their minimums</li>
 *   <li>SELL: RSI above the overbought level and negative histogram</li>
 *   <li>otherwise NEUTRAL</li>
 * </ul>
 */
public final class HardFilterEvaluator {

    static final String BUY_REASON = "Oversold with positive momentum, strong volume and significant body move";
    static final String SELL_REASON = "Overbought with weakening momentum";
    static final String NEUTRAL_REASON = "Does not meet strict hard filter criteria";

    private final HardFilterCriteria criteria;

    public HardFilterEvaluator(HardFilterCriteria criteria) {
        this.criteria = criteria;
    }

    public HardFilterEvaluator() {
        this(HardFilterCriteria.defaults());
    }

    public HardFilterResult evaluate(Candle latest, IndicatorSet indicators) {
        double rsi = indicators.rsi();
        double histogram = indicators.macd().histogram();
        double volumeRatio = indicators.volumeMA() > 0 ? latest.volume() / indicators.volumeMA() : 0.0;
        double bodyPercent = latest.bodyPercent();

        HardFilterResult.Metrics metrics = new HardFilterResult.Metrics(rsi, histogram, volumeRatio, bodyPercent);

        // NaN compares false everywhere, which lands on NEUTRAL
        if (rsi < criteria.oversoldRsi()
                && histogram > 0
                && volumeRatio >= criteria.minVolumeRatio()
                && bodyPercent >= criteria.minBodyPercent()) {
            return new HardFilterResult(CandidateAction.BUY, BUY_REASON, metrics);
        }
        if (rsi > criteria.overboughtRsi() && histogram < 0) {
            return new HardFilterResult(CandidateAction.SELL, SELL_REASON, metrics);
        }
        return new HardFilterResult(CandidateAction.NEUTRAL, NEUTRAL_REASON, metrics);
    }
}
