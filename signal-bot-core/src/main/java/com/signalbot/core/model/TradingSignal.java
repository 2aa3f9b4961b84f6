package com.signalbot.core.model;

import java.time.Instant;

/**
 * Final fused decision for one instrument and timeframe.
 *
 * @param hardFilter  null when the filter could not run (insufficient history)
 * @param aiDecision  null when the AI was not consulted or returned nothing usable
 */
public record TradingSignal(
    String instrument,
    Timeframe timeframe,
    SignalAction action,
    double confidence,
    String reason,
    RiskLevel riskLevel,
    HardFilterResult hardFilter,
    AIDecision aiDecision,
    Instant timestamp
) {
    public boolean hardFilterPassed() {
        return hardFilter != null && hardFilter.passed();
    }

    public boolean isActionable() {
        return action != SignalAction.WAIT;
    }
}
