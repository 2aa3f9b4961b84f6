package com.signalbot.core.model;

import java.util.Objects;

/**
 * A validated AI verdict. Only produced by the response parser after every required
 * field has been checked, so consumers never see partial decisions.
 */
public record AIDecision(
    SignalAction action,
    double confidence,
    String reason,
    RiskLevel riskLevel,
    Double suggestedStopLoss,
    Double suggestedTakeProfit,
    String provider
) {
    public AIDecision {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(riskLevel, "riskLevel");
        if (Double.isNaN(confidence) || confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("Confidence must be within [0, 100]: " + confidence);
        }
    }

    /** Same decision attributed to the provider that produced it. */
    public AIDecision withProvider(String providerId) {
        return new AIDecision(action, confidence, reason, riskLevel,
            suggestedStopLoss, suggestedTakeProfit, providerId);
    }
}
