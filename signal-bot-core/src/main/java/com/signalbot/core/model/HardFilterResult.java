package com.signalbot.core.model;

/**
 * Outcome of the deterministic pre-filter.
 */
public record HardFilterResult(CandidateAction candidate, String reason, Metrics metrics) {

    public record Metrics(double rsi, double macdHistogram, double volumeRatio, double bodyPercent) {
    }

    public boolean passed() {
        return candidate != CandidateAction.NEUTRAL;
    }
}
