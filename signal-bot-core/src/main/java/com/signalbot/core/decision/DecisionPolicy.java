package com.signalbot.core.decision;

/**
 * @param minConfidence   AI confidence required to act, inclusive
 * @param sellActionable  when false (long-only) a SELL candidate always ends as WAIT
 */
public record DecisionPolicy(double minConfidence, boolean sellActionable) {

    public DecisionPolicy {
        if (minConfidence < 0 || minConfidence > 100) {
            throw new IllegalArgumentException("minConfidence must be within [0, 100]: " + minConfidence);
        }
    }

    public static DecisionPolicy longOnly() {
        return new DecisionPolicy(80.0, false);
    }
}
