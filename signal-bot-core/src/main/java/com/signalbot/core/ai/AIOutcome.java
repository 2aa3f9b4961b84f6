package com.signalbot.core.ai;

import com.signalbot.core.model.AIDecision;

/**
 * Result of consulting the AI layer, as seen by the decision engine.
 */
public sealed interface AIOutcome {

    record Decided(AIDecision decision) implements AIOutcome {
    }

    /** No provider could answer: all failed, none ready, or budget spent. */
    record Unavailable(String reason) implements AIOutcome {
    }

    /** Providers answered but nothing parsed into a valid decision. */
    record Rejected(String reason) implements AIOutcome {
    }
}
