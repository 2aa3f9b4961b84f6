package com.signalbot.core.decision;

import com.signalbot.core.ai.AIOutcome;
import com.signalbot.core.model.AIDecision;
import com.signalbot.core.model.CandidateAction;
import com.signalbot.core.model.HardFilterResult;
import com.signalbot.core.model.RiskLevel;
import com.signalbot.core.model.SignalAction;
import com.signalbot.core.model.Timeframe;
import com.signalbot.core.model.TradingSignal;

import java.time.Clock;
import java.util.Locale;

/**
 * Fuses the hard-filter candidate and the AI outcome into a final signal.
 *
 * <p>Only a BUY candidate confirmed by an AI BUY at or above the confidence threshold
 * becomes BUY. SELL follows the same rule but only when the policy allows it. Every
 * other combination is WAIT with a reason. A WAIT the AI answered for keeps the AI's
 * confidence; WAIT without an AI answer carries 0.
 */
public final class SignalDecisionEngine {

    public static final String REASON_FILTER_NOT_MET = "Hard filter criteria not met";
    public static final String REASON_AI_UNAVAILABLE = "AI validation not available";
    public static final String REASON_AI_REJECTED = "AI validation failed";
    public static final String REASON_SELL_NOT_ACTIONABLE = "SELL candidate not actionable under long-only policy";

    private final DecisionPolicy policy;
    private final Clock clock;

    public SignalDecisionEngine(DecisionPolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    public SignalDecisionEngine(DecisionPolicy policy) {
        this(policy, Clock.systemUTC());
    }

    public DecisionPolicy getPolicy() {
        return policy;
    }

    /**
     * @param aiOutcome ignored when the filter did not pass; may be null in that case
     */
    public TradingSignal decide(String instrument, Timeframe timeframe,
                                HardFilterResult filter, AIOutcome aiOutcome) {
        if (!filter.passed()) {
            return waitSignal(instrument, timeframe, REASON_FILTER_NOT_MET, filter, null);
        }

        if (aiOutcome == null || aiOutcome instanceof AIOutcome.Unavailable) {
            String detail = aiOutcome == null ? "" : ": " + ((AIOutcome.Unavailable) aiOutcome).reason();
            return waitSignal(instrument, timeframe, REASON_AI_UNAVAILABLE + detail, filter, null);
        }
        if (aiOutcome instanceof AIOutcome.Rejected rejected) {
            return waitSignal(instrument, timeframe, REASON_AI_REJECTED + ": " + rejected.reason(), filter, null);
        }

        AIDecision decision = ((AIOutcome.Decided) aiOutcome).decision();
        double confidence = clampConfidence(decision.confidence());

        if (filter.candidate() == CandidateAction.SELL && !policy.sellActionable()) {
            return new TradingSignal(instrument, timeframe, SignalAction.WAIT, confidence,
                REASON_SELL_NOT_ACTIONABLE, decision.riskLevel(), filter, decision, clock.instant());
        }

        SignalAction expected = filter.candidate() == CandidateAction.BUY ? SignalAction.BUY : SignalAction.SELL;
        if (decision.action() != expected) {
            String reason = String.format(Locale.ROOT, "AI answered %s for %s candidate: %s",
                decision.action(), filter.candidate(), decision.reason());
            return new TradingSignal(instrument, timeframe, SignalAction.WAIT, confidence,
                reason, decision.riskLevel(), filter, decision, clock.instant());
        }
        if (confidence < policy.minConfidence()) {
            String reason = String.format(Locale.ROOT, "AI confidence %.1f below threshold %.1f: %s",
                confidence, policy.minConfidence(), decision.reason());
            return new TradingSignal(instrument, timeframe, SignalAction.WAIT, confidence,
                reason, decision.riskLevel(), filter, decision, clock.instant());
        }

        return new TradingSignal(instrument, timeframe, expected, confidence,
            decision.reason(), decision.riskLevel(), filter, decision, clock.instant());
    }

    /** Signal for a series that could not be analysed at all. */
    public TradingSignal insufficientHistory(String instrument, Timeframe timeframe, String reason) {
        return waitSignal(instrument, timeframe, reason, null, null);
    }

    /** NaN and infinities become 0, everything else is clamped to [0, 100]. */
    static double clampConfidence(double confidence) {
        if (Double.isNaN(confidence) || Double.isInfinite(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, confidence));
    }

    private TradingSignal waitSignal(String instrument, Timeframe timeframe, String reason,
                                     HardFilterResult filter, AIDecision decision) {
        return new TradingSignal(instrument, timeframe, SignalAction.WAIT, 0.0, reason,
            RiskLevel.HIGH, filter, decision, clock.instant());
    }
}
