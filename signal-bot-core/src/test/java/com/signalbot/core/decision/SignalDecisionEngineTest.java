package com.signalbot.core.decision;

import com.signalbot.core.ai.AIOutcome;
import com.signalbot.core.analysis.HardFilterEvaluator;
import com.signalbot.core.model.AIDecision;
import com.signalbot.core.model.CandidateAction;
import com.signalbot.core.model.HardFilterResult;
import com.signalbot.core.model.IndicatorSet;
import com.signalbot.core.model.RiskLevel;
import com.signalbot.core.model.SignalAction;
import com.signalbot.core.model.Timeframe;
import com.signalbot.core.model.TradingSignal;
import com.signalbot.core.support.Candles;
import com.signalbot.core.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Signal decision engine")
class SignalDecisionEngineTest {

    private static final HardFilterResult.Metrics METRICS = new HardFilterResult.Metrics(25, 0.5, 1.5, 1.0);
    private static final HardFilterResult BUY_CANDIDATE =
        new HardFilterResult(CandidateAction.BUY, "oversold bounce", METRICS);
    private static final HardFilterResult NEUTRAL =
        new HardFilterResult(CandidateAction.NEUTRAL, "nothing", METRICS);

    private final MutableClock clock = MutableClock.at("2024-05-01T12:00:00Z");
    private final SignalDecisionEngine longOnly = new SignalDecisionEngine(DecisionPolicy.longOnly(), clock);

    private static AIOutcome ai(SignalAction action, double confidence) {
        return new AIOutcome.Decided(
            new AIDecision(action, confidence, "model says so", RiskLevel.LOW, null, null, "GEMINI"));
    }

    @Nested
    @DisplayName("BUY candidate")
    class BuyCandidate {

        @Test
        @DisplayName("AI BUY at 85 confidence yields BUY 85")
        void confirmedBuy() {
            TradingSignal signal = longOnly.decide("BTC/USDT", Timeframe.H1, BUY_CANDIDATE, ai(SignalAction.BUY, 85));

            assertThat(signal.action()).isEqualTo(SignalAction.BUY);
            assertThat(signal.confidence()).isEqualTo(85.0);
            assertThat(signal.reason()).isEqualTo("model says so");
            assertThat(signal.riskLevel()).isEqualTo(RiskLevel.LOW);
            assertThat(signal.hardFilterPassed()).isTrue();
            assertThat(signal.aiDecision().provider()).isEqualTo("GEMINI");
            assertThat(signal.timestamp()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("Confidence exactly at the threshold is enough")
        void thresholdInclusive() {
            assertThat(longOnly.decide("BTC/USDT", Timeframe.H1, BUY_CANDIDATE, ai(SignalAction.BUY, 80)).action())
                .isEqualTo(SignalAction.BUY);
        }

        @Test
        @DisplayName("AI BUY at 70 confidence yields WAIT carrying the AI confidence")
        void lowConfidence() {
            TradingSignal signal = longOnly.decide("BTC/USDT", Timeframe.H1, BUY_CANDIDATE, ai(SignalAction.BUY, 70));

            assertThat(signal.action()).isEqualTo(SignalAction.WAIT);
            assertThat(signal.confidence()).isEqualTo(70.0);
            assertThat(signal.reason()).contains("below threshold");
            assertThat(signal.aiDecision()).isNotNull();
        }

        @Test
        @DisplayName("AI disagreeing with the candidate yields WAIT")
        void aiDisagrees() {
            TradingSignal signal = longOnly.decide("BTC/USDT", Timeframe.H1, BUY_CANDIDATE, ai(SignalAction.WAIT, 95));

            assertThat(signal.action()).isEqualTo(SignalAction.WAIT);
            assertThat(signal.confidence()).isEqualTo(95.0);
            assertThat(signal.reason()).startsWith("AI answered WAIT");
        }

        @Test
        @DisplayName("Unavailable AI yields WAIT with confidence 0")
        void aiUnavailable() {
            TradingSignal signal = longOnly.decide("BTC/USDT", Timeframe.H1, BUY_CANDIDATE,
                new AIOutcome.Unavailable("All AI providers failed"));

            assertThat(signal.action()).isEqualTo(SignalAction.WAIT);
            assertThat(signal.confidence()).isZero();
            assertThat(signal.reason()).startsWith(SignalDecisionEngine.REASON_AI_UNAVAILABLE);
        }

        @Test
        @DisplayName("Malformed AI output yields WAIT")
        void aiRejected() {
            TradingSignal signal = longOnly.decide("BTC/USDT", Timeframe.H1, BUY_CANDIDATE,
                new AIOutcome.Rejected("missing action"));

            assertThat(signal.action()).isEqualTo(SignalAction.WAIT);
            assertThat(signal.reason()).isEqualTo(SignalDecisionEngine.REASON_AI_REJECTED + ": missing action");
        }
    }

    @Nested
    @DisplayName("SELL candidate")
    class SellCandidate {

        @Test
        @DisplayName("SELL candidate from RSI 75 and negative histogram still yields WAIT under long-only policy")
        void sellCandidateStillYieldsWaitUnderLongOnlyPolicy() {
            HardFilterResult sell = new HardFilterEvaluator().evaluate(
                Candles.single("BTC/USDT", 100, 99.5, 800),
                new IndicatorSet(75, new IndicatorSet.Macd(-0.3, 0.1, -0.4), 1000));
            assertThat(sell.candidate()).isEqualTo(CandidateAction.SELL);

            TradingSignal signal = longOnly.decide("BTC/USDT", Timeframe.H1, sell, ai(SignalAction.SELL, 95));

            assertThat(signal.action()).isEqualTo(SignalAction.WAIT);
            assertThat(signal.confidence()).isEqualTo(95.0);
            assertThat(signal.reason()).isEqualTo(SignalDecisionEngine.REASON_SELL_NOT_ACTIONABLE);
            assertThat(signal.hardFilterPassed()).isTrue();
        }

        @Test
        @DisplayName("AI BUY on a SELL candidate never becomes BUY")
        void buyOnSellCandidate() {
            HardFilterResult sell = new HardFilterResult(CandidateAction.SELL, "overbought", METRICS);

            assertThat(longOnly.decide("BTC/USDT", Timeframe.H1, sell, ai(SignalAction.BUY, 99)).action())
                .isEqualTo(SignalAction.WAIT);
        }

        @Test
        @DisplayName("With SELL enabled a confident AI SELL yields SELL")
        void sellEnabled() {
            SignalDecisionEngine engine = new SignalDecisionEngine(new DecisionPolicy(80, true), clock);
            HardFilterResult sell = new HardFilterResult(CandidateAction.SELL, "overbought", METRICS);

            TradingSignal signal = engine.decide("ETH/USDT", Timeframe.H4, sell, ai(SignalAction.SELL, 88));

            assertThat(signal.action()).isEqualTo(SignalAction.SELL);
            assertThat(signal.confidence()).isEqualTo(88.0);
        }
    }

    @Test
    @DisplayName("NEUTRAL candidate yields WAIT without looking at the AI")
    void neutral() {
        TradingSignal signal = longOnly.decide("BTC/USDT", Timeframe.H1, NEUTRAL, ai(SignalAction.BUY, 100));

        assertThat(signal.action()).isEqualTo(SignalAction.WAIT);
        assertThat(signal.confidence()).isZero();
        assertThat(signal.reason()).isEqualTo(SignalDecisionEngine.REASON_FILTER_NOT_MET);
        assertThat(signal.aiDecision()).isNull();
    }

    @Test
    @DisplayName("Confidence is clamped and NaN becomes 0")
    void clamp() {
        assertThat(SignalDecisionEngine.clampConfidence(Double.NaN)).isZero();
        assertThat(SignalDecisionEngine.clampConfidence(Double.POSITIVE_INFINITY)).isZero();
        assertThat(SignalDecisionEngine.clampConfidence(-5)).isZero();
        assertThat(SignalDecisionEngine.clampConfidence(150)).isEqualTo(100.0);
        assertThat(SignalDecisionEngine.clampConfidence(42.5)).isEqualTo(42.5);
    }
}
