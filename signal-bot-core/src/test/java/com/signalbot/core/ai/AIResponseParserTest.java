package com.signalbot.core.ai;

import com.signalbot.core.exception.ResponseValidationException;
import com.signalbot.core.model.AIDecision;
import com.signalbot.core.model.RiskLevel;
import com.signalbot.core.model.SignalAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AI response parser")
class AIResponseParserTest {

    private static final String VALID = """
        {"action": "BUY", "confidence": 85, "reason": "Oversold bounce", "riskLevel": "MEDIUM",
         "suggestedStopLoss": 41000.5, "suggestedTakeProfit": 45000}
        """;

    @Nested
    @DisplayName("Accepted responses")
    class Accepted {

        @Test
        void parsesPlainJson() {
            AIDecision decision = AIResponseParser.parse(VALID, "GEMINI");

            assertThat(decision.action()).isEqualTo(SignalAction.BUY);
            assertThat(decision.confidence()).isEqualTo(85.0);
            assertThat(decision.reason()).isEqualTo("Oversold bounce");
            assertThat(decision.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
            assertThat(decision.suggestedStopLoss()).isEqualTo(41000.5);
            assertThat(decision.suggestedTakeProfit()).isEqualTo(45000.0);
            assertThat(decision.provider()).isEqualTo("GEMINI");
        }

        @Test
        @DisplayName("Strips a Markdown json code fence")
        void stripsCodeFence() {
            String fenced = "```json\n{\"action\":\"WAIT\",\"confidence\":40,\"reason\":\"Choppy\",\"riskLevel\":\"HIGH\"}\n```";

            AIDecision decision = AIResponseParser.parse(fenced, "CLAUDE");

            assertThat(decision.action()).isEqualTo(SignalAction.WAIT);
            assertThat(decision.suggestedStopLoss()).isNull();
        }

        @Test
        @DisplayName("Extracts the object from surrounding prose")
        void extractsFromProse() {
            String prose = "Here is my analysis: {\"action\":\"SELL\",\"confidence\":81.5,"
                + "\"reason\":\"Divergence\",\"riskLevel\":\"LOW\"} Hope this helps.";

            assertThat(AIResponseParser.parse(prose, "OPENAI").action()).isEqualTo(SignalAction.SELL);
        }

        @Test
        @DisplayName("HOLD and lower-case values are normalized")
        void normalizesValues() {
            String json = "{\"action\":\"hold\",\"confidence\":10,\"reason\":\"Nothing\",\"riskLevel\":\"low\"}";

            AIDecision decision = AIResponseParser.parse(json, "GEMINI");

            assertThat(decision.action()).isEqualTo(SignalAction.WAIT);
            assertThat(decision.riskLevel()).isEqualTo(RiskLevel.LOW);
        }
    }

    @Nested
    @DisplayName("Rejected responses")
    class Rejected {

        @ParameterizedTest
        @ValueSource(strings = {"action", "confidence", "reason", "riskLevel"})
        @DisplayName("Missing required field is a hard failure")
        void missingField(String field) {
            String json = VALID.replace("\"" + field + "\"", "\"ignored_" + field + "\"");

            assertThatThrownBy(() -> AIResponseParser.parse(json, "GEMINI"))
                .isInstanceOf(ResponseValidationException.class)
                .hasMessageContaining(field);
        }

        @Test
        void unknownAction() {
            String json = VALID.replace("\"BUY\"", "\"STRONG_BUY\"");

            assertThatThrownBy(() -> AIResponseParser.parse(json, "GEMINI"))
                .isInstanceOf(ResponseValidationException.class)
                .hasMessageContaining("STRONG_BUY");
        }

        @Test
        void confidenceAsString() {
            String json = VALID.replace("85", "\"85\"");

            assertThatThrownBy(() -> AIResponseParser.parse(json, "GEMINI"))
                .isInstanceOf(ResponseValidationException.class)
                .hasMessageContaining("confidence");
        }

        @Test
        void confidenceOutOfRange() {
            String json = VALID.replace("85", "120");

            assertThatThrownBy(() -> AIResponseParser.parse(json, "GEMINI"))
                .isInstanceOf(ResponseValidationException.class)
                .hasMessageContaining("out of range");
        }

        @Test
        void nonNumericOptionalField() {
            String json = VALID.replace("45000", "\"soon\"");

            assertThatThrownBy(() -> AIResponseParser.parse(json, "GEMINI"))
                .isInstanceOf(ResponseValidationException.class)
                .hasMessageContaining("suggestedTakeProfit");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "I think you should buy", "[1,2,3]", "{\"action\": "})
        void notADecision(String text) {
            assertThatThrownBy(() -> AIResponseParser.parse(text, "GEMINI"))
                .isInstanceOf(ResponseValidationException.class);
        }
    }
}
