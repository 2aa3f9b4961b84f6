package com.signalbot.core.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalbot.core.exception.ResponseValidationException;
import com.signalbot.core.model.AIDecision;
import com.signalbot.core.model.RiskLevel;
import com.signalbot.core.model.SignalAction;

import java.util.Locale;

/**
 * Strict parser for AI replies. Accepts a JSON object, optionally wrapped in a Markdown
 * code fence or surrounded by prose, and rejects anything with a missing or invalid
 * required field. Partial decisions are never produced.
 */
public final class AIResponseParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AIResponseParser() {
    }

    public static AIDecision parse(String rawText, String providerId) {
        if (rawText == null || rawText.isBlank()) {
            throw new ResponseValidationException(providerId + " returned an empty response");
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(extractJson(rawText));
        } catch (JsonProcessingException e) {
            throw new ResponseValidationException(providerId + " returned invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ResponseValidationException(providerId + " response is not a JSON object");
        }

        SignalAction action = parseAction(requireText(root, "action", providerId), providerId);
        double confidence = parseConfidence(root.get("confidence"), providerId);
        String reason = requireText(root, "reason", providerId);
        RiskLevel riskLevel = parseRiskLevel(requireText(root, "riskLevel", providerId), providerId);

        return new AIDecision(action, confidence, reason, riskLevel,
            optionalNumber(root, "suggestedStopLoss", providerId),
            optionalNumber(root, "suggestedTakeProfit", providerId),
            providerId);
    }

    /** Strip a ```json fence, or fall back to the outermost braces. */
    static String extractJson(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closingFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closingFence > firstNewline) {
                trimmed = trimmed.substring(firstNewline + 1, closingFence).trim();
            }
        }
        if (!trimmed.startsWith("{")) {
            int start = trimmed.indexOf('{');
            int end = trimmed.lastIndexOf('}');
            if (start >= 0 && end > start) {
                trimmed = trimmed.substring(start, end + 1);
            }
        }
        return trimmed;
    }

    private static String requireText(JsonNode root, String field, String providerId) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new ResponseValidationException(providerId + " response missing required field '" + field + "'");
        }
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new ResponseValidationException(providerId + " response field '" + field + "' must be a non-empty string");
        }
        return node.asText().trim();
    }

    private static SignalAction parseAction(String value, String providerId) {
        String normalized = value.toUpperCase(Locale.ROOT);
        // some models answer HOLD for "do nothing"
        if ("HOLD".equals(normalized)) {
            return SignalAction.WAIT;
        }
        try {
            return SignalAction.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ResponseValidationException(providerId + " response has unknown action '" + value + "'");
        }
    }

    private static RiskLevel parseRiskLevel(String value, String providerId) {
        try {
            return RiskLevel.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseValidationException(providerId + " response has unknown riskLevel '" + value + "'");
        }
    }

    private static double parseConfidence(JsonNode node, String providerId) {
        if (node == null || node.isNull()) {
            throw new ResponseValidationException(providerId + " response missing required field 'confidence'");
        }
        if (!node.isNumber()) {
            throw new ResponseValidationException(providerId + " response field 'confidence' must be a number");
        }
        double confidence = node.asDouble();
        if (confidence < 0 || confidence > 100) {
            throw new ResponseValidationException(providerId + " response confidence out of range: " + confidence);
        }
        return confidence;
    }

    private static Double optionalNumber(JsonNode root, String field, String providerId) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            throw new ResponseValidationException(providerId + " response field '" + field + "' must be a number");
        }
        return node.asDouble();
    }
}
