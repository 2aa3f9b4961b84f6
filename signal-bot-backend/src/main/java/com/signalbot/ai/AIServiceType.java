package com.signalbot.ai;

import java.util.Locale;

/**
 * Supported AI services with their defaults.
 */
public enum AIServiceType {
    GEMINI("gemini-2.5-flash", "https://generativelanguage.googleapis.com", 0.0002, 30),
    CLAUDE("claude-3-haiku-20240307", "https://api.anthropic.com", 0.00025, 50),
    OPENAI("gpt-4o-mini", "https://api.openai.com", 0.002, 30);

    private final String defaultModel;
    private final String defaultBaseUrl;
    private final double defaultCostPerCall;
    private final int defaultRequestsPerMinute;

    AIServiceType(String defaultModel, String defaultBaseUrl, double defaultCostPerCall, int defaultRequestsPerMinute) {
        this.defaultModel = defaultModel;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultCostPerCall = defaultCostPerCall;
        this.defaultRequestsPerMinute = defaultRequestsPerMinute;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    public double defaultCostPerCall() {
        return defaultCostPerCall;
    }

    public int defaultRequestsPerMinute() {
        return defaultRequestsPerMinute;
    }

    public static AIServiceType parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown AI service: " + value, e);
        }
    }
}
