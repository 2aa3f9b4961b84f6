package com.signalbot.config;

import com.signalbot.ai.AIServiceType;
import com.signalbot.core.exception.ProviderConfigurationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Duration;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settings of one AI provider, checked with Bean Validation before the adapter is used.
 */
public final class ProviderSettings {

    private static final ValidatorFactory VALIDATOR_FACTORY = Validation.buildDefaultValidatorFactory();

    @NotNull
    private final AIServiceType service;

    @NotBlank(message = "API key is required")
    private final String apiKey;

    @NotBlank(message = "Model is required")
    @Pattern(regexp = "^[A-Za-z0-9._:/-]+$", message = "Model name contains invalid characters")
    private final String model;

    @NotBlank(message = "Base URL is required")
    @Pattern(regexp = "^https?://.*", message = "Base URL must be an http(s) URL")
    private final String baseUrl;

    @DecimalMin(value = "0.0", message = "Temperature cannot be negative")
    @DecimalMax(value = "2.0", message = "Temperature cannot exceed 2.0")
    private final double temperature;

    @Positive(message = "Max output tokens must be positive")
    private final int maxOutputTokens;

    @PositiveOrZero(message = "Cost per call cannot be negative")
    private final double costPerCall;

    @Positive(message = "Requests per minute must be positive")
    private final int requestsPerMinute;

    @NotNull
    private final Duration timeout;

    public ProviderSettings(AIServiceType service, String apiKey, String model, String baseUrl,
                            double temperature, int maxOutputTokens, double costPerCall,
                            int requestsPerMinute, Duration timeout) {
        this.service = service;
        this.apiKey = apiKey;
        this.model = model;
        this.baseUrl = baseUrl;
        this.temperature = temperature;
        this.maxOutputTokens = maxOutputTokens;
        this.costPerCall = costPerCall;
        this.requestsPerMinute = requestsPerMinute;
        this.timeout = timeout;
    }

    /**
     * @throws ProviderConfigurationException listing every violation
     */
    public void validate() {
        Validator validator = VALIDATOR_FACTORY.getValidator();
        Set<ConstraintViolation<ProviderSettings>> violations = validator.validate(this);
        if (!violations.isEmpty()) {
            String errors = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .collect(Collectors.joining(", "));
            throw new ProviderConfigurationException(service + " configuration invalid: " + errors);
        }
    }

    public AIServiceType service() {
        return service;
    }

    public String apiKey() {
        return apiKey;
    }

    public String model() {
        return model;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public double temperature() {
        return temperature;
    }

    public int maxOutputTokens() {
        return maxOutputTokens;
    }

    public double costPerCall() {
        return costPerCall;
    }

    public int requestsPerMinute() {
        return requestsPerMinute;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public String toString() {
        // never log the key
        return "ProviderSettings[" + service + ", model=" + model + ", baseUrl=" + baseUrl + "]";
    }
}
