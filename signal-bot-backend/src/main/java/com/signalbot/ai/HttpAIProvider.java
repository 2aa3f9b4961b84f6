package com.signalbot.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.signalbot.config.ProviderSettings;
import com.signalbot.core.ai.AIProvider;
import com.signalbot.core.ai.AIResponseParser;
import com.signalbot.core.ai.PredictionRequest;
import com.signalbot.core.ai.PromptBuilder;
import com.signalbot.core.exception.ResponseValidationException;
import com.signalbot.core.model.AIDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Base for adapters that speak JSON over HTTP. Subclasses build the vendor request
 * and pull the generated text out of the vendor envelope; parsing the decision is shared.
 */
public abstract class HttpAIProvider implements AIProvider {
    private static final Logger logger = LoggerFactory.getLogger(HttpAIProvider.class);

    static final String HEALTH_CHECK_PROMPT = "Reply with the single word OK.";

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    private final AIServiceType service;
    private final Supplier<ProviderSettings> settingsLoader;
    protected final JsonHttpTransport transport;

    private volatile ProviderSettings settings;

    protected HttpAIProvider(AIServiceType service, Supplier<ProviderSettings> settingsLoader,
                             JsonHttpTransport transport) {
        this.service = service;
        this.settingsLoader = settingsLoader;
        this.transport = transport;
    }

    @Override
    public String serviceId() {
        return service.name();
    }

    @Override
    public void initialize() {
        ProviderSettings loaded = settingsLoader.get();
        this.settings = loaded;
        logger.info("🤖 {} provider initialized - Model: {}", serviceId(), loaded.model());
    }

    @Override
    public CompletableFuture<AIDecision> predict(PredictionRequest request) {
        String prompt = PromptBuilder.build(request);
        CompletableFuture<String> text = complete(settings(), prompt);
        return cancelling(text, text.thenApply(body -> AIResponseParser.parse(body, serviceId())));
    }

    @Override
    public CompletableFuture<Boolean> testConnection() {
        CompletableFuture<String> text = complete(settings(), HEALTH_CHECK_PROMPT);
        return cancelling(text, text.thenApply(body -> !body.isBlank()));
    }

    @Override
    public double costPerCall() {
        ProviderSettings current = settings;
        return current != null ? current.costPerCall() : service.defaultCostPerCall();
    }

    /**
     * Send the prompt and return the generated text.
     */
    protected abstract CompletableFuture<String> complete(ProviderSettings settings, String prompt);

    protected ProviderSettings settings() {
        ProviderSettings current = settings;
        if (current == null) {
            throw new IllegalStateException(serviceId() + " provider used before initialize()");
        }
        return current;
    }

    /**
     * Cancelling {@code derived} also cancels {@code source}, down to the HTTP call.
     */
    protected static <T, R> CompletableFuture<R> cancelling(CompletableFuture<T> source, CompletableFuture<R> derived) {
        derived.whenComplete((ignored, failure) -> {
            if (derived.isCancelled()) {
                source.cancel(true);
            }
        });
        return derived;
    }

    protected static ObjectNode newObject() {
        return MAPPER.createObjectNode();
    }

    protected static String toJson(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize request body", e);
        }
    }

    /**
     * Read a vendor envelope and follow the path to the generated text.
     *
     * @param path JSON pointer, e.g. {@code /content/0/text}
     */
    protected String extractText(String body, String path) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ResponseValidationException(serviceId() + " returned a non-JSON envelope", e);
        }
        JsonNode text = root == null ? null : root.at(path);
        if (text == null || text.isMissingNode() || !text.isTextual()) {
            throw new ResponseValidationException(serviceId() + " response has no text at " + path);
        }
        return text.asText();
    }
}
