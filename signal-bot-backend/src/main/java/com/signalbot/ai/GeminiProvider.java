package com.signalbot.ai;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.signalbot.config.ProviderSettings;
import com.signalbot.core.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Google Gemini via {@code generateContent}.
 *
 * <p>The structured call asks for a JSON response with generation settings. If it fails
 * for any reason, the same prompt is sent once more as a plain REST request with no
 * generation config, which some models and API versions accept when the structured
 * form is rejected. Each leg gets half of the configured timeout so the fallback still
 * answers inside the caller's budget when the structured leg times out.
 */
public final class GeminiProvider extends HttpAIProvider {
    private static final Logger logger = LoggerFactory.getLogger(GeminiProvider.class);

    static final String TEXT_PATH = "/candidates/0/content/parts/0/text";

    public GeminiProvider(Supplier<ProviderSettings> settingsLoader, JsonHttpTransport transport) {
        super(AIServiceType.GEMINI, settingsLoader, transport);
    }

    @Override
    protected CompletableFuture<String> complete(ProviderSettings settings, String prompt) {
        Duration legTimeout = legTimeout(settings);
        CompletableFuture<String> structured = structuredCall(settings, prompt, legTimeout);
        AtomicReference<CompletableFuture<String>> inFlight = new AtomicReference<>(structured);

        CompletableFuture<String> result = structured.exceptionallyCompose(failure -> {
            Throwable cause = RetryPolicy.unwrap(failure);
            if (cause instanceof CancellationException) {
                return CompletableFuture.failedFuture(cause);
            }
            logger.warn("Gemini structured call failed ({}), trying plain REST", cause.getMessage());
            CompletableFuture<String> rest = restCall(settings, prompt, legTimeout);
            inFlight.set(rest);
            return rest.whenComplete((text, restFailure) -> {
                if (restFailure != null) {
                    RetryPolicy.unwrap(restFailure).addSuppressed(cause);
                }
            });
        });
        result.whenComplete((text, failure) -> {
            if (result.isCancelled()) {
                inFlight.get().cancel(true);
            }
        });
        return result;
    }

    static Duration legTimeout(ProviderSettings settings) {
        return settings.timeout().dividedBy(2);
    }

    CompletableFuture<String> structuredCall(ProviderSettings settings, String prompt, Duration timeout) {
        ObjectNode body = newObject();
        ObjectNode content = body.putArray("contents").addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", prompt);
        ObjectNode generationConfig = body.putObject("generationConfig");
        generationConfig.put("temperature", settings.temperature());
        generationConfig.put("maxOutputTokens", settings.maxOutputTokens());
        generationConfig.put("responseMimeType", "application/json");

        CompletableFuture<String> sent = transport.post(endpoint(settings), headers(settings), toJson(body), timeout);
        return cancelling(sent, sent.thenApply(response -> extractText(response, TEXT_PATH)));
    }

    CompletableFuture<String> restCall(ProviderSettings settings, String prompt, Duration timeout) {
        ObjectNode body = newObject();
        body.putArray("contents").addObject()
            .putArray("parts").addObject().put("text", prompt);

        CompletableFuture<String> sent = transport.post(endpoint(settings), headers(settings), toJson(body), timeout);
        return cancelling(sent, sent.thenApply(response -> extractText(response, TEXT_PATH)));
    }

    static String endpoint(ProviderSettings settings) {
        return settings.baseUrl() + "/v1beta/models/" + settings.model() + ":generateContent";
    }

    private static Map<String, String> headers(ProviderSettings settings) {
        return Map.of("x-goog-api-key", settings.apiKey());
    }
}
