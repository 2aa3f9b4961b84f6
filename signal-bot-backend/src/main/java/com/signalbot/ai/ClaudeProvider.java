package com.signalbot.ai;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.signalbot.config.ProviderSettings;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Anthropic Claude via the Messages API.
 */
public final class ClaudeProvider extends HttpAIProvider {

    static final String API_VERSION = "2023-06-01";
    static final String TEXT_PATH = "/content/0/text";

    public ClaudeProvider(Supplier<ProviderSettings> settingsLoader, JsonHttpTransport transport) {
        super(AIServiceType.CLAUDE, settingsLoader, transport);
    }

    @Override
    protected CompletableFuture<String> complete(ProviderSettings settings, String prompt) {
        ObjectNode body = newObject();
        body.put("model", settings.model());
        body.put("max_tokens", settings.maxOutputTokens());
        body.put("temperature", settings.temperature());
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", prompt);

        Map<String, String> headers = Map.of(
            "x-api-key", settings.apiKey(),
            "anthropic-version", API_VERSION);

        CompletableFuture<String> sent = transport.post(settings.baseUrl() + "/v1/messages", headers, toJson(body), settings.timeout());
        return cancelling(sent, sent.thenApply(response -> extractText(response, TEXT_PATH)));
    }
}
