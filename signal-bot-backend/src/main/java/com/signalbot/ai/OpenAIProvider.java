package com.signalbot.ai;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.signalbot.config.ProviderSettings;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * OpenAI via Chat Completions in JSON mode.
 */
public final class OpenAIProvider extends HttpAIProvider {

    static final String TEXT_PATH = "/choices/0/message/content";
    private static final String SYSTEM_PROMPT =
        "You are a professional cryptocurrency trading analyst. Answer with a single JSON object.";

    public OpenAIProvider(Supplier<ProviderSettings> settingsLoader, JsonHttpTransport transport) {
        super(AIServiceType.OPENAI, settingsLoader, transport);
    }

    @Override
    protected CompletableFuture<String> complete(ProviderSettings settings, String prompt) {
        ObjectNode body = newObject();
        body.put("model", settings.model());
        body.put("temperature", settings.temperature());
        body.put("max_tokens", settings.maxOutputTokens());
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", prompt);
        body.putObject("response_format").put("type", "json_object");

        Map<String, String> headers = Map.of("Authorization", "Bearer " + settings.apiKey());

        CompletableFuture<String> sent = transport.post(settings.baseUrl() + "/v1/chat/completions", headers, toJson(body), settings.timeout());
        return cancelling(sent, sent.thenApply(response -> extractText(response, TEXT_PATH)));
    }
}
