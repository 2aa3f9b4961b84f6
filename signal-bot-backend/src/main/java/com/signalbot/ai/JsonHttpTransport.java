package com.signalbot.ai;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Minimal async JSON POST used by the AI adapters.
 */
@FunctionalInterface
public interface JsonHttpTransport {

    /**
     * @return the response body of a 2xx reply; other statuses fail with
     *         {@link com.signalbot.core.exception.ProviderException}
     */
    CompletableFuture<String> post(String url, Map<String, String> headers, String jsonBody, Duration timeout);
}
