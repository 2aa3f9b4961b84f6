package com.signalbot.core.exception;

/**
 * No provider could serve the request: retries and failover exhausted, no provider
 * ready, or the daily cost budget spent. Individual causes are attached as suppressed.
 */
public class ProviderUnavailableException extends SignalBotException {

    public ProviderUnavailableException(String message) {
        super(message);
    }
}
