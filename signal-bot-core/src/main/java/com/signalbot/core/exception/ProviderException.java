package com.signalbot.core.exception;

/**
 * Failure talking to an external service (AI provider or exchange).
 * The retryable flag drives the retry executor's classification.
 */
public class ProviderException extends SignalBotException {

    private final String providerId;
    private final boolean retryable;

    public ProviderException(String providerId, String message, boolean retryable) {
        super(message);
        this.providerId = providerId;
        this.retryable = retryable;
    }

    public ProviderException(String providerId, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.retryable = retryable;
    }

    /** HTTP 429 and 5xx are transient, every other error status is not. */
    public static ProviderException forHttpStatus(String providerId, int status, String body) {
        boolean transientStatus = status == 429 || status >= 500;
        return new ProviderException(providerId,
            providerId + " returned HTTP " + status + ": " + abbreviate(body), transientStatus);
    }

    public String getProviderId() {
        return providerId;
    }

    public boolean isRetryable() {
        return retryable;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
