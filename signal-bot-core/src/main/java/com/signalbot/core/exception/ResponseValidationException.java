package com.signalbot.core.exception;

/**
 * AI output that is not a well-formed decision. Never retried.
 */
public class ResponseValidationException extends SignalBotException {

    public ResponseValidationException(String message) {
        super(message);
    }

    public ResponseValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
