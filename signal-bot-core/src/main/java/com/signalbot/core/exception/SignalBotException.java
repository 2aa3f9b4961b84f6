package com.signalbot.core.exception;

/**
 * Base type for failures raised by the signal pipeline.
 */
public class SignalBotException extends RuntimeException {

    public SignalBotException(String message) {
        super(message);
    }

    public SignalBotException(String message, Throwable cause) {
        super(message, cause);
    }
}
