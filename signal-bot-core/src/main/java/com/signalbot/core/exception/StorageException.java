package com.signalbot.core.exception;

/**
 * Database read or write failed.
 */
public class StorageException extends SignalBotException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
