package com.signalbot.core.exception;

/**
 * Store rejected a second OPEN position for the same instrument.
 */
public class DuplicateOpenPositionException extends SignalBotException {

    private final String instrument;

    public DuplicateOpenPositionException(String instrument, Throwable cause) {
        super("Position already open for " + instrument, cause);
        this.instrument = instrument;
    }

    public String getInstrument() {
        return instrument;
    }
}
