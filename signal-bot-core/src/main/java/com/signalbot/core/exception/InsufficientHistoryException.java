package com.signalbot.core.exception;

public class InsufficientHistoryException extends SignalBotException {

    private final int required;
    private final int actual;

    public InsufficientHistoryException(int required, int actual) {
        super("Insufficient history: need " + required + " candles, have " + actual);
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
