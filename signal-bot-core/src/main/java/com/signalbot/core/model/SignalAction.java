package com.signalbot.core.model;

public enum SignalAction {
    BUY,
    SELL,
    WAIT
}
