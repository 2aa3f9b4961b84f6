package com.signalbot.core.model;

public enum CloseReason {
    TAKE_PROFIT,
    STOP_LOSS,
    SELL_SIGNAL
}
