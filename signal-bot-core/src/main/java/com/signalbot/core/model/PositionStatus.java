package com.signalbot.core.model;

public enum PositionStatus {
    OPEN,
    CLOSED
}
