package com.signalbot.core.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
