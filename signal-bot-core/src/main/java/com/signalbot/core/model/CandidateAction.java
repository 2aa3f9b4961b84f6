package com.signalbot.core.model;

/** Direction proposed by the hard filter before AI validation. */
public enum CandidateAction {
    BUY,
    SELL,
    NEUTRAL
}
