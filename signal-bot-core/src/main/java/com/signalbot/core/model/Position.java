package com.signalbot.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Long position. OPEN positions carry no exit data; CLOSED ones carry all of it.
 * Transitions only go OPEN -> CLOSED, via {@link #close}.
 */
public record Position(
    Long id,
    String instrument,
    double entryPrice,
    double size,
    PositionStatus status,
    Instant openTime,
    Double exitPrice,
    Double pnl,
    Instant closeTime,
    CloseReason closeReason
) {
    public Position {
        Objects.requireNonNull(instrument, "instrument");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(openTime, "openTime");
        if (entryPrice <= 0) {
            throw new IllegalArgumentException("Entry price must be positive: " + entryPrice);
        }
        if (size <= 0) {
            throw new IllegalArgumentException("Size must be positive: " + size);
        }
    }

    public static Position open(String instrument, double entryPrice, double size, Instant openTime) {
        return new Position(null, instrument, entryPrice, size, PositionStatus.OPEN,
            openTime, null, null, null, null);
    }

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public Position withId(long newId) {
        return new Position(newId, instrument, entryPrice, size, status,
            openTime, exitPrice, pnl, closeTime, closeReason);
    }

    /** Realized (or unrealized) PnL at the given price, long only. */
    public double pnlAt(double price) {
        return (price - entryPrice) * size;
    }

    public Position close(double price, Instant when, CloseReason reason) {
        if (!isOpen()) {
            throw new IllegalStateException("Position " + id + " is already closed");
        }
        return new Position(id, instrument, entryPrice, size, PositionStatus.CLOSED,
            openTime, price, pnlAt(price), when, reason);
    }
}
