package com.signalbot.core.position;

import com.signalbot.core.model.CloseReason;

import java.util.Optional;

/**
 * Take-profit and stop-loss distances from entry, in percent.
 */
public record ExitThresholds(double takeProfitPercent, double stopLossPercent) {

    public ExitThresholds {
        if (takeProfitPercent <= 0 || stopLossPercent <= 0 || stopLossPercent >= 100) {
            throw new IllegalArgumentException(
                "Invalid exit thresholds: TP=" + takeProfitPercent + "%, SL=" + stopLossPercent + "%");
        }
    }

    /** TP +6%, SL -3%. */
    public static ExitThresholds defaults() {
        return new ExitThresholds(6.0, 3.0);
    }

    public double takeProfitPrice(double entryPrice) {
        return entryPrice * (1 + takeProfitPercent / 100.0);
    }

    public double stopLossPrice(double entryPrice) {
        return entryPrice * (1 - stopLossPercent / 100.0);
    }

    /** Exits trigger only on a strict crossing; touching a level is not enough. */
    public Optional<CloseReason> exitReason(double entryPrice, double currentPrice) {
        if (currentPrice > takeProfitPrice(entryPrice)) {
            return Optional.of(CloseReason.TAKE_PROFIT);
        }
        if (currentPrice < stopLossPrice(entryPrice)) {
            return Optional.of(CloseReason.STOP_LOSS);
        }
        return Optional.empty();
    }
}
