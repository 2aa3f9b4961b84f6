package com.signalbot.core.position;

import com.signalbot.core.exception.DuplicateOpenPositionException;
import com.signalbot.core.market.MarketDataSource;
import com.signalbot.core.model.Candle;
import com.signalbot.core.model.CloseReason;
import com.signalbot.core.model.Position;
import com.signalbot.core.model.Timeframe;
import com.signalbot.core.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Opens long positions and closes them at take-profit or stop-loss.
 *
 * <p>Opens are idempotent per instrument: check-then-insert runs under a per-instrument
 * lock and the store enforces uniqueness as a second line. Closing is a conditional
 * store update, so a position is closed at most once.
 */
public final class PositionLifecycleManager {
    private static final Logger logger = LoggerFactory.getLogger(PositionLifecycleManager.class);

    public enum OpenStatus {
        OPENED,
        ALREADY_OPEN
    }

    public record OpenResult(OpenStatus status, Position position) {
    }

    /**
     * @param skipped instruments whose price could not be resolved this tick
     */
    public record MonitorReport(int checked, List<Position> closed, List<String> skipped) {
    }

    private final PositionStore store;
    private final MarketDataSource marketData;
    private final ExitThresholds thresholds;
    private final Clock clock;
    private final ConcurrentHashMap<String, ReentrantLock> instrumentLocks = new ConcurrentHashMap<>();

    public PositionLifecycleManager(PositionStore store, MarketDataSource marketData,
                                    ExitThresholds thresholds, Clock clock) {
        this.store = store;
        this.marketData = marketData;
        this.thresholds = thresholds;
        this.clock = clock;
    }

    /**
     * Open a long position unless one is already open for the instrument.
     *
     * @param price entry price, or null to use the current market price
     */
    public CompletableFuture<OpenResult> open(String instrument, Double price, double size) {
        Optional<Position> existing = store.findOpen(instrument);
        if (existing.isPresent()) {
            logger.info("Position already open for {} (id={}), skipping buy", instrument, existing.get().id());
            return CompletableFuture.completedFuture(new OpenResult(OpenStatus.ALREADY_OPEN, existing.get()));
        }

        CompletableFuture<Double> entryPrice = price != null && price > 0
            ? CompletableFuture.completedFuture(price)
            : resolvePrice(instrument);
        return entryPrice.thenApply(resolved -> openAt(instrument, resolved, size));
    }

    /**
     * Check every open position against its exit levels. Positions whose price cannot
     * be resolved are skipped for this tick.
     */
    public CompletableFuture<MonitorReport> monitor() {
        List<Position> open = store.findAllOpen();
        if (open.isEmpty()) {
            return CompletableFuture.completedFuture(new MonitorReport(0, List.of(), List.of()));
        }

        List<Position> closed = Collections.synchronizedList(new ArrayList<>());
        List<String> skipped = Collections.synchronizedList(new ArrayList<>());

        List<CompletableFuture<Void>> checks = open.stream()
            .map(position -> resolvePrice(position.instrument())
                .thenAccept(price -> checkExit(position, price).ifPresent(closed::add))
                .exceptionally(failure -> {
                    logger.warn("⚠️ Skipping exit check for {}: {}", position.instrument(),
                        RetryPolicy.unwrap(failure).getMessage());
                    skipped.add(position.instrument());
                    return null;
                }))
            .toList();

        return CompletableFuture.allOf(checks.toArray(new CompletableFuture[0]))
            .thenApply(ignored -> new MonitorReport(open.size(), List.copyOf(closed), List.copyOf(skipped)));
    }

    /** Close the open position for the instrument at market, if any. */
    public CompletableFuture<Optional<Position>> closeOnSignal(String instrument) {
        Optional<Position> open = store.findOpen(instrument);
        if (open.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return resolvePrice(instrument)
            .thenApply(price -> closeAt(open.get(), price, CloseReason.SELL_SIGNAL));
    }

    /**
     * Current price, falling back to the close of the latest one-minute candle when
     * the ticker request fails.
     */
    public CompletableFuture<Double> resolvePrice(String instrument) {
        return marketData.fetchPrice(instrument)
            .thenApply(price -> {
                if (price == null || !(price > 0)) {
                    throw new IllegalStateException("Invalid price for " + instrument + ": " + price);
                }
                return price;
            })
            .exceptionallyCompose(failure -> {
                logger.warn("Ticker price failed for {} ({}), falling back to latest 1m candle",
                    instrument, RetryPolicy.unwrap(failure).getMessage());
                return marketData.fetchCandles(instrument, Timeframe.M1, null, 1)
                    .thenApply(candles -> {
                        if (candles.isEmpty()) {
                            throw new IllegalStateException("No price available for " + instrument);
                        }
                        Candle last = candles.get(candles.size() - 1);
                        return last.close();
                    });
            });
    }

    public List<Position> openPositions() {
        return store.findAllOpen();
    }

    private OpenResult openAt(String instrument, double price, double size) {
        ReentrantLock lock = instrumentLocks.computeIfAbsent(instrument, key -> new ReentrantLock());
        lock.lock();
        try {
            Optional<Position> existing = store.findOpen(instrument);
            if (existing.isPresent()) {
                logger.info("Position already open for {} (id={}), skipping buy", instrument, existing.get().id());
                return new OpenResult(OpenStatus.ALREADY_OPEN, existing.get());
            }
            try {
                Position saved = store.insertOpen(Position.open(instrument, price, size, clock.instant()));
                logger.atInfo()
                    .addKeyValue("positionId", saved.id())
                    .addKeyValue("instrument", instrument)
                    .addKeyValue("entryPrice", price)
                    .addKeyValue("size", size)
                    .log("📈 Opened {} position: {} @ {} (TP {} / SL {})", instrument, size, price,
                        String.format("%.4f", thresholds.takeProfitPrice(price)),
                        String.format("%.4f", thresholds.stopLossPrice(price)));
                return new OpenResult(OpenStatus.OPENED, saved);
            } catch (DuplicateOpenPositionException e) {
                Position current = store.findOpen(instrument).orElseThrow(() -> e);
                logger.info("Concurrent open detected for {}, keeping position {}", instrument, current.id());
                return new OpenResult(OpenStatus.ALREADY_OPEN, current);
            }
        } finally {
            lock.unlock();
        }
    }

    private Optional<Position> checkExit(Position position, double price) {
        Optional<CloseReason> reason = thresholds.exitReason(position.entryPrice(), price);
        if (reason.isEmpty()) {
            logger.debug("{} @ {} within TP/SL band (entry {})", position.instrument(), price, position.entryPrice());
            return Optional.empty();
        }
        return closeAt(position, price, reason.get());
    }

    private Optional<Position> closeAt(Position position, double price, CloseReason reason) {
        ReentrantLock lock = instrumentLocks.computeIfAbsent(position.instrument(), key -> new ReentrantLock());
        lock.lock();
        try {
            Position closed = position.close(price, clock.instant(), reason);
            if (!store.close(closed)) {
                logger.debug("Position {} was already closed", position.id());
                return Optional.empty();
            }
            String icon = closed.pnl() >= 0 ? "💰" : "🛑";
            logger.atInfo()
                .addKeyValue("positionId", closed.id())
                .addKeyValue("instrument", closed.instrument())
                .addKeyValue("exitPrice", price)
                .addKeyValue("pnl", closed.pnl())
                .addKeyValue("reason", reason)
                .log("{} Closed {} position {} @ {} ({}), PnL {}", icon, closed.instrument(), closed.id(),
                    price, reason, String.format("%.4f", closed.pnl()));
            return Optional.of(closed);
        } finally {
            lock.unlock();
        }
    }
}
