package com.signalbot.core.position;

import com.signalbot.core.model.Position;

import java.util.List;
import java.util.Optional;

/**
 * Durable position storage. Implementations must guarantee at most one OPEN position
 * per instrument and make the OPEN to CLOSED transition atomic.
 */
public interface PositionStore {

    Optional<Position> findOpen(String instrument);

    List<Position> findAllOpen();

    /**
     * @return the stored position with its id assigned
     * @throws com.signalbot.core.exception.DuplicateOpenPositionException if the instrument already has an OPEN position
     */
    Position insertOpen(Position position);

    /**
     * Persist a closed position if it is still OPEN in the store.
     *
     * @return false if the position was already closed
     */
    boolean close(Position closed);

    /** Most recent positions first. */
    List<Position> findHistory(String instrument, int limit);
}
