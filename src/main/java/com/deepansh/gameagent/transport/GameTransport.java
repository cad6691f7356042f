package com.deepansh.gameagent.transport;

import java.time.Duration;
import java.util.Optional;

/**
 * Duplex text channel to a game server.
 *
 * Implementations buffer inbound frames in arrival order so nothing is lost
 * while the agent is busy with a move. Once the connection is gone, every
 * further {@link #receive} throws a TransportException after the buffered
 * frames are drained.
 */
public interface GameTransport extends OutboundChannel, AutoCloseable {

    /**
     * Wait up to {@code timeout} for the next inbound frame.
     *
     * @return the frame, or empty when the timeout elapsed
     * @throws com.deepansh.gameagent.exception.TransportException if the connection closed or failed
     */
    Optional<String> receive(Duration timeout) throws InterruptedException;

    boolean isOpen();

    /** Idempotent; never throws. */
    @Override
    void close();
}
