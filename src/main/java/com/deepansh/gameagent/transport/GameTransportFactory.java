package com.deepansh.gameagent.transport;

import java.time.Duration;

@FunctionalInterface
public interface GameTransportFactory {

    /**
     * Open a new connection, blocking for at most {@code connectTimeout}.
     *
     * @throws com.deepansh.gameagent.exception.TransportException on failure or timeout
     */
    GameTransport open(String url, Duration connectTimeout);
}
