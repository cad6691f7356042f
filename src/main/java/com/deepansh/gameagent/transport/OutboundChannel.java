package com.deepansh.gameagent.transport;

/**
 * Write side of a game connection.
 */
@FunctionalInterface
public interface OutboundChannel {

    /**
     * Send one serialized message to the server.
     *
     * @throws com.deepansh.gameagent.exception.TransportException if the message cannot be written
     */
    void send(String payload);
}
