package com.deepansh.gameagent.exception;

/**
 * Connect failure, send failure, dropped connection or receive timeout.
 * Recoverable: handled by the reconnection supervisor up to the attempt budget.
 */
public class TransportException extends AgentException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
