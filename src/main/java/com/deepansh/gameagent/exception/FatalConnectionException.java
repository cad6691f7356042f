package com.deepansh.gameagent.exception;

import lombok.Getter;

/**
 * Reconnect attempts exhausted. Terminal: the agent is disconnected and does not restart itself.
 */
@Getter
public class FatalConnectionException extends AgentException {

    private final int attempts;

    public FatalConnectionException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }
}
