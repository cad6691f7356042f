package com.deepansh.gameagent.model;

/**
 * Lifecycle kind of an inbound server payload.
 * Every payload maps to exactly one kind; anything unrecognized is {@link #UNKNOWN}.
 */
public enum MessageKind {
    GAME_START,
    ACKNOWLEDGMENT,
    COMMAND,
    RESULT,
    ERROR,
    UNKNOWN
}
