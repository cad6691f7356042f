package com.deepansh.gameagent.model;

import java.util.Locale;

/**
 * Outcome carried by a result event.
 */
public enum ResultOutcome {
    WIN,
    LOSS,
    TIMEOUT,
    ERROR,
    ABANDONED,
    UNKNOWN;

    /** Maps the server's result string; null, blank or unrecognized values become UNKNOWN. */
    public static ResultOutcome from(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "win", "won" -> WIN;
            case "loss", "lost", "lose" -> LOSS;
            case "timeout" -> TIMEOUT;
            case "error" -> ERROR;
            case "abandoned" -> ABANDONED;
            default -> UNKNOWN;
        };
    }

    /** LOSS, TIMEOUT and ABANDONED count against the agent; ERROR and UNKNOWN count only as played. */
    public boolean isLoss() {
        return this == LOSS || this == TIMEOUT || this == ABANDONED;
    }
}
