package com.deepansh.gameagent.model;

import java.util.Locale;

/**
 * Per-letter feedback for Wordle-style guesses.
 */
public enum Feedback {
    CORRECT,
    PRESENT,
    ABSENT;

    /**
     * Servers disagree on tokens ("green", "g", "correct" ...).
     * Anything that is not a known correct/present token is ABSENT.
     */
    public static Feedback normalize(String token) {
        if (token == null) return ABSENT;
        return switch (token.trim().toLowerCase(Locale.ROOT)) {
            case "correct", "green", "g" -> CORRECT;
            case "present", "yellow", "y" -> PRESENT;
            default -> ABSENT;
        };
    }
}
