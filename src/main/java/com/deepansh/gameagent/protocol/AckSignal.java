package com.deepansh.gameagent.protocol;

/**
 * Lifecycle signal derived from an acknowledgment.
 *
 * @param type what the acknowledgment means for the game lifecycle
 * @param clue the newly extracted clue; non-null only for {@link Type#CLUE}
 */
public record AckSignal(Type type, String clue) {

    public enum Type {
        GAME_STARTED,
        CLUE,
        /** A clue acknowledgment that carried no usable payload */
        EMPTY_CLUE,
        /** Any other subject; forwarded to the generic acknowledgment hook */
        OTHER,
        /** Not an acknowledgment at all */
        NONE
    }

    public static AckSignal gameStarted() {
        return new AckSignal(Type.GAME_STARTED, null);
    }

    public static AckSignal clue(String clue) {
        return new AckSignal(Type.CLUE, clue);
    }

    public static AckSignal emptyClue() {
        return new AckSignal(Type.EMPTY_CLUE, null);
    }

    public static AckSignal other() {
        return new AckSignal(Type.OTHER, null);
    }

    public static AckSignal none() {
        return new AckSignal(Type.NONE, null);
    }
}
