package com.deepansh.gameagent.strategy;

import com.deepansh.gameagent.core.GameContext;
import com.deepansh.gameagent.model.GameMessage;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Contract every game strategy implements.
 *
 * The four lifecycle methods are mandatory; the remaining hooks have defaults.
 * Callbacks run on the agent's receive loop thread, one at a time, in the
 * order the server sent the events. Exceptions thrown from a callback are
 * logged by the runtime and never stop the agent.
 */
public interface GameStrategy {

    /** A new game began. Accumulated clues and game state have already been cleared. */
    void onGameStarted(GameMessage message, GameContext context);

    /**
     * A clue arrived. {@code clue} is the single new clue; the full list is
     * available through {@link GameContext#getClues()}.
     */
    void onClueReceived(String clue, GameMessage message, GameContext context);

    /**
     * Produce the move for a command. Called at most once per command and
     * never while a previous move is still pending.
     *
     * The returned future may complete later (e.g. after a remote model call).
     * An empty result means "no move" and nothing is sent; an exceptional
     * completion is logged and reported through {@link #onMoveFailed}.
     */
    CompletableFuture<Optional<String>> makeMove(GameMessage message, GameContext context);

    /** The game ended; stats already include this result. */
    void onGameEnded(GameMessage message, GameContext context);

    /**
     * Build the wire payload for {@code move}. Empty means the command is
     * intentionally skipped. Default: matchId, gameId, otp (when supplied) and
     * the move under "guess".
     */
    default Optional<Map<String, Object>> buildResponse(GameMessage message, String move, GameContext context) {
        return Optional.of(MoveResponses.correlated(message, context, MoveResponses.GUESS, move));
    }

    /** Acknowledgments with a subject the runtime does not recognize. */
    default void onAcknowledgment(GameMessage message, GameContext context) {
    }

    /** Error events from the server. The phase is not changed. */
    default void onError(GameMessage message, GameContext context) {
    }

    /** Move generation or response building failed; nothing was sent for this command. */
    default void onMoveFailed(GameMessage message, Throwable error, GameContext context) {
    }

    default void onConnected(GameContext context) {
    }

    default void onDisconnected(GameContext context) {
    }

    default String getName() {
        return getClass().getSimpleName();
    }
}
