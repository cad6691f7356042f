package com.deepansh.gameagent.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle phase of a game agent. Exactly one phase is current per agent.
 *
 * Staying in the same phase is always permitted and is a no-op;
 * PLAYING -> PLAYING is the command/clue self-loop.
 * IDLE and CONNECTED may go straight to GAME_OVER: a result always ends the
 * game, including one that began before a reconnect.
 */
public enum AgentPhase {
    IDLE,
    CONNECTING,
    CONNECTED,
    PLAYING,
    GAME_OVER,
    DISCONNECTED,
    ERRORED;

    private static final Map<AgentPhase, Set<AgentPhase>> ALLOWED = Map.of(
            IDLE,         EnumSet.of(CONNECTING, PLAYING, GAME_OVER, DISCONNECTED),
            CONNECTING,   EnumSet.of(CONNECTED, ERRORED, DISCONNECTED),
            CONNECTED,    EnumSet.of(PLAYING, GAME_OVER, ERRORED, DISCONNECTED),
            PLAYING,      EnumSet.of(GAME_OVER, ERRORED, DISCONNECTED),
            GAME_OVER,    EnumSet.of(CONNECTED, PLAYING, ERRORED, DISCONNECTED),
            DISCONNECTED, EnumSet.of(CONNECTING),
            ERRORED,      EnumSet.of(CONNECTING, DISCONNECTED)
    );

    public boolean canTransitionTo(AgentPhase target) {
        return this == target || ALLOWED.get(this).contains(target);
    }
}
