package com.deepansh.gameagent.core;

import com.deepansh.gameagent.model.AgentPhase;
import com.deepansh.gameagent.model.GameMessage;
import com.deepansh.gameagent.model.GameStats;
import com.deepansh.gameagent.observability.StatisticsRecorder;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Per-agent game state handed to every strategy callback.
 *
 * Owned and mutated by {@link LifecycleStateMachine}; strategies see the
 * clues read-only and get a scratch map ({@link #getGameState()}) that is
 * cleared with the clues on every game start. Safe to read from any thread.
 */
public class GameContext {

    private final List<String> clues = new CopyOnWriteArrayList<>();
    private final Map<String, Object> gameState = new ConcurrentHashMap<>();
    private final StatisticsRecorder stats;
    private final Supplier<AgentPhase> phase;

    private volatile String matchId;
    private volatile String gameId;
    private volatile String playerId;

    GameContext(StatisticsRecorder stats, Supplier<AgentPhase> phase) {
        this.stats = stats;
        this.phase = phase;
    }

    public String getMatchId() {
        return matchId;
    }

    public String getGameId() {
        return gameId;
    }

    public String getPlayerId() {
        return playerId;
    }

    /** Clues received since the last game start, in arrival order. Read-only live view. */
    public List<String> getClues() {
        return Collections.unmodifiableList(clues);
    }

    /** Free-form strategy storage, cleared on game start. */
    public Map<String, Object> getGameState() {
        return gameState;
    }

    public GameStats getStats() {
        return stats.snapshot();
    }

    public AgentPhase getPhase() {
        return phase.get();
    }

    void beginGame(GameMessage message) {
        clues.clear();
        gameState.clear();
        matchId = message.getMatchId();
        gameId = message.getGameId();
        playerId = message.getPlayerId();
    }

    void addClue(String clue) {
        clues.add(clue);
    }
}
