package com.deepansh.gameagent.strategy;

import com.deepansh.gameagent.core.GameContext;
import com.deepansh.gameagent.model.GameMessage;

/**
 * Convenience base with no-op lifecycle callbacks. Subclasses only need {@link #makeMove}.
 */
public abstract class GameStrategyAdapter implements GameStrategy {

    @Override
    public void onGameStarted(GameMessage message, GameContext context) {
    }

    @Override
    public void onClueReceived(String clue, GameMessage message, GameContext context) {
    }

    @Override
    public void onGameEnded(GameMessage message, GameContext context) {
    }
}
