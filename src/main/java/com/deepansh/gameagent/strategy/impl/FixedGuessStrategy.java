package com.deepansh.gameagent.strategy.impl;

import com.deepansh.gameagent.core.GameContext;
import com.deepansh.gameagent.model.GameMessage;
import com.deepansh.gameagent.strategy.GameStrategyAdapter;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Smoke-test strategy: answers every command with the same word.
 * Useful to check the connection and the lifecycle end-to-end against a real server.
 */
public class FixedGuessStrategy extends GameStrategyAdapter {

    private final String guess;

    public FixedGuessStrategy(String guess) {
        if (guess == null || guess.isBlank()) {
            throw new IllegalArgumentException("Fixed guess must not be blank");
        }
        this.guess = guess.trim();
    }

    @Override
    public CompletableFuture<Optional<String>> makeMove(GameMessage message, GameContext context) {
        return CompletableFuture.completedFuture(Optional.of(guess));
    }

    public String getGuess() {
        return guess;
    }
}
