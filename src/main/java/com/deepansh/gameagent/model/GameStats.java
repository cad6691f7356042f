package com.deepansh.gameagent.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time snapshot of an agent's game statistics.
 */
@Value
@Builder(toBuilder = true)
public class GameStats {

    int gamesPlayed;
    int gamesWon;
    int gamesLost;
    int totalMoves;
    int currentGameMoves;
    Instant gameStartedAt;
    Instant gameEndedAt;

    public double getWinRate() {
        return gamesPlayed == 0 ? 0.0 : (double) gamesWon / gamesPlayed;
    }

    public double getAverageMovesPerGame() {
        return gamesPlayed == 0 ? 0.0 : (double) totalMoves / gamesPlayed;
    }

    /** Duration of the most recent finished game, or null while one is running. */
    public Duration getLastGameDuration() {
        if (gameStartedAt == null || gameEndedAt == null || gameEndedAt.isBefore(gameStartedAt)) {
            return null;
        }
        return Duration.between(gameStartedAt, gameEndedAt);
    }
}
