package com.deepansh.gameagent.observability;

import com.deepansh.gameagent.model.GameStats;
import com.deepansh.gameagent.model.ResultOutcome;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Accumulates per-game and aggregate counters for one agent.
 *
 * Written only by the lifecycle state machine at game start, move sent and
 * game end; counters never go down. Readers get immutable snapshots and may
 * call {@link #snapshot()} from any thread at any time.
 */
@Slf4j
public class StatisticsRecorder {

    private final Clock clock;

    private int gamesPlayed;
    private int gamesWon;
    private int gamesLost;
    private int totalMoves;
    private int currentGameMoves;
    private Instant gameStartedAt;
    private Instant gameEndedAt;

    public StatisticsRecorder(Clock clock) {
        this.clock = clock;
    }

    public synchronized void recordGameStarted() {
        currentGameMoves = 0;
        gameStartedAt = clock.instant();
        gameEndedAt = null;
    }

    public synchronized void recordMoveSent() {
        currentGameMoves++;
        totalMoves++;
    }

    /**
     * Every result counts as a played game; WIN adds a win, LOSS / TIMEOUT / ABANDONED a loss.
     */
    public synchronized GameStats recordGameEnded(ResultOutcome outcome) {
        gamesPlayed++;
        if (outcome == ResultOutcome.WIN) {
            gamesWon++;
        } else if (outcome != null && outcome.isLoss()) {
            gamesLost++;
        }
        gameEndedAt = clock.instant();

        GameStats stats = snapshot();
        Duration duration = stats.getLastGameDuration();
        log.info("Game finished [outcome={}, moves={}, duration={}ms] played={} won={} lost={} winRate={}%",
                outcome, currentGameMoves, duration != null ? duration.toMillis() : -1,
                gamesPlayed, gamesWon, gamesLost, String.format("%.1f", stats.getWinRate() * 100));
        return stats;
    }

    public synchronized GameStats snapshot() {
        return GameStats.builder()
                .gamesPlayed(gamesPlayed)
                .gamesWon(gamesWon)
                .gamesLost(gamesLost)
                .totalMoves(totalMoves)
                .currentGameMoves(currentGameMoves)
                .gameStartedAt(gameStartedAt)
                .gameEndedAt(gameEndedAt)
                .build();
    }
}
