package com.deepansh.gameagent.strategy.impl;

import com.deepansh.gameagent.core.GameContext;
import com.deepansh.gameagent.model.GameMessage;
import com.deepansh.gameagent.strategy.GameStrategyAdapter;
import com.deepansh.gameagent.strategy.MoveResponses;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Coordinate mover for 2D grid games (tic-tac-toe style boards).
 *
 * Coordinates are column letter + 1-based row, e.g. "B2". The first move
 * takes the center; later moves walk the board in row-major order, skipping
 * cells this strategy already played. The grid size comes from the
 * game-start message ("gridSize"), default 3.
 */
@Slf4j
public class GridMoveStrategy extends GameStrategyAdapter {

    public static final String GRID_SIZE = "gridSize";
    public static final String POSITION = "position";
    public static final int DEFAULT_GRID_SIZE = 3;

    private static final String MOVES = "gridMoves";

    @Override
    public void onGameStarted(GameMessage message, GameContext context) {
        Integer size = message.integer(GRID_SIZE);
        if (size == null && message.getAckPayload() != null && message.getAckPayload().path(GRID_SIZE).canConvertToInt()) {
            size = message.getAckPayload().path(GRID_SIZE).asInt();
        }
        int gridSize = size != null && size > 0 && size <= 26 ? size : DEFAULT_GRID_SIZE;
        context.getGameState().put(GRID_SIZE, gridSize);
        context.getGameState().put(MOVES, new ArrayList<String>());
        log.info("New grid game {}x{} [gameId={}]", gridSize, gridSize, context.getGameId());
    }

    @Override
    public CompletableFuture<Optional<String>> makeMove(GameMessage message, GameContext context) {
        int size = (Integer) context.getGameState().getOrDefault(GRID_SIZE, DEFAULT_GRID_SIZE);
        List<String> played = movesOf(context);

        String move = nextMove(size, played);
        if (move == null) {
            log.warn("No free cell left on the {}x{} grid", size, size);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        played.add(move);
        return CompletableFuture.completedFuture(Optional.of(move));
    }

    @Override
    public void onGameEnded(GameMessage message, GameContext context) {
        log.info("Grid game ended, my moves: {}", movesOf(context));
    }

    /** Grid servers expect "move" and "position" instead of "guess". */
    @Override
    public Optional<Map<String, Object>> buildResponse(GameMessage message, String move, GameContext context) {
        Map<String, Object> response = MoveResponses.correlated(message, context, MoveResponses.MOVE, move);
        response.put(POSITION, move);
        return Optional.of(response);
    }

    static String nextMove(int size, List<String> played) {
        String center = cell(size / 2, size / 2);
        if (played.isEmpty()) {
            return center;
        }
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                String candidate = cell(row, col);
                if (!played.contains(candidate)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    static String cell(int row, int col) {
        return String.valueOf((char) ('A' + col)) + (row + 1);
    }

    @SuppressWarnings("unchecked")
    private static List<String> movesOf(GameContext context) {
        return (List<String>) context.getGameState().computeIfAbsent(MOVES, key -> new ArrayList<String>());
    }
}
