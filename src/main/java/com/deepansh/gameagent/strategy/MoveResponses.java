package com.deepansh.gameagent.strategy;

import com.deepansh.gameagent.core.GameContext;
import com.deepansh.gameagent.model.GameMessage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for outbound move payloads.
 */
public final class MoveResponses {

    public static final String GUESS = "guess";
    public static final String MOVE = "move";

    private MoveResponses() {
    }

    /**
     * Correlation fields the server needs to match a move to its open command,
     * plus the move under {@code moveKey}. Ids from the command win; the
     * current game's ids fill in when the command omits them.
     */
    public static Map<String, Object> correlated(GameMessage command, GameContext context,
                                                 String moveKey, Object move) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("matchId", firstNonNull(command.getMatchId(), context.getMatchId()));
        response.put("gameId", firstNonNull(command.getGameId(), context.getGameId()));
        String otp = command.getOtp();
        if (otp != null) {
            response.put("otp", otp);
        }
        response.put(moveKey, move);
        return response;
    }

    private static String firstNonNull(String preferred, String fallback) {
        return preferred != null ? preferred : fallback;
    }
}
