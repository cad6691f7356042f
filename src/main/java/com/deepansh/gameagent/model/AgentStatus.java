package com.deepansh.gameagent.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class AgentStatus {

    private AgentPhase phase;
    private String strategy;
    private String url;
    private String matchId;
    private String gameId;
    private String playerId;
    private List<String> clues;
    private boolean moveInFlight;
}
