package com.deepansh.gameagent.model;

/**
 * Kind of game the server runs. Picks the reference strategy when
 * "game.agent.strategy" is left empty.
 */
public enum GameType {
    WORDLE("fixed"),
    CLUEDLE("keyword"),
    GRID_2D("grid"),
    CUSTOM("keyword");

    private final String defaultStrategy;

    GameType(String defaultStrategy) {
        this.defaultStrategy = defaultStrategy;
    }

    public String getDefaultStrategy() {
        return defaultStrategy;
    }
}
