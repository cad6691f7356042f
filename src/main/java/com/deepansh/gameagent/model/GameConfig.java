package com.deepansh.gameagent.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable connection and lifecycle settings for one agent.
 * Defaults: 10s connect, 2s receive, keep-alive on, 3 attempts 5s apart.
 */
@Value
@Builder(toBuilder = true)
public class GameConfig {

    /** WebSocket URL of the game server, e.g. ws://localhost:2025 */
    String url;

    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(10);

    @Builder.Default
    Duration recvTimeout = Duration.ofSeconds(2);

    /** Keep the connection open across successive games */
    @Builder.Default
    boolean keepAlive = true;

    /** Connection attempts per reconnect cycle, first attempt included */
    @Builder.Default
    int maxReconnectAttempts = 3;

    @Builder.Default
    Duration reconnectDelay = Duration.ofSeconds(5);

    /** 1.0 keeps the reconnect delay fixed; larger values grow it per attempt */
    @Builder.Default
    double backoffMultiplier = 1.0;

    /** Upper bound for one move generation; null waits indefinitely */
    Duration moveTimeout;

    @Builder.Default
    GameType gameType = GameType.CUSTOM;
}
