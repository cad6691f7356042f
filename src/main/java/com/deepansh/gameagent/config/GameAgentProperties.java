package com.deepansh.gameagent.config;

import com.deepansh.gameagent.model.GameConfig;
import com.deepansh.gameagent.model.GameType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Locale;

/**
 * Strongly-typed agent configuration.
 * Bound from application.yml under the "game.agent" prefix; every value can be
 * overridden by env var, e.g. GAME_AGENT_URL, GAME_AGENT_KEEP_ALIVE.
 */
@ConfigurationProperties(prefix = "game.agent")
@Validated
@Data
public class GameAgentProperties {

    @NotBlank
    private String url = "ws://localhost:2025";

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration recvTimeout = Duration.ofSeconds(2);

    private boolean keepAlive = true;

    @Min(1)
    private int maxReconnectAttempts = 3;

    @NotNull
    private Duration reconnectDelay = Duration.ofSeconds(5);

    @DecimalMin("1.0")
    private double backoffMultiplier = 1.0;

    /** Empty = wait for the strategy indefinitely */
    private Duration moveTimeout;

    @NotNull
    private GameType gameType = GameType.CUSTOM;

    /** Connect as soon as the application is ready */
    private boolean autoStart = true;

    /** Reference strategy: keyword | fixed | grid. Empty = the game type's default */
    private String strategy;

    /** Answer sent by the "fixed" strategy */
    private String fixedGuess = "anthropic";

    /** The configured strategy name, or the game type's default when none is set. */
    public String resolveStrategy() {
        if (strategy == null || strategy.isBlank()) {
            return gameType.getDefaultStrategy();
        }
        return strategy.trim().toLowerCase(Locale.ROOT);
    }

    public GameConfig toGameConfig() {
        return GameConfig.builder()
                .url(url)
                .connectTimeout(connectTimeout)
                .recvTimeout(recvTimeout)
                .keepAlive(keepAlive)
                .maxReconnectAttempts(maxReconnectAttempts)
                .reconnectDelay(reconnectDelay)
                .backoffMultiplier(backoffMultiplier)
                .moveTimeout(moveTimeout)
                .gameType(gameType)
                .build();
    }
}
