package com.deepansh.gameagent.config;

import com.deepansh.gameagent.core.GameAgent;
import com.deepansh.gameagent.model.GameConfig;
import com.deepansh.gameagent.strategy.GameStrategy;
import com.deepansh.gameagent.strategy.impl.FixedGuessStrategy;
import com.deepansh.gameagent.strategy.impl.GridMoveStrategy;
import com.deepansh.gameagent.strategy.impl.KeywordClueStrategy;
import com.deepansh.gameagent.transport.GameTransportFactory;
import com.deepansh.gameagent.transport.SpringWebSocketTransportFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;


/**
 * Wires one {@link GameAgent} from {@link GameAgentProperties}.
 * The strategy is picked by "game.agent.strategy", else by "game.agent.game-type";
 * define your own {@link GameStrategy} bean to replace the reference ones.
 */
@Configuration
@Slf4j
public class GameAgentConfig {

    @Bean
    public WebSocketClient gameWebSocketClient() {
        return new StandardWebSocketClient();
    }

    @Bean
    public GameTransportFactory gameTransportFactory(WebSocketClient gameWebSocketClient) {
        return new SpringWebSocketTransportFactory(gameWebSocketClient);
    }

    @Bean
    @ConditionalOnMissingBean(GameStrategy.class)
    public GameStrategy gameStrategy(GameAgentProperties properties) {
        String name = properties.resolveStrategy();
        GameStrategy strategy = switch (name) {
            case "fixed" -> new FixedGuessStrategy(properties.getFixedGuess());
            case "grid" -> new GridMoveStrategy();
            case "keyword" -> new KeywordClueStrategy();
            default -> {
                log.warn("Unknown strategy '{}', falling back to keyword", name);
                yield new KeywordClueStrategy();
            }
        };
        log.info("Active strategy: {} [gameType={}]", strategy.getName(), properties.getGameType());
        return strategy;
    }

    @Bean(destroyMethod = "close")
    public GameAgent gameAgent(GameAgentProperties properties,
                               GameStrategy gameStrategy,
                               GameTransportFactory gameTransportFactory,
                               ObjectMapper objectMapper,
                               ObjectProvider<RetryRegistry> retryRegistry) {
        GameConfig config = properties.toGameConfig();
        log.info("Game agent configured [url={}, gameType={}, keepAlive={}, maxReconnectAttempts={}]",
                config.getUrl(), config.getGameType(), config.isKeepAlive(), config.getMaxReconnectAttempts());
        // resilience4j-spring-boot3 auto-configures the registry; plain contexts get a private one
        return new GameAgent(config, gameStrategy, gameTransportFactory, objectMapper,
                retryRegistry.getIfAvailable(RetryRegistry::ofDefaults));
    }
}
