package com.deepansh.gameagent.core;

import com.deepansh.gameagent.config.GameAgentProperties;
import com.deepansh.gameagent.exception.FatalConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Starts the agent's receive loop on its own executor, at boot when
 * "game.agent.auto-start" is on, or on demand from the status API.
 */
@Service
@Slf4j
public class AgentLauncher implements ApplicationRunner {

    private final GameAgent agent;
    private final GameAgentProperties properties;
    private final Executor executor;

    private volatile CompletableFuture<Void> session;

    public AgentLauncher(GameAgent agent,
                         GameAgentProperties properties,
                         @Qualifier("agentLoopExecutor") Executor executor) {
        this.agent = agent;
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (properties.isAutoStart()) {
            launch();
        } else {
            log.info("Auto-start disabled; POST /api/agent/start to connect");
        }
    }

    /**
     * Start a session unless one is already running.
     *
     * @throws IllegalStateException if the agent is running or closed
     */
    public synchronized CompletableFuture<Void> launch() {
        if (agent.isClosed()) {
            throw new IllegalStateException("Agent is closed");
        }
        if (session != null && !session.isDone()) {
            throw new IllegalStateException("Agent is already running");
        }
        session = agent.start(executor).whenComplete((ignored, error) -> {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof FatalConnectionException fatal) {
                log.error("Agent disconnected for good after {} attempts: {}", fatal.getAttempts(), fatal.getMessage());
            } else if (cause != null) {
                log.error("Agent session failed", cause);
            } else {
                log.info("Agent session ended [phase={}]", agent.getPhase());
            }
        });
        return session;
    }

    public void stop() {
        agent.close();
    }

    public boolean isRunning() {
        CompletableFuture<Void> current = session;
        return current != null && !current.isDone();
    }
}
