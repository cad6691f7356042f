package com.deepansh.gameagent.resilience;

import com.deepansh.gameagent.core.LifecycleStateMachine;
import com.deepansh.gameagent.exception.FatalConnectionException;
import com.deepansh.gameagent.exception.TransportException;
import com.deepansh.gameagent.model.AgentPhase;
import com.deepansh.gameagent.model.GameConfig;
import com.deepansh.gameagent.transport.GameTransport;
import com.deepansh.gameagent.transport.GameTransportFactory;
import com.deepansh.gameagent.transport.OutboundChannel;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the connection: connect with bounded retries, run the receive loop,
 * reconnect after a mid-session fault, close.
 *
 * Retry config, registered as {@value #RECONNECT_RETRY} in the {@link RetryRegistry}:
 * - maxAttempts = max-reconnect-attempts, the first attempt included
 * - wait = reconnect-delay, multiplied by backoff-multiplier per attempt when above 1.0
 * - only {@link TransportException} is retried
 *
 * Each fault starts a fresh retry cycle. Nothing is replayed after a reconnect;
 * stats and the current phase history survive, the server drives the next game.
 */
@Slf4j
public class ReconnectionSupervisor {

    public static final String RECONNECT_RETRY = "game-agent-reconnect";

    /** Consumer of one raw inbound frame; replies go to {@code out}. */
    @FunctionalInterface
    public interface FrameHandler {
        void onFrame(String raw, OutboundChannel out);
    }

    private enum SessionEnd {
        /** Normal end: keep-alive off or the agent was closed */
        COMPLETED,
        /** Transport fault; reconnect */
        FAULTED
    }

    private final GameConfig config;
    private final GameTransportFactory transportFactory;
    private final LifecycleStateMachine stateMachine;
    private final FrameHandler frameHandler;
    private final Retry retry;

    private final AtomicInteger connectionAttempts = new AtomicInteger();
    private final AtomicInteger cycleAttempts = new AtomicInteger();
    private volatile GameTransport transport;
    private volatile Thread runner;
    private volatile boolean closed;

    public ReconnectionSupervisor(GameConfig config,
                                  GameTransportFactory transportFactory,
                                  LifecycleStateMachine stateMachine,
                                  FrameHandler frameHandler) {
        this(config, transportFactory, stateMachine, frameHandler, RetryRegistry.ofDefaults());
    }

    public ReconnectionSupervisor(GameConfig config,
                                  GameTransportFactory transportFactory,
                                  LifecycleStateMachine stateMachine,
                                  FrameHandler frameHandler,
                                  RetryRegistry retryRegistry) {
        this.config = config;
        this.transportFactory = transportFactory;
        this.stateMachine = stateMachine;
        this.frameHandler = frameHandler;
        this.retry = buildRetry(config, retryRegistry);
    }

    /**
     * Block until the session ends normally or the agent is closed.
     *
     * @throws FatalConnectionException when a reconnect cycle exhausts its attempts
     */
    public void run() {
        runner = Thread.currentThread();
        try {
            while (!closed) {
                GameTransport connected = connect();
                if (connected == null) {
                    return;
                }
                if (runSession(connected) == SessionEnd.COMPLETED || closed) {
                    return;
                }
                stateMachine.transitionTo(AgentPhase.ERRORED);
                log.info("Reconnecting to {} [maxAttempts={}]", config.getUrl(), config.getMaxReconnectAttempts());
            }
        } finally {
            runner = null;
            if (closed) {
                // interrupt from close() must not leak into a pooled thread
                Thread.interrupted();
            }
            stateMachine.transitionTo(AgentPhase.DISCONNECTED);
            stateMachine.connectionClosed();
        }
    }

    /** Stop the receive loop and any pending reconnect wait. Idempotent. */
    public void close() {
        if (closed) return;
        closed = true;
        GameTransport open = transport;
        if (open != null) {
            open.close();
        }
        Thread loop = runner;
        if (loop != null) {
            loop.interrupt();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /** Connection attempts made over the supervisor's lifetime. */
    public int getConnectionAttempts() {
        return connectionAttempts.get();
    }

    private GameTransport connect() {
        cycleAttempts.set(0);
        try {
            return retry.executeSupplier(this::openOnce);
        } catch (TransportException e) {
            if (closed) {
                log.info("Agent closed while reconnecting to {}", config.getUrl());
                return null;
            }
            int attempts = cycleAttempts.get();
            log.error("Giving up on {} after {} connection attempts: {}", config.getUrl(), attempts, e.getMessage());
            stateMachine.transitionTo(AgentPhase.ERRORED);
            throw new FatalConnectionException(
                    "Could not connect to " + config.getUrl() + " after " + attempts + " attempts", attempts, e);
        }
    }

    /** One connection attempt: CONNECTING, then CONNECTED or ERRORED. Null once closed. */
    private GameTransport openOnce() {
        if (closed) {
            return null;
        }
        int attempt = cycleAttempts.incrementAndGet();
        connectionAttempts.incrementAndGet();
        stateMachine.transitionTo(AgentPhase.CONNECTING);
        log.info("Connecting to {} [attempt={}/{}]", config.getUrl(), attempt, config.getMaxReconnectAttempts());
        GameTransport opened;
        try {
            opened = transportFactory.open(config.getUrl(), config.getConnectTimeout());
        } catch (TransportException e) {
            stateMachine.transitionTo(AgentPhase.ERRORED);
            throw e;
        } catch (RuntimeException e) {
            stateMachine.transitionTo(AgentPhase.ERRORED);
            throw new TransportException("Failed to connect to " + config.getUrl() + ": " + e.getMessage(), e);
        }
        if (closed) {
            opened.close();
            return null;
        }
        transport = opened;
        stateMachine.transitionTo(AgentPhase.CONNECTED);
        log.info("Connected to {}", config.getUrl());
        return opened;
    }

    private SessionEnd runSession(GameTransport session) {
        try {
            stateMachine.connectionOpened();
            return receiveLoop(session);
        } catch (TransportException e) {
            if (closed) {
                return SessionEnd.COMPLETED;
            }
            log.warn("Connection to {} lost in phase {}: {}", config.getUrl(), stateMachine.getPhase(), e.getMessage());
            return SessionEnd.FAULTED;
        } finally {
            transport = null;
            session.close();
        }
    }

    private SessionEnd receiveLoop(GameTransport session) {
        while (!closed) {
            Optional<String> frame;
            try {
                frame = session.receive(config.getRecvTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return SessionEnd.COMPLETED;
            }

            if (frame.isEmpty()) {
                if (config.isKeepAlive()) {
                    continue;
                }
                if (stateMachine.getPhase() != AgentPhase.PLAYING) {
                    log.info("No message within {}ms and keep-alive is off; closing session",
                            config.getRecvTimeout().toMillis());
                    return SessionEnd.COMPLETED;
                }
                throw new TransportException("No message within " + config.getRecvTimeout().toMillis()
                        + "ms while playing [gameId=" + stateMachine.getContext().getGameId() + "]");
            }

            try {
                frameHandler.onFrame(frame.get(), session);
            } catch (TransportException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Failed to handle inbound frame, continuing: {}", e.getMessage(), e);
            }

            if (stateMachine.getPhase() == AgentPhase.GAME_OVER && afterGameOver(session)) {
                return SessionEnd.COMPLETED;
            }
        }
        return SessionEnd.COMPLETED;
    }

    /** @return true when the session should end */
    private boolean afterGameOver(GameTransport session) {
        if (!config.isKeepAlive()) {
            log.info("Game over and keep-alive is off; closing session");
            return true;
        }
        if (!session.isOpen()) {
            throw new TransportException("Connection to " + config.getUrl() + " dropped at game over");
        }
        stateMachine.transitionTo(AgentPhase.CONNECTED);
        return false;
    }

    /** Replaces any instance already registered under the same name. */
    private static Retry buildRetry(GameConfig config, RetryRegistry registry) {
        long delayMillis = Math.max(1, config.getReconnectDelay().toMillis());
        IntervalFunction interval = config.getBackoffMultiplier() > 1.0
                ? IntervalFunction.ofExponentialBackoff(delayMillis, config.getBackoffMultiplier())
                : IntervalFunction.of(delayMillis);

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, config.getMaxReconnectAttempts()))
                .intervalFunction(interval)
                .retryExceptions(TransportException.class)
                .build();

        registry.remove(RECONNECT_RETRY);
        Retry retry = registry.retry(RECONNECT_RETRY, retryConfig);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "Connection attempt {} failed, retrying in {}ms: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
