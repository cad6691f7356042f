package com.deepansh.gameagent.core;

import com.deepansh.gameagent.model.AgentPhase;
import com.deepansh.gameagent.model.AgentStatus;
import com.deepansh.gameagent.model.GameConfig;
import com.deepansh.gameagent.model.GameMessage;
import com.deepansh.gameagent.model.GameStats;
import com.deepansh.gameagent.observability.StatisticsRecorder;
import com.deepansh.gameagent.protocol.AcknowledgmentExtractor;
import com.deepansh.gameagent.protocol.MessageClassifier;
import com.deepansh.gameagent.resilience.ReconnectionSupervisor;
import com.deepansh.gameagent.strategy.GameStrategy;
import com.deepansh.gameagent.transport.GameTransportFactory;
import com.deepansh.gameagent.transport.OutboundChannel;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One game-playing agent: a strategy bound to one server connection.
 *
 * Flow per inbound frame:
 * 1. classify the raw payload
 * 2. hand it to the lifecycle state machine
 * 3. the state machine fires strategy callbacks and, for commands, the move dispatcher
 *
 * {@link #run()} blocks the calling thread for the whole session;
 * {@link #start(Executor)} runs it on the given executor instead.
 * Agents share no state with each other.
 */
@Slf4j
public class GameAgent implements AutoCloseable {

    private final GameConfig config;
    private final GameStrategy strategy;
    private final MessageClassifier classifier;
    private final MoveGate gate;
    private final LifecycleStateMachine stateMachine;
    private final ReconnectionSupervisor supervisor;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    public GameAgent(GameConfig config, GameStrategy strategy,
                     GameTransportFactory transportFactory, ObjectMapper objectMapper) {
        this(config, strategy, transportFactory, objectMapper, RetryRegistry.ofDefaults(), Clock.systemUTC());
    }

    public GameAgent(GameConfig config, GameStrategy strategy,
                     GameTransportFactory transportFactory, ObjectMapper objectMapper, RetryRegistry retryRegistry) {
        this(config, strategy, transportFactory, objectMapper, retryRegistry, Clock.systemUTC());
    }

    public GameAgent(GameConfig config, GameStrategy strategy, GameTransportFactory transportFactory,
                     ObjectMapper objectMapper, RetryRegistry retryRegistry, Clock clock) {
        if (config.getUrl() == null || config.getUrl().isBlank()) {
            throw new IllegalArgumentException("Game server url is required");
        }
        this.config = config;
        this.strategy = strategy;
        this.classifier = new MessageClassifier(objectMapper);
        this.gate = new MoveGate();

        StatisticsRecorder stats = new StatisticsRecorder(clock);
        MoveDispatcher dispatcher = new MoveDispatcher(strategy, objectMapper, stats, gate, config.getMoveTimeout());
        this.stateMachine = new LifecycleStateMachine(strategy, new AcknowledgmentExtractor(), dispatcher, stats);
        this.supervisor = new ReconnectionSupervisor(config, transportFactory, stateMachine, this::handleFrame, retryRegistry);
    }

    /**
     * Connect and play until the session ends or {@link #close()} is called.
     *
     * @throws com.deepansh.gameagent.exception.FatalConnectionException when reconnect attempts run out
     * @throws IllegalStateException if the agent is already running or closed
     */
    public void run() {
        if (closed.get()) {
            throw new IllegalStateException("Agent is closed");
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Agent is already running");
        }
        log.info("Starting agent [strategy={}, url={}, gameType={}, keepAlive={}]",
                strategy.getName(), config.getUrl(), config.getGameType(), config.isKeepAlive());
        try {
            supervisor.run();
            log.info("Agent stopped [strategy={}] {}", strategy.getName(), getStats());
        } finally {
            running.set(false);
        }
    }

    /** Run on {@code executor}; the future completes when the session ends. */
    public CompletableFuture<Void> start(Executor executor) {
        return CompletableFuture.runAsync(this::run, executor);
    }

    /**
     * Classify one raw frame and apply it. Called by the receive loop; also
     * usable directly to drive the agent without a connection.
     */
    public void handleFrame(String raw, OutboundChannel out) {
        GameMessage message = classifier.classify(raw);
        stateMachine.handle(message, out);
    }

    /**
     * Cancel any pending move, stop the receive loop and release the
     * connection. No move is sent afterwards. Idempotent; the agent cannot be restarted.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing agent [strategy={}, phase={}]", strategy.getName(), getPhase());
        gate.close();
        supervisor.close();
        if (!running.get()) {
            stateMachine.transitionTo(AgentPhase.DISCONNECTED);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean isMoveInFlight() {
        return gate.isMoveInFlight();
    }

    public AgentPhase getPhase() {
        return stateMachine.getPhase();
    }

    public GameStats getStats() {
        return stateMachine.getStats();
    }

    public List<String> getClues() {
        return List.copyOf(stateMachine.getContext().getClues());
    }

    public GameContext getContext() {
        return stateMachine.getContext();
    }

    public GameConfig getConfig() {
        return config;
    }

    public String getStrategyName() {
        return strategy.getName();
    }

    public void addPhaseListener(PhaseListener listener) {
        stateMachine.addPhaseListener(listener);
    }

    /** Point-in-time view for the status API. */
    public AgentStatus getStatus() {
        GameContext context = stateMachine.getContext();
        return AgentStatus.builder()
                .phase(getPhase())
                .strategy(strategy.getName())
                .url(config.getUrl())
                .matchId(context.getMatchId())
                .gameId(context.getGameId())
                .playerId(context.getPlayerId())
                .clues(getClues())
                .moveInFlight(isMoveInFlight())
                .build();
    }
}
