package com.deepansh.gameagent.core;

import com.deepansh.gameagent.model.AgentPhase;
import com.deepansh.gameagent.model.GameMessage;
import com.deepansh.gameagent.model.GameStats;
import com.deepansh.gameagent.observability.StatisticsRecorder;
import com.deepansh.gameagent.protocol.AckSignal;
import com.deepansh.gameagent.protocol.AcknowledgmentExtractor;
import com.deepansh.gameagent.strategy.GameStrategy;
import com.deepansh.gameagent.transport.OutboundChannel;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the agent's phase, clues and stats, and decides which callback fires next.
 *
 * Events are handled one at a time under a single lock, including the wait
 * for a pending move, so inbound events are never reordered or interleaved.
 *
 * Event handling per phase:
 * <ul>
 *   <li>game started: IDLE / CONNECTED / GAME_OVER / PLAYING → PLAYING, clears clues</li>
 *   <li>clue, command: only while PLAYING</li>
 *   <li>result: → GAME_OVER where legal; always recorded in stats and ended once per game id</li>
 *   <li>error: strategy hook only, phase unchanged</li>
 * </ul>
 * Connection phases are driven by the reconnection supervisor through {@link #transitionTo}.
 */
@Slf4j
public class LifecycleStateMachine {

    private final GameStrategy strategy;
    private final AcknowledgmentExtractor extractor;
    private final MoveDispatcher dispatcher;
    private final StatisticsRecorder stats;
    private final GameContext context;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<PhaseListener> listeners = new CopyOnWriteArrayList<>();

    private volatile AgentPhase phase = AgentPhase.IDLE;
    private String endedGameId;

    public LifecycleStateMachine(GameStrategy strategy,
                                 AcknowledgmentExtractor extractor,
                                 MoveDispatcher dispatcher,
                                 StatisticsRecorder stats) {
        this.strategy = strategy;
        this.extractor = extractor;
        this.dispatcher = dispatcher;
        this.stats = stats;
        this.context = new GameContext(stats, this::getPhase);
    }

    public AgentPhase getPhase() {
        return phase;
    }

    public GameContext getContext() {
        return context;
    }

    public GameStats getStats() {
        return stats.snapshot();
    }

    public void addPhaseListener(PhaseListener listener) {
        listeners.add(listener);
    }

    /**
     * Move to {@code target} if the transition is legal.
     *
     * @return false when the transition was rejected; the phase is then unchanged
     */
    public boolean transitionTo(AgentPhase target) {
        lock.lock();
        try {
            AgentPhase current = phase;
            if (current == target) {
                return true;
            }
            if (!current.canTransitionTo(target)) {
                log.warn("Rejected phase transition {} -> {}", current, target);
                return false;
            }
            phase = target;
            log.info("Phase {} -> {} [gameId={}]", current, target, context.getGameId());
            for (PhaseListener listener : listeners) {
                notifyListener(listener, current, target);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply one classified inbound event. Replies, if any, go to {@code out}.
     * Never throws for strategy failures; transport failures while sending propagate.
     */
    public void handle(GameMessage message, OutboundChannel out) {
        lock.lock();
        try {
            switch (message.getKind()) {
                case ACKNOWLEDGMENT -> onAcknowledgment(message);
                case GAME_START -> startGame(message);
                case COMMAND -> onCommand(message, out);
                case RESULT -> endGame(message);
                case ERROR -> {
                    log.warn("Server error event: {}", message.getRaw());
                    invoke("onError", () -> strategy.onError(message, context));
                }
                case UNKNOWN -> log.debug("Ignoring unclassified message: {}", message.getRaw());
            }
        } finally {
            lock.unlock();
        }
    }

    /** The supervisor opened a connection. */
    public void connectionOpened() {
        invoke("onConnected", () -> strategy.onConnected(context));
    }

    /** The agent is finally disconnected. */
    public void connectionClosed() {
        invoke("onDisconnected", () -> strategy.onDisconnected(context));
    }

    private void onAcknowledgment(GameMessage message) {
        AckSignal signal = extractor.extract(message);
        log.debug("Acknowledgment [{}] -> {}", message.getAckSubject(), signal.type());
        switch (signal.type()) {
            case GAME_STARTED -> startGame(message);
            case CLUE -> addClue(signal.clue(), message);
            case EMPTY_CLUE -> log.debug("Clue acknowledgment without payload ignored");
            case OTHER -> invoke("onAcknowledgment", () -> strategy.onAcknowledgment(message, context));
            case NONE -> { }
        }
    }

    private void startGame(GameMessage message) {
        if (phase == AgentPhase.PLAYING
                && message.getGameId() != null
                && Objects.equals(message.getGameId(), context.getGameId())) {
            log.debug("Duplicate game start ignored [gameId={}]", message.getGameId());
            return;
        }
        if (!transitionTo(AgentPhase.PLAYING)) {
            log.warn("Game start ignored in phase {} [gameId={}]", phase, message.getGameId());
            return;
        }
        context.beginGame(message);
        endedGameId = null;
        stats.recordGameStarted();
        log.info("Game started [matchId={}, gameId={}, playerId={}]",
                message.getMatchId(), message.getGameId(), message.getPlayerId());
        invoke("onGameStarted", () -> strategy.onGameStarted(message, context));
    }

    private void addClue(String clue, GameMessage message) {
        if (phase != AgentPhase.PLAYING) {
            log.debug("Clue ignored in phase {}: {}", phase, clue);
            return;
        }
        context.addClue(clue);
        log.info("Clue #{} received: {}", context.getClues().size(), clue);
        invoke("onClueReceived", () -> strategy.onClueReceived(clue, message, context));
    }

    private void onCommand(GameMessage message, OutboundChannel out) {
        if (phase != AgentPhase.PLAYING) {
            log.debug("Command [{}] ignored in phase {}", message.getCommand(), phase);
            return;
        }
        dispatcher.dispatch(message, context, out);
    }

    private void endGame(GameMessage message) {
        String gameId = message.getGameId();
        if (gameId != null && gameId.equals(endedGameId)) {
            log.debug("Duplicate result ignored [gameId={}]", gameId);
            return;
        }
        if (phase.canTransitionTo(AgentPhase.GAME_OVER)) {
            transitionTo(AgentPhase.GAME_OVER);
        } else {
            log.warn("Result [{}] received in phase {}, recording without phase change", message.getOutcome(), phase);
        }
        endedGameId = gameId;
        stats.recordGameEnded(message.getOutcome());
        String answer = message.getAnswer();
        log.info("Game over: {} [gameId={}, answer={}]",
                message.getOutcome(), gameId, answer != null ? answer : "unknown");
        invoke("onGameEnded", () -> strategy.onGameEnded(message, context));
    }

    private void notifyListener(PhaseListener listener, AgentPhase from, AgentPhase to) {
        try {
            listener.onTransition(from, to);
        } catch (RuntimeException e) {
            log.error("Phase listener failed on {} -> {}", from, to, e);
        }
    }

    private void invoke(String hook, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Strategy hook [{}] failed in {}", hook, strategy.getName(), e);
        }
    }
}
