package com.deepansh.gameagent.core;

import com.deepansh.gameagent.model.GameMessage;
import com.deepansh.gameagent.observability.StatisticsRecorder;
import com.deepansh.gameagent.strategy.GameStrategy;
import com.deepansh.gameagent.transport.OutboundChannel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns a command into at most one outbound move.
 *
 * Per command: claim the {@link MoveGate}, call {@code makeMove}, wait for
 * the move, build the response, send it once. Strategy failures degrade to
 * "no move" and never propagate; transport failures on send do propagate so
 * the reconnection supervisor can handle them.
 */
@Slf4j
public class MoveDispatcher {

    public enum Outcome {
        SENT,
        /** No move, or an empty response: intentionally skipped */
        SKIPPED,
        /** makeMove or buildResponse failed */
        FAILED,
        /** The agent was closed while the move was pending */
        CANCELLED
    }

    private final GameStrategy strategy;
    private final ObjectMapper objectMapper;
    private final StatisticsRecorder stats;
    private final MoveGate gate;
    private final Duration moveTimeout;

    public MoveDispatcher(GameStrategy strategy, ObjectMapper objectMapper, StatisticsRecorder stats,
                          MoveGate gate, Duration moveTimeout) {
        this.strategy = strategy;
        this.objectMapper = objectMapper;
        this.stats = stats;
        this.gate = gate;
        this.moveTimeout = moveTimeout;
    }

    public Outcome dispatch(GameMessage command, GameContext context, OutboundChannel out) {
        log.info("Command received: [{}] [gameId={}]", command.getCommand(), command.getGameId());

        CompletableFuture<Optional<String>> slot = new CompletableFuture<>();
        if (!gate.acquire(slot)) {
            log.info("Agent is closing, command [{}] dropped", command.getCommand());
            return Outcome.CANCELLED;
        }

        try {
            String move;
            try {
                move = awaitMove(command, context, slot).orElse(null);
            } catch (CancellationException e) {
                log.info("Move generation cancelled [gameId={}]", command.getGameId());
                return Outcome.CANCELLED;
            } catch (MoveFailure e) {
                return fail(command, context, "Move generation failed", e.getCause());
            }

            if (move == null || move.isBlank()) {
                log.info("Strategy made no move for command [{}]; nothing sent", command.getCommand());
                return Outcome.SKIPPED;
            }

            Optional<String> payload;
            try {
                payload = serialize(strategy.buildResponse(command, move, context));
            } catch (RuntimeException | JsonProcessingException e) {
                return fail(command, context, "Building the response failed", e);
            }
            if (payload.isEmpty()) {
                log.info("Empty response for move '{}'; command [{}] skipped", move, command.getCommand());
                return Outcome.SKIPPED;
            }

            if (!gate.sendIfOpen(() -> out.send(payload.get()))) {
                log.info("Agent closed before move '{}' could be sent", move);
                return Outcome.CANCELLED;
            }
            stats.recordMoveSent();
            log.info("Move #{} sent: {} [gameId={}]",
                    stats.snapshot().getCurrentGameMoves(), move, command.getGameId());
            return Outcome.SENT;

        } finally {
            gate.release(slot);
        }
    }

    public boolean isMoveInFlight() {
        return gate.isMoveInFlight();
    }

    /**
     * Wait for the strategy's move through {@code slot}, which the gate can
     * cancel. The strategy's own future is cancelled along with it.
     */
    private Optional<String> awaitMove(GameMessage command, GameContext context,
                                       CompletableFuture<Optional<String>> slot) {
        CompletableFuture<Optional<String>> pending;
        try {
            pending = strategy.makeMove(command, context);
        } catch (RuntimeException e) {
            throw new MoveFailure(e);
        }
        if (pending == null) {
            return Optional.empty();
        }

        pending.whenComplete((move, error) -> {
            if (error != null) {
                slot.completeExceptionally(unwrap(error));
            } else {
                slot.complete(move);
            }
        });
        slot.whenComplete((move, error) -> {
            if (slot.isCancelled()) {
                pending.cancel(true);
            }
        });

        try {
            Optional<String> move = moveTimeout == null
                    ? slot.get()
                    : slot.get(moveTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return move != null ? move : Optional.empty();
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new MoveFailure(new TimeoutException(
                    "No move within " + moveTimeout.toMillis() + "ms"));
        } catch (ExecutionException e) {
            throw new MoveFailure(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for a move");
        }
    }

    private Optional<String> serialize(Optional<Map<String, Object>> response) throws JsonProcessingException {
        if (response == null || response.isEmpty() || response.get().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.writeValueAsString(response.get()));
    }

    private Outcome fail(GameMessage command, GameContext context, String what, Throwable error) {
        log.error("{} for command [{}] [gameId={}]: {}",
                what, command.getCommand(), command.getGameId(), error.getMessage(), error);
        try {
            strategy.onMoveFailed(command, error, context);
        } catch (RuntimeException e) {
            log.error("Strategy hook [onMoveFailed] failed", e);
        }
        return Outcome.FAILED;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static final class MoveFailure extends RuntimeException {
        MoveFailure(Throwable cause) {
            super(cause.getMessage(), cause);
        }
    }
}
