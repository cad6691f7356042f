package com.deepansh.gameagent.core;

import com.deepansh.gameagent.exception.FatalConnectionException;
import com.deepansh.gameagent.model.AgentPhase;
import com.deepansh.gameagent.model.AgentStatus;
import com.deepansh.gameagent.model.GameConfig;
import com.deepansh.gameagent.model.GameStats;
import com.deepansh.gameagent.support.RecordingStrategy;
import com.deepansh.gameagent.support.ScriptedTransport;
import com.deepansh.gameagent.support.ScriptedTransportFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.deepansh.gameagent.support.Frames.clue;
import static com.deepansh.gameagent.support.Frames.gameStarted;
import static com.deepansh.gameagent.support.Frames.guess;
import static com.deepansh.gameagent.support.Frames.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class GameAgentTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    private GameAgent agent;

    @AfterEach
    void tearDown() {
        if (agent != null) {
            agent.close();
        }
        executor.shutdownNow();
    }

    private static GameConfig config(boolean keepAlive) {
        return GameConfig.builder()
                .url("ws://game.test")
                .recvTimeout(Duration.ofMillis(50))
                .keepAlive(keepAlive)
                .maxReconnectAttempts(2)
                .reconnectDelay(Duration.ofMillis(1))
                .build();
    }

    private GameAgent agent(GameConfig config, RecordingStrategy strategy, ScriptedTransport... transports) {
        agent = new GameAgent(config, strategy, new ScriptedTransportFactory(transports), objectMapper);
        return agent;
    }

    @Test
    void run_fullGame_sendsOneMoveAndRecordsWin() throws Exception {
        ScriptedTransport server = new ScriptedTransport().push(
                gameStarted("g1"), clue("g1", "Makers of Claude AI"), guess("g1", "o-1"), result("g1", "win"));
        RecordingStrategy strategy = RecordingStrategy.answering("anthropic");

        agent(config(false), strategy, server).run();

        assertThat(server.getSent()).hasSize(1);
        JsonNode move = objectMapper.readTree(server.getSent().get(0));
        assertThat(move.get("guess").asText()).isEqualTo("anthropic");
        assertThat(move.get("otp").asText()).isEqualTo("o-1");

        GameStats stats = agent.getStats();
        assertThat(stats.getGamesPlayed()).isEqualTo(1);
        assertThat(stats.getGamesWon()).isEqualTo(1);
        assertThat(stats.getTotalMoves()).isEqualTo(1);
        assertThat(agent.getPhase()).isEqualTo(AgentPhase.DISCONNECTED);
        assertThat(strategy.getEvents()).containsExactly(
                "connected", "started:g1", "clue:Makers of Claude AI", "move:guess", "ended:WIN", "disconnected");
    }

    @Test
    void run_slowMoves_neverOverlap_andEventsStayInOrder() {
        ScriptedTransport server = new ScriptedTransport().push(
                gameStarted("g1"), guess("g1", "a"), guess("g1", "b"), guess("g1", "c"), result("g1", "loss"));
        RecordingStrategy strategy = new RecordingStrategy().moves((message, context) ->
                CompletableFuture.supplyAsync(() -> Optional.of("w" + message.getOtp()),
                        CompletableFuture.delayedExecutor(30, TimeUnit.MILLISECONDS)));

        agent(config(false), strategy, server).run();

        assertThat(strategy.getMakeMoveCalls()).isEqualTo(3);
        assertThat(strategy.getMaxPendingMoves()).isEqualTo(1);
        assertThat(server.getSent()).hasSize(3);
        assertThat(server.getSent().get(0)).contains("\"guess\":\"wa\"");
        assertThat(server.getSent().get(2)).contains("\"guess\":\"wc\"");
        assertThat(agent.getStats().getTotalMoves()).isEqualTo(3);
        assertThat(agent.getStats().getGamesLost()).isEqualTo(1);
    }

    @Test
    void run_garbageFrames_doNotStopTheLoop() {
        ScriptedTransport server = new ScriptedTransport().push(
                gameStarted("g1"), "garbage", "[]", "{\"type\":", clue("g1", "hint"), guess("g1", "o"), result("g1", "win"));

        agent(config(false), RecordingStrategy.answering("x"), server).run();

        assertThat(server.getSent()).hasSize(1);
        assertThat(agent.getStats().getGamesWon()).isEqualTo(1);
    }

    @Test
    void run_idleWithoutKeepAlive_closesNormally() {
        ScriptedTransport server = new ScriptedTransport();
        ScriptedTransportFactory factory = new ScriptedTransportFactory(server);
        agent = new GameAgent(config(false), RecordingStrategy.answering("x"), factory, objectMapper);

        agent.run();

        assertThat(agent.getPhase()).isEqualTo(AgentPhase.DISCONNECTED);
        assertThat(factory.getOpens()).isEqualTo(1);
        assertThat(server.isOpen()).isFalse();
    }

    @Test
    void run_keepAlive_playsSuccessiveGamesOnOneConnection() {
        ScriptedTransport server = new ScriptedTransport().push(
                gameStarted("g1"), clue("g1", "first"), guess("g1", "1"), result("g1", "win"),
                gameStarted("g2"), guess("g2", "2"), result("g2", "loss"));
        RecordingStrategy strategy = RecordingStrategy.answering("anthropic");
        List<String> transitions = new CopyOnWriteArrayList<>();
        agent(config(true), strategy, server).addPhaseListener((from, to) -> transitions.add(from + "->" + to));

        CompletableFuture<Void> session = agent.start(executor);
        await().atMost(Duration.ofSeconds(5)).until(() ->
                agent.getStats().getGamesPlayed() == 2 && agent.getPhase() == AgentPhase.CONNECTED);

        assertThat(agent.getClues()).isEmpty();
        assertThat(strategy.getCluesAtMove()).containsExactly(List.of("first"), List.of());
        assertThat(transitions).contains("GAME_OVER->CONNECTED", "CONNECTED->PLAYING");

        agent.close();
        session.join();
        assertThat(agent.getPhase()).isEqualTo(AgentPhase.DISCONNECTED);
    }

    @Test
    void close_whileMoveIsPending_cancelsItAndSendsNothing() {
        CompletableFuture<Optional<String>> neverAnswered = new CompletableFuture<>();
        ScriptedTransport server = new ScriptedTransport().push(gameStarted("g1"), guess("g1", "o"));
        RecordingStrategy strategy = new RecordingStrategy().moves((message, context) -> neverAnswered);

        CompletableFuture<Void> session = agent(config(true), strategy, server).start(executor);
        await().atMost(Duration.ofSeconds(5)).until(agent::isMoveInFlight);

        agent.close();
        session.join();
        neverAnswered.complete(Optional.of("too late"));

        assertThat(server.getSent()).isEmpty();
        assertThat(agent.isMoveInFlight()).isFalse();
        assertThat(agent.getPhase()).isEqualTo(AgentPhase.DISCONNECTED);
        assertThat(agent.getStats().getTotalMoves()).isZero();
    }

    @Test
    void start_unreachableServer_failsWithFatalConnectionException() {
        agent = new GameAgent(config(true), RecordingStrategy.answering("x"),
                ScriptedTransportFactory.alwaysFailing(), objectMapper);

        CompletableFuture<Void> session = agent.start(executor);

        assertThatThrownBy(session::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(FatalConnectionException.class);
        assertThat(agent.getPhase()).isEqualTo(AgentPhase.DISCONNECTED);
    }

    @Test
    void run_whileRunning_isRejected() {
        ScriptedTransport server = new ScriptedTransport();
        agent(config(true), RecordingStrategy.answering("x"), server).start(executor);
        await().atMost(Duration.ofSeconds(5)).until(agent::isRunning);

        assertThatThrownBy(agent::run)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already running");
    }

    @Test
    void run_afterClose_isRejected() {
        agent(config(true), RecordingStrategy.answering("x"), new ScriptedTransport()).close();

        assertThatThrownBy(agent::run).isInstanceOf(IllegalStateException.class);
        assertThat(agent.getPhase()).isEqualTo(AgentPhase.DISCONNECTED);
    }

    @Test
    void handleFrame_drivesTheLifecycleWithoutAConnection() {
        List<String> sent = new CopyOnWriteArrayList<>();
        agent(config(true), RecordingStrategy.answering("anthropic"));

        agent.handleFrame(gameStarted("g7"), sent::add);
        agent.handleFrame(clue("g7", "AI lab"), sent::add);
        agent.handleFrame(guess("g7", "o"), sent::add);

        AgentStatus status = agent.getStatus();
        assertThat(status.getPhase()).isEqualTo(AgentPhase.PLAYING);
        assertThat(status.getGameId()).isEqualTo("g7");
        assertThat(status.getPlayerId()).isEqualTo("p1");
        assertThat(status.getClues()).containsExactly("AI lab");
        assertThat(status.getStrategy()).isEqualTo("RecordingStrategy");
        assertThat(status.isMoveInFlight()).isFalse();
        assertThat(sent).hasSize(1);
    }

    @Test
    void handleFrame_resultOnFreshAgent_countsTheGame() {
        List<String> sent = new CopyOnWriteArrayList<>();
        RecordingStrategy strategy = RecordingStrategy.answering("anthropic");
        agent(config(true), strategy);

        agent.handleFrame("{\"type\":\"result\",\"result\":\"win\"}", sent::add);

        assertThat(agent.getStats().getGamesPlayed()).isEqualTo(1);
        assertThat(agent.getStats().getGamesWon()).isEqualTo(1);
        assertThat(strategy.getGamesEnded()).isEqualTo(1);
        assertThat(agent.getPhase()).isEqualTo(AgentPhase.GAME_OVER);
        assertThat(sent).isEmpty();
    }

    @Test
    void constructor_blankUrl_isRejected() {
        GameConfig config = GameConfig.builder().url(" ").build();

        assertThatThrownBy(() -> new GameAgent(config, new RecordingStrategy(),
                new ScriptedTransportFactory(), objectMapper))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
