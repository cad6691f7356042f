package com.deepansh.gameagent.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AgentPhaseTest {

    @Test
    void connectionLifecycle_isAllowed() {
        assertThat(AgentPhase.IDLE.canTransitionTo(AgentPhase.CONNECTING)).isTrue();
        assertThat(AgentPhase.CONNECTING.canTransitionTo(AgentPhase.CONNECTED)).isTrue();
        assertThat(AgentPhase.CONNECTED.canTransitionTo(AgentPhase.PLAYING)).isTrue();
        assertThat(AgentPhase.PLAYING.canTransitionTo(AgentPhase.GAME_OVER)).isTrue();
        assertThat(AgentPhase.GAME_OVER.canTransitionTo(AgentPhase.CONNECTED)).isTrue();
        assertThat(AgentPhase.ERRORED.canTransitionTo(AgentPhase.CONNECTING)).isTrue();
    }

    @Test
    void resultMayEndGameFromIdleOrConnected() {
        assertThat(AgentPhase.IDLE.canTransitionTo(AgentPhase.GAME_OVER)).isTrue();
        assertThat(AgentPhase.CONNECTED.canTransitionTo(AgentPhase.GAME_OVER)).isTrue();
        assertThat(AgentPhase.CONNECTING.canTransitionTo(AgentPhase.GAME_OVER)).isFalse();
    }

    @Test
    void everyPhase_mayStayPut() {
        for (AgentPhase phase : AgentPhase.values()) {
            assertThat(phase.canTransitionTo(phase)).isTrue();
        }
    }

    @Test
    void shortcuts_areRejected() {
        assertThat(AgentPhase.IDLE.canTransitionTo(AgentPhase.CONNECTED)).isFalse();
        assertThat(AgentPhase.DISCONNECTED.canTransitionTo(AgentPhase.GAME_OVER)).isFalse();
        assertThat(AgentPhase.DISCONNECTED.canTransitionTo(AgentPhase.PLAYING)).isFalse();
        assertThat(AgentPhase.ERRORED.canTransitionTo(AgentPhase.PLAYING)).isFalse();
    }

    @Test
    void resultOutcome_mapsServerStrings() {
        assertThat(ResultOutcome.from("Won")).isEqualTo(ResultOutcome.WIN);
        assertThat(ResultOutcome.from("lost")).isEqualTo(ResultOutcome.LOSS);
        assertThat(ResultOutcome.from(null)).isEqualTo(ResultOutcome.UNKNOWN);
        assertThat(ResultOutcome.TIMEOUT.isLoss()).isTrue();
        assertThat(ResultOutcome.ERROR.isLoss()).isFalse();
    }
}
