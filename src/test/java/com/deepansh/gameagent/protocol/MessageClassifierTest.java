package com.deepansh.gameagent.protocol;

import com.deepansh.gameagent.model.Feedback;
import com.deepansh.gameagent.model.GameMessage;
import com.deepansh.gameagent.model.MessageKind;
import com.deepansh.gameagent.model.ResultOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class MessageClassifierTest {

    private final MessageClassifier classifier = new MessageClassifier(new ObjectMapper());

    @Test
    void classify_ackWithClue_extractsSubjectPayloadAndIds() {
        GameMessage message = classifier.classify(
                "{\"matchId\":\"m1\",\"gameId\":\"g1\",\"yourId\":\"p7\",\"type\":\"ack\","
                        + "\"ackFor\":\"meta data\",\"ackData\":\"Made by the makers of Claude\"}");

        assertThat(message.getKind()).isEqualTo(MessageKind.ACKNOWLEDGMENT);
        assertThat(message.getMatchId()).isEqualTo("m1");
        assertThat(message.getGameId()).isEqualTo("g1");
        assertThat(message.getPlayerId()).isEqualTo("p7");
        assertThat(message.getAckSubject()).isEqualTo("meta data");
        assertThat(message.getAckPayload().asText()).isEqualTo("Made by the makers of Claude");
    }

    @Test
    void classify_ackWithoutSubject_hasEmptySubject() {
        GameMessage message = classifier.classify("{\"type\":\"ack\"}");

        assertThat(message.getKind()).isEqualTo(MessageKind.ACKNOWLEDGMENT);
        assertThat(message.getAckSubject()).isEmpty();
    }

    @Test
    void classify_command_keepsOtpInGameData() {
        GameMessage message = classifier.classify(
                "{\"matchId\":\"m1\",\"gameId\":\"g1\",\"command\":\"guess\",\"otp\":\"123\",\"wordLength\":5}");

        assertThat(message.getKind()).isEqualTo(MessageKind.COMMAND);
        assertThat(message.getCommand()).isEqualTo("guess");
        assertThat(message.getOtp()).isEqualTo("123");
        assertThat(message.getWordLength()).isEqualTo(5);
        assertThat(message.getGameData()).doesNotContainKeys("matchId", "gameId", "command");
    }

    @Test
    void classify_result_mapsOutcomeAndAnswer() {
        GameMessage message = classifier.classify(
                "{\"matchId\":\"m1\",\"gameId\":\"g1\",\"type\":\"result\",\"result\":\"win\",\"word\":\"crane\"}");

        assertThat(message.getKind()).isEqualTo(MessageKind.RESULT);
        assertThat(message.getOutcome()).isEqualTo(ResultOutcome.WIN);
        assertThat(message.getAnswer()).isEqualTo("crane");
    }

    @Test
    void classify_resultWithUnrecognizedOutcome_isUnknownOutcome() {
        GameMessage message = classifier.classify("{\"type\":\"result\",\"result\":\"draw-ish\"}");

        assertThat(message.getKind()).isEqualTo(MessageKind.RESULT);
        assertThat(message.getOutcome()).isEqualTo(ResultOutcome.UNKNOWN);
    }

    @Test
    void classify_errorType_winsOverOtherFields() {
        GameMessage message = classifier.classify("{\"type\":\"error\",\"command\":\"guess\",\"message\":\"bad otp\"}");

        assertThat(message.getKind()).isEqualTo(MessageKind.ERROR);
        assertThat(message.text("message")).isEqualTo("bad otp");
    }

    @Test
    void classify_legacyGameStart_isGameStart() {
        GameMessage message = classifier.classify(
                "{\"type\":\"game start\",\"matchId\":\"m1\",\"gameId\":\"g2\",\"wordLength\":5,\"maxAttempts\":6}");

        assertThat(message.getKind()).isEqualTo(MessageKind.GAME_START);
        assertThat(message.getMaxAttempts()).isEqualTo(6);
    }

    @Test
    void classify_wordleFeedback_isNormalized() {
        GameMessage message = classifier.classify(
                "{\"command\":\"guess\",\"lastGuess\":\"crane\",\"lastResult\":[\"correct\",\"y\",\"GREEN\",\"absent\",\"?\"]}");

        assertThat(message.getLastGuess()).isEqualTo("crane");
        assertThat(message.getLastFeedback()).containsExactly(
                Feedback.CORRECT, Feedback.PRESENT, Feedback.CORRECT, Feedback.ABSENT, Feedback.ABSENT);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "not json", "[1,2,3]", "42", "{\"matchId\":", "{\"foo\":\"bar\"}"})
    void classify_garbage_isUnknown(String raw) {
        GameMessage message = classifier.classify(raw);

        assertThat(message.getKind()).isEqualTo(MessageKind.UNKNOWN);
        assertThat(message.getRaw()).isEqualTo(raw);
    }

    @Test
    void classify_truncatedErrorPayload_isStillError() {
        GameMessage message = classifier.classify("{\"type\": \"error\", \"message\": \"boom");

        assertThat(message.getKind()).isEqualTo(MessageKind.ERROR);
    }

    @Test
    void classify_null_isUnknown() {
        assertThat(classifier.classify(null).getKind()).isEqualTo(MessageKind.UNKNOWN);
    }
}
