package com.deepansh.gameagent.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Normalized view of one inbound server payload.
 *
 * Correlation ids, the kind tag and the kind-specific fields are extracted;
 * every other top-level field is kept in {@link #gameData} in arrival order.
 * {@code ackSubject} is non-null iff {@code kind == ACKNOWLEDGMENT}.
 */
@Value
@Builder
public class GameMessage {

    /** Original payload text, exactly as received */
    String raw;

    String matchId;
    String gameId;
    String playerId;

    MessageKind kind;

    /** Present only on ACKNOWLEDGMENT: the "ackFor" subject */
    String ackSubject;

    /** Present only on ACKNOWLEDGMENT: empty, a clue string, or structured metadata */
    JsonNode ackPayload;

    /** Present only on COMMAND, e.g. "guess" */
    String command;

    /** Present only on RESULT */
    ResultOutcome outcome;

    @Builder.Default
    Map<String, JsonNode> gameData = Map.of();

    /** One-time token the server expects echoed back with the move. */
    public String getOtp() {
        return text("otp");
    }

    /** The revealed answer on a result event ("word", or "answer" on some servers). */
    public String getAnswer() {
        String word = text("word");
        return word != null ? word : text("answer");
    }

    public Integer getWordLength() {
        return integer("wordLength");
    }

    public Integer getMaxAttempts() {
        return integer("maxAttempts");
    }

    public Integer getCurrentAttempt() {
        return integer("currentAttempt");
    }

    public String getLastGuess() {
        String guess = text("lastGuess");
        return guess != null ? guess : "";
    }

    /** Feedback for {@link #getLastGuess()}, normalized to CORRECT / PRESENT / ABSENT. */
    public List<Feedback> getLastFeedback() {
        JsonNode node = gameData.get("lastResult");
        if (node == null || !node.isArray()) return List.of();
        List<Feedback> feedback = new ArrayList<>(node.size());
        node.forEach(token -> feedback.add(Feedback.normalize(token.asText())));
        return Collections.unmodifiableList(feedback);
    }

    public boolean has(String field) {
        JsonNode node = gameData.get(field);
        return node != null && !node.isNull();
    }

    /** Scalar field as text; null when absent, JSON null, or not a scalar. */
    public String text(String field) {
        JsonNode node = gameData.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) return null;
        return node.asText();
    }

    /** Integer field; null when absent or not numeric. */
    public Integer integer(String field) {
        JsonNode node = gameData.get(field);
        if (node == null) return null;
        if (node.canConvertToInt()) return node.asInt();
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public boolean isKind(MessageKind expected) {
        return kind == expected;
    }
}
