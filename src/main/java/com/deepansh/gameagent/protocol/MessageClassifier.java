package com.deepansh.gameagent.protocol;

import com.deepansh.gameagent.model.GameMessage;
import com.deepansh.gameagent.model.MessageKind;
import com.deepansh.gameagent.model.ResultOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns raw inbound text into a {@link GameMessage}.
 *
 * Classification is total and never throws. Priority order:
 * <ol>
 *   <li>{@code type} is an error marker → ERROR</li>
 *   <li>{@code type} is an ack marker → ACKNOWLEDGMENT (subject from {@code ackFor})</li>
 *   <li>non-blank {@code command} → COMMAND</li>
 *   <li>{@code result} present, or a result {@code type} → RESULT</li>
 *   <li>game-start {@code type} → GAME_START</li>
 *   <li>anything else → UNKNOWN</li>
 * </ol>
 * Payloads that are not a JSON object are UNKNOWN, or ERROR when the raw text
 * still carries an error type marker.
 */
@Slf4j
public class MessageClassifier {

    static final String TYPE_FIELD = "type";
    static final String MATCH_ID = "matchId";
    static final String GAME_ID = "gameId";
    static final String PLAYER_ID = "yourId";
    static final String ACK_FOR = "ackFor";
    static final String ACK_DATA = "ackData";
    static final String COMMAND_FIELD = "command";
    static final String RESULT_FIELD = "result";

    private static final Set<String> EXTRACTED_FIELDS =
            Set.of(TYPE_FIELD, MATCH_ID, GAME_ID, PLAYER_ID, ACK_FOR, ACK_DATA, COMMAND_FIELD, RESULT_FIELD);

    private static final Set<String> ACK_TYPES = Set.of("ack", "acknowledgement", "acknowledgment");
    private static final Set<String> RESULT_TYPES = Set.of("result", "game result", "game_result");
    private static final Set<String> GAME_START_TYPES = Set.of("game start", "game_start", "start");

    private static final Pattern ERROR_MARKER =
            Pattern.compile("\"type\"\\s*:\\s*\"error\"", Pattern.CASE_INSENSITIVE);

    private static final int LOG_PREVIEW = 200;

    private final ObjectMapper objectMapper;

    public MessageClassifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public GameMessage classify(String raw) {
        if (raw == null || raw.isBlank()) {
            return malformed(raw == null ? "" : raw, "empty payload");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return malformed(raw, e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return malformed(raw, "not a JSON object");
        }

        String type = lower(text(root, TYPE_FIELD));
        MessageKind kind = kindOf(root, type);

        GameMessage.GameMessageBuilder builder = GameMessage.builder()
                .raw(raw)
                .kind(kind)
                .matchId(text(root, MATCH_ID))
                .gameId(text(root, GAME_ID))
                .playerId(text(root, PLAYER_ID))
                .gameData(gameData(root));

        switch (kind) {
            case ACKNOWLEDGMENT -> {
                String subject = text(root, ACK_FOR);
                builder.ackSubject(subject != null ? subject.trim() : "")
                        .ackPayload(root.get(ACK_DATA));
            }
            case COMMAND -> builder.command(text(root, COMMAND_FIELD).trim());
            case RESULT -> builder.outcome(ResultOutcome.from(text(root, RESULT_FIELD)));
            default -> { }
        }

        GameMessage message = builder.build();
        log.debug("Classified {} [matchId={}, gameId={}]", kind, message.getMatchId(), message.getGameId());
        return message;
    }

    private MessageKind kindOf(JsonNode root, String type) {
        if ("error".equals(type)) {
            return MessageKind.ERROR;
        }
        if (type != null && ACK_TYPES.contains(type)) {
            return MessageKind.ACKNOWLEDGMENT;
        }
        String command = text(root, COMMAND_FIELD);
        if (command != null && !command.isBlank()) {
            return MessageKind.COMMAND;
        }
        if (root.hasNonNull(RESULT_FIELD) || (type != null && RESULT_TYPES.contains(type))) {
            return MessageKind.RESULT;
        }
        if (type != null && GAME_START_TYPES.contains(type)) {
            return MessageKind.GAME_START;
        }
        return MessageKind.UNKNOWN;
    }

    private GameMessage malformed(String raw, String reason) {
        MessageKind kind = ERROR_MARKER.matcher(raw).find() ? MessageKind.ERROR : MessageKind.UNKNOWN;
        log.warn("Malformed payload classified as {} ({}): {}", kind, reason, preview(raw));
        return GameMessage.builder()
                .raw(raw)
                .kind(kind)
                .build();
    }

    private static Map<String, JsonNode> gameData(JsonNode root) {
        Map<String, JsonNode> data = new LinkedHashMap<>();
        root.fields().forEachRemaining(field -> {
            if (!EXTRACTED_FIELDS.contains(field.getKey())) {
                data.put(field.getKey(), field.getValue());
            }
        });
        return Collections.unmodifiableMap(data);
    }

    /** Scalars as text, so numeric ids still correlate; objects and arrays are not text. */
    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) return null;
        return node.asText();
    }

    private static String lower(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    private static String preview(String raw) {
        return raw.length() <= LOG_PREVIEW ? raw : raw.substring(0, LOG_PREVIEW) + "...[truncated]";
    }
}
