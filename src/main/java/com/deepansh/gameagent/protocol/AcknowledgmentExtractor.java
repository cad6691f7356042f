package com.deepansh.gameagent.protocol;

import com.deepansh.gameagent.model.GameMessage;
import com.deepansh.gameagent.model.MessageKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Recognizes acknowledgment subjects and derives lifecycle signals from them.
 *
 * Dispatch is a table keyed by normalized subject. Subjects not in the table
 * map to {@link AckSignal.Type#OTHER}. Never throws.
 */
@Slf4j
public class AcknowledgmentExtractor {

    public static final String GAME_STARTED = "game started";
    public static final String META_DATA = "meta data";

    private final Map<String, Function<GameMessage, AckSignal>> handlers;

    public AcknowledgmentExtractor() {
        Function<GameMessage, AckSignal> clue = this::extractClue;
        this.handlers = Map.of(
                GAME_STARTED, message -> AckSignal.gameStarted(),
                "game start", message -> AckSignal.gameStarted(),
                META_DATA, clue,
                "metadata", clue,
                "meta-data", clue,
                "clue", clue
        );
    }

    public AckSignal extract(GameMessage message) {
        if (message == null || !message.isKind(MessageKind.ACKNOWLEDGMENT)) {
            return AckSignal.none();
        }
        String subject = normalize(message.getAckSubject());
        Function<GameMessage, AckSignal> handler = handlers.get(subject);
        if (handler == null) {
            log.debug("Unrecognized acknowledgment subject '{}'", message.getAckSubject());
            return AckSignal.other();
        }
        return handler.apply(message);
    }

    public boolean recognizes(String subject) {
        return handlers.containsKey(normalize(subject));
    }

    private AckSignal extractClue(GameMessage message) {
        String clue = render(message.getAckPayload());
        return clue.isBlank() ? AckSignal.emptyClue() : AckSignal.clue(clue);
    }

    /** Strings as-is, scalars as text, objects and arrays as compact JSON. */
    private static String render(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) return "";
        if (payload.isContainerNode()) return payload.isEmpty() ? "" : payload.toString();
        return payload.asText();
    }

    private static String normalize(String subject) {
        return subject == null ? "" : subject.trim().toLowerCase(Locale.ROOT);
    }
}
