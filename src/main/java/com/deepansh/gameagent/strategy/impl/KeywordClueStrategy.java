package com.deepansh.gameagent.strategy.impl;

import com.deepansh.gameagent.core.GameContext;
import com.deepansh.gameagent.model.GameMessage;
import com.deepansh.gameagent.strategy.GameStrategy;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Clue-guessing strategy that answers from keywords found in the clues.
 *
 * All clues of the current game are joined and lower-cased, then the rules
 * are tried in order; the first match wins. Without a match the default
 * answer is sent.
 */
@Slf4j
public class KeywordClueStrategy implements GameStrategy {

    public static final String DEFAULT_ANSWER = "anthropic";

    /** One keyword rule: the answer to send when {@code matches} accepts the joined clues */
    public record Rule(String answer, Predicate<String> matches) {

        public static Rule allOf(String answer, String... keywords) {
            return new Rule(answer, text -> List.of(keywords).stream().allMatch(text::contains));
        }

        public static Rule anyOf(String answer, String... keywords) {
            return new Rule(answer, text -> List.of(keywords).stream().anyMatch(text::contains));
        }
    }

    private final List<Rule> rules;
    private final String defaultAnswer;

    public KeywordClueStrategy() {
        this(defaultRules(), DEFAULT_ANSWER);
    }

    public KeywordClueStrategy(List<Rule> rules, String defaultAnswer) {
        this.rules = List.copyOf(rules);
        this.defaultAnswer = defaultAnswer;
    }

    public static List<Rule> defaultRules() {
        return List.of(
                Rule.allOf("anthropic", "claude", "ai"),
                Rule.anyOf("openai", "chatgpt", "gpt"),
                Rule.anyOf("google", "gemini", "bard")
        );
    }

    @Override
    public void onGameStarted(GameMessage message, GameContext context) {
        log.info("New clue game [gameId={}]", context.getGameId());
    }

    @Override
    public void onClueReceived(String clue, GameMessage message, GameContext context) {
        log.debug("Clue noted: {}", clue);
    }

    @Override
    public CompletableFuture<Optional<String>> makeMove(GameMessage message, GameContext context) {
        return CompletableFuture.completedFuture(Optional.of(answer(context.getClues())));
    }

    @Override
    public void onGameEnded(GameMessage message, GameContext context) {
        log.info("Game over with {} clue(s), outcome={}", context.getClues().size(), message.getOutcome());
    }

    String answer(List<String> clues) {
        if (clues.isEmpty()) {
            log.warn("No clues received yet, using default answer");
            return defaultAnswer;
        }
        String text = String.join(" ", clues).toLowerCase(Locale.ROOT);
        return rules.stream()
                .filter(rule -> rule.matches().test(text))
                .map(Rule::answer)
                .findFirst()
                .orElse(defaultAnswer);
    }
}
