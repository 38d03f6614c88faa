package dev.ebullient.detective.chat;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import dev.ebullient.detective.model.Guess;

/**
 * What the oracle proposed for the next turn. Only {@link Valid} replies carry a question
 * or guesses; the other variants send the selector straight to its fallbacks.
 */
public sealed interface ParsedOracleReply {

    record Valid(String question, List<Guess> guesses) implements ParsedOracleReply {
        public Valid {
            guesses = guesses == null ? List.of() : List.copyOf(guesses);
        }

        public boolean hasQuestion() {
            return question != null && !question.isBlank();
        }
    }

    record Malformed(String reason) implements ParsedOracleReply {
    }

    record Empty() implements ParsedOracleReply {
    }

    ParsedOracleReply EMPTY = new Empty();

    Pattern CODE_FENCE = Pattern.compile("```(?:json)?");

    static ParsedOracleReply of(DetectiveProposal proposal) {
        if (proposal == null) {
            return EMPTY;
        }
        String question = proposal.question() == null ? null : proposal.question().trim();
        List<Guess> guesses = new ArrayList<>();
        if (proposal.topGuesses() != null) {
            for (Guess g : proposal.topGuesses()) {
                if (g != null && g.name() != null && !g.name().isBlank()) {
                    guesses.add(new Guess(g.name().trim(), g.confidence()));
                }
            }
        }
        if ((question == null || question.isEmpty()) && guesses.isEmpty()) {
            return EMPTY;
        }
        return new Valid(question, guesses);
    }

    /**
     * The JSON object embedded in a model reply: markdown fences and any text around
     * the outermost braces are dropped.
     *
     * @return the object text, or null if the reply holds no braces
     */
    static String jsonObject(String raw) {
        if (raw == null) {
            return null;
        }
        String text = CODE_FENCE.matcher(raw).replaceAll("").trim();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end < start) {
            return null;
        }
        return text.substring(start, end + 1);
    }
}
