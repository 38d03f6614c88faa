package dev.ebullient.detective;

import java.util.List;

import dev.ebullient.detective.model.Guess;

/**
 * What the engine does next: ask a question, or name a character.
 */
public sealed interface Selection {

    /**
     * @param source where the question came from: entropy, oracle, fallback or emergency
     */
    record Ask(String question, List<Guess> guesses, String source) implements Selection {
        public Ask {
            guesses = List.copyOf(guesses);
        }
    }

    record MakeGuess(Guess guess, String reason) implements Selection {
    }
}
