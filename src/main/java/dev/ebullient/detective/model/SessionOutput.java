package dev.ebullient.detective.model;

import java.util.List;

/**
 * What the presentation layer sees after each turn.
 */
public record SessionOutput(
        String sessionId,
        int turn,
        String question,
        List<Trait> traits,
        List<Guess> guesses,
        boolean guessPhase,
        EngineState state,
        long seed,
        boolean beyondDatabase) {
}
