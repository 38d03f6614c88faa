package dev.ebullient.detective.model;

import java.util.List;

/**
 * A guess the player said was wrong, with the ledger as it stood at that moment.
 */
public record RejectedGuess(
        String name,
        List<Trait> traitsAtRejection,
        int turn) {

    public RejectedGuess {
        traitsAtRejection = List.copyOf(traitsAtRejection);
    }
}
