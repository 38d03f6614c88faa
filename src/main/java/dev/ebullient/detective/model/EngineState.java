package dev.ebullient.detective.model;

public enum EngineState {
    IDLE,
    ASKING,
    GUESSING,
    /** No subject in the candidate store survives the ledger, even relaxed. */
    KNOWLEDGE_EXHAUSTED,
    SOLVED
}
