package dev.ebullient.detective;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

import dev.ebullient.detective.model.AnswerValue;
import dev.ebullient.detective.model.EngineState;
import dev.ebullient.detective.model.Guess;
import dev.ebullient.detective.model.ReferenceTraits;
import dev.ebullient.detective.model.RejectedGuess;
import dev.ebullient.detective.model.Trait;
import dev.ebullient.detective.model.Turn;

/**
 * State of one game: the trait ledger, the question history, rejected guesses and
 * questions the player could not answer. Owned by a single caller; the engine mutates it
 * only between oracle round-trips.
 */
public class GameSession {

    private final String id;

    // Ordered by recency: a replaced trait moves to the end
    private final List<Trait> ledger = new ArrayList<>();
    private final List<Turn> turns = new ArrayList<>();
    private final List<RejectedGuess> rejectedGuesses = new ArrayList<>();
    private final List<String> ambiguousQuestions = new ArrayList<>();

    // Guess validator lookups may fill this concurrently within one turn
    private final Map<String, ReferenceTraits> lookupCache = new ConcurrentHashMap<>();

    private long seed;
    private int turn;
    private String currentQuestion;
    private String pendingGuess;
    private boolean beyondDatabase;
    private List<Guess> guesses = List.of();
    private EngineState state = EngineState.IDLE;

    public GameSession(String id) {
        this.id = id;
        this.seed = newSeed();
    }

    public String id() {
        return id;
    }

    /**
     * Clear the ledger, history, rejections, ambiguous questions and lookup cache,
     * and draw a fresh seed.
     */
    public void reset() {
        ledger.clear();
        turns.clear();
        rejectedGuesses.clear();
        ambiguousQuestions.clear();
        lookupCache.clear();
        seed = newSeed();
        turn = 0;
        currentQuestion = null;
        pendingGuess = null;
        beyondDatabase = false;
        guesses = List.of();
        state = EngineState.IDLE;
    }

    // --- Trait ledger ---

    /**
     * Add a trait; an existing trait with the same key is replaced.
     */
    public void putTrait(Trait trait) {
        ledger.removeIf(t -> t.key().equals(trait.key()));
        ledger.add(trait);
    }

    public List<Trait> traits() {
        return List.copyOf(ledger);
    }

    public Trait trait(String key) {
        for (Trait t : ledger) {
            if (t.key().equals(key)) {
                return t;
            }
        }
        return null;
    }

    /** Keys settled with a positive value (NOT_x values leave the key open). */
    public Set<String> confirmedKeys() {
        return confirmedKeys(ledger);
    }

    public static Set<String> confirmedKeys(List<Trait> traits) {
        Set<String> keys = new LinkedHashSet<>();
        for (Trait t : traits) {
            if (!t.isNegated()) {
                keys.add(t.key());
            }
        }
        return keys;
    }

    // --- Turn history ---

    public Turn recordAnswer(AnswerValue answer) {
        if (currentQuestion == null) {
            throw new IllegalStateException("No question is waiting for an answer");
        }
        Turn t = new Turn(turn, currentQuestion, answer);
        turns.add(t);
        if (answer == AnswerValue.DONT_KNOW) {
            ambiguousQuestions.add(currentQuestion);
        }
        return t;
    }

    public List<Turn> turns() {
        return Collections.unmodifiableList(turns);
    }

    public List<String> askedQuestions() {
        return turns.stream().map(Turn::question).toList();
    }

    public List<String> ambiguousQuestions() {
        return Collections.unmodifiableList(ambiguousQuestions);
    }

    // --- Rejected guesses ---

    /**
     * Record a wrong guess. The trait snapshot is copied now and never updated.
     */
    public void rejectGuess(String name) {
        if (name == null || name.isBlank() || isRejected(name)) {
            return;
        }
        rejectedGuesses.add(new RejectedGuess(name.trim(), ledger, turn));
    }

    public boolean isRejected(String name) {
        if (name == null) {
            return false;
        }
        String n = name.trim();
        return rejectedGuesses.stream().anyMatch(r -> r.name().equalsIgnoreCase(n));
    }

    public List<RejectedGuess> rejectedGuesses() {
        return Collections.unmodifiableList(rejectedGuesses);
    }

    public List<String> rejectedNames() {
        return rejectedGuesses.stream().map(RejectedGuess::name).toList();
    }

    // --- Lookup cache ---

    public Map<String, ReferenceTraits> lookupCache() {
        return lookupCache;
    }

    // --- Per-turn presentation state ---

    public int turn() {
        return turn;
    }

    public int nextTurn() {
        return ++turn;
    }

    public String currentQuestion() {
        return currentQuestion;
    }

    public void setCurrentQuestion(String currentQuestion) {
        this.currentQuestion = currentQuestion;
    }

    public String pendingGuess() {
        return pendingGuess;
    }

    public void setPendingGuess(String pendingGuess) {
        this.pendingGuess = pendingGuess;
    }

    /** True while the pending guess names someone outside the candidate store. */
    public boolean beyondDatabase() {
        return beyondDatabase;
    }

    public void setBeyondDatabase(boolean beyondDatabase) {
        this.beyondDatabase = beyondDatabase;
    }

    public List<Guess> guesses() {
        return guesses;
    }

    public void setGuesses(List<Guess> guesses) {
        this.guesses = List.copyOf(guesses);
    }

    public EngineState state() {
        return state;
    }

    public void setState(EngineState state) {
        this.state = state;
    }

    public long seed() {
        return seed;
    }

    private static long newSeed() {
        return ThreadLocalRandom.current().nextLong(Integer.MAX_VALUE);
    }
}
