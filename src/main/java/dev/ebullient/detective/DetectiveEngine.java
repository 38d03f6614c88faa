package dev.ebullient.detective;

import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import dev.ebullient.detective.KnowledgeFilter.FilterResult;
import dev.ebullient.detective.chat.OracleService;
import dev.ebullient.detective.model.AnswerValue;
import dev.ebullient.detective.model.EngineState;
import dev.ebullient.detective.model.Guess;
import dev.ebullient.detective.model.SessionOutput;
import dev.ebullient.detective.model.Trait;
import io.quarkus.logging.Log;

/**
 * Runs one turn at a time: record the answer, update the ledger, filter, pick the next move.
 */
@ApplicationScoped
public class DetectiveEngine {

    static final double BEYOND_DATABASE_MAX_CONFIDENCE = 0.8;
    static final int PROMPT_CANDIDATES = 10;

    @Inject
    KnowledgeFilter filter;

    @Inject
    TraitExtractor extractor;

    @Inject
    QuestionSelector selector;

    @Inject
    GuessValidator validator;

    @Inject
    TopicTracker topics;

    @Inject
    OracleService oracle;

    @ConfigProperty(name = "detective.beyond-database.min-turn", defaultValue = "15")
    int beyondDatabaseMinTurn;

    /**
     * Clear the session and ask the first question.
     */
    public SessionOutput start(GameSession session) {
        session.reset();
        Log.debugf("%s: new game (seed %d)", session.id(), session.seed());
        return nextMove(session);
    }

    public SessionOutput answer(GameSession session, AnswerValue answer) {
        requireState(session, EngineState.ASKING, EngineState.KNOWLEDGE_EXHAUSTED);
        String question = session.currentQuestion();
        session.recordAnswer(answer);

        String named = topics.extractName(question);
        if (named != null && answer.isNegative()) {
            Log.debugf("%s: '%s' answered %s; rejecting %s", session.id(), question, answer.value(), named);
            session.rejectGuess(named);
        } else if (named != null && answer.isPositive()) {
            session.setPendingGuess(named);
            return solved(session);
        } else {
            Trait trait = extractor.extract(session, question, answer);
            if (trait != null) {
                session.putTrait(trait);
                Log.debugf("%s: turn %d %s=%s (%.2f)", session.id(), session.turn(), trait.key(), trait.value(),
                        trait.confidence());
                for (Trait deduced : extractor.deduce(session.traits(), session.turn())) {
                    session.putTrait(deduced);
                    Log.debugf("%s: deduced %s=%s", session.id(), deduced.key(), deduced.value());
                }
            }
        }
        return nextMove(session);
    }

    /**
     * The player's verdict on the pending guess. A wrong guess is remembered with the traits
     * known at that moment, and questioning resumes.
     */
    public SessionOutput confirmGuess(GameSession session, boolean correct) {
        requireState(session, EngineState.GUESSING);
        String guess = session.pendingGuess();
        if (correct) {
            return solved(session);
        }
        Log.debugf("%s: %s rejected at turn %d", session.id(), guess, session.turn());
        session.rejectGuess(guess);
        session.setPendingGuess(null);
        session.setBeyondDatabase(false);
        return nextMove(session);
    }

    /**
     * Abandon the current game and start over with a new seed.
     */
    public SessionOutput reset(GameSession session) {
        return start(session);
    }

    public SessionOutput output(GameSession session) {
        return new SessionOutput(session.id(),
                session.turn(),
                session.currentQuestion(),
                session.traits(),
                session.guesses(),
                session.state() == EngineState.GUESSING,
                session.state(),
                session.seed(),
                session.beyondDatabase());
    }

    // --- Private helpers ---

    SessionOutput nextMove(GameSession session) {
        session.nextTurn();
        FilterResult result = filter.filter(session.traits());
        if (result.relaxed()) {
            Log.debugf("%s: relaxed filter dropped %s=%s", session.id(),
                    result.dropped().key(), result.dropped().value());
        }

        if (result.isEmpty()) {
            if (session.turn() >= beyondDatabaseMinTurn) {
                Guess outside = beyondDatabaseGuess(session);
                if (outside != null) {
                    session.setBeyondDatabase(true);
                    return guess(session, outside, "no known character matches");
                }
            }
            session.setState(EngineState.KNOWLEDGE_EXHAUSTED);
        } else {
            session.setState(EngineState.ASKING);
        }

        Selection selection = selector.selectNext(session, result,
                () -> oracle.proposeQuestion(session, filter.candidateContext(result.candidates(), PROMPT_CANDIDATES)));

        if (selection instanceof Selection.MakeGuess makeGuess) {
            return guess(session, makeGuess.guess(), makeGuess.reason());
        }
        Selection.Ask ask = (Selection.Ask) selection;
        session.setCurrentQuestion(ask.question());
        session.setGuesses(ask.guesses());
        session.setPendingGuess(null);
        Log.debugf("%s: turn %d asks '%s' (%s)", session.id(), session.turn(), ask.question(), ask.source());
        return output(session);
    }

    private SessionOutput guess(GameSession session, Guess guess, String reason) {
        Log.infof("%s: turn %d guesses %s (%.2f): %s", session.id(), session.turn(), guess.name(),
                guess.confidence(), reason);
        session.setCurrentQuestion(null);
        session.setPendingGuess(guess.name());
        session.setGuesses(List.of(guess));
        session.setState(EngineState.GUESSING);
        return output(session);
    }

    private SessionOutput solved(GameSession session) {
        Log.infof("%s: solved at turn %d: %s", session.id(), session.turn(), session.pendingGuess());
        session.setCurrentQuestion(null);
        session.setState(EngineState.SOLVED);
        return output(session);
    }

    /**
     * Names outside the candidate store, capped below the store's own confidence and screened
     * against the ledger.
     */
    Guess beyondDatabaseGuess(GameSession session) {
        List<Guess> proposed = oracle.beyondDatabase(session).stream()
                .filter(g -> !session.isRejected(g.name()) && CandidateStore.isValidName(g.name()))
                .map(g -> g.withConfidence(StringUtils.clamp(g.confidence(), 0.01, BEYOND_DATABASE_MAX_CONFIDENCE)))
                .sorted(Comparator.comparingDouble(Guess::confidence).reversed())
                .toList();
        List<Guess> screened = validator.screen(proposed, session.traits(), session);
        return screened.isEmpty() ? null : screened.get(0);
    }

    private static void requireState(GameSession session, EngineState... allowed) {
        for (EngineState s : allowed) {
            if (session.state() == s) {
                return;
            }
        }
        throw new IllegalStateException("Session " + session.id() + " is " + session.state());
    }
}
