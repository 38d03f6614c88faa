package dev.ebullient.detective;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import dev.ebullient.detective.KnowledgeFilter.FilterResult;
import dev.ebullient.detective.RuleTables.CatalogueQuestion;
import dev.ebullient.detective.RuleTables.Scope;
import dev.ebullient.detective.RuleTables.UniqueRole;
import dev.ebullient.detective.chat.ParsedOracleReply;
import dev.ebullient.detective.model.Guess;
import dev.ebullient.detective.model.Subject;
import dev.ebullient.detective.model.Trait;
import dev.ebullient.detective.model.TraitKey;
import io.quarkus.logging.Log;

/**
 * Picks the next move. Rule-based choices come first; the oracle proposal is fetched
 * only when none of them applies.
 */
@Singleton
public class QuestionSelector {

    static final double UNIQUE_ROLE_CONFIDENCE = 0.95;
    static final double STRONG_CONFIDENCE = 0.85;
    static final double MIN_GUESS_CONFIDENCE = 0.01;
    static final double MAX_GUESS_CONFIDENCE = 0.99;

    @Inject
    RuleTables rules;

    @Inject
    KnowledgeFilter filter;

    @Inject
    TopicTracker topics;

    @Inject
    GuessValidator validator;

    @ConfigProperty(name = "detective.confidence-threshold", defaultValue = "0.95")
    double confidenceThreshold;

    @ConfigProperty(name = "detective.entropy.min-candidates", defaultValue = "10")
    int entropyMinCandidates;

    @ConfigProperty(name = "detective.question.max-words", defaultValue = "20")
    int maxQuestionWords;

    @ConfigProperty(name = "detective.guesses.max", defaultValue = "5")
    int maxGuesses;

    public Selection selectNext(GameSession session, FilterResult result, Supplier<ParsedOracleReply> oracleProposal) {
        List<Trait> traits = session.traits();

        Guess holder = uniqueRoleHolder(session, traits);
        if (holder != null) {
            return new Selection.MakeGuess(holder, "only one person holds that office");
        }

        List<Subject> live = result.candidates().stream()
                .filter(s -> !session.isRejected(s.name()))
                .toList();
        List<Guess> ranked = filter.rankGuesses(live, traits, result.relaxed(), live.size());

        if (live.size() > entropyMinCandidates) {
            String question = entropyQuestion(session, live);
            if (question != null) {
                return new Selection.Ask(question, guesses(session, ranked, List.of()), "entropy");
            }
        }

        Selection.MakeGuess direct = directGuess(session, live.size(), ranked);
        if (direct != null) {
            return direct;
        }

        ParsedOracleReply reply = oracleProposal.get();
        List<Guess> oracleGuesses = List.of();
        if (reply instanceof ParsedOracleReply.Valid valid) {
            oracleGuesses = valid.guesses();
            if (valid.hasQuestion()) {
                Selection selection = fromOracle(session, valid.question(), ranked, live.size());
                if (selection instanceof Selection.MakeGuess) {
                    return selection;
                }
                if (selection instanceof Selection.Ask ask) {
                    return new Selection.Ask(ask.question(), guesses(session, ranked, oracleGuesses), "oracle");
                }
            }
        } else if (reply instanceof ParsedOracleReply.Malformed malformed) {
            Log.debugf("%s: oracle reply unusable (%s); using fallbacks", session.id(), malformed.reason());
        }

        List<Guess> guesses = guesses(session, ranked, oracleGuesses);
        for (String question : rules.fallbackQuestions()) {
            if (isAcceptable(session, question, live.size())) {
                return new Selection.Ask(question, guesses, "fallback");
            }
        }
        return new Selection.Ask(emergencyQuestion(session), guesses, "emergency");
    }

    /**
     * A confirmed one-holder office that is currently held names exactly one person.
     */
    Guess uniqueRoleHolder(GameSession session, List<Trait> traits) {
        Trait role = session.trait(TraitKey.ROLE.key());
        if (role == null || role.isNegated()
                || traits.stream().noneMatch(t -> t.is(TraitKey.IN_OFFICE.key(), "true"))) {
            return null;
        }
        for (UniqueRole r : rules.uniqueRoles()) {
            if (r.matches(role.value()) && !session.isRejected(r.holder())) {
                return new Guess(r.holder(), UNIQUE_ROLE_CONFIDENCE);
            }
        }
        return null;
    }

    /**
     * The catalogue question whose probe trait splits the candidates closest to half.
     * Ties keep catalogue order.
     */
    String entropyQuestion(GameSession session, List<Subject> candidates) {
        List<Trait> traits = session.traits();
        Set<String> confirmed = session.confirmedKeys();
        int total = candidates.size();

        CatalogueQuestion best = null;
        double bestScore = Double.MAX_VALUE;
        for (CatalogueQuestion c : rules.catalogue()) {
            if (confirmed.contains(c.key()) || !inScope(c, traits) || ruledOut(c, traits)) {
                continue;
            }
            if (!isAcceptable(session, c.question(), total)) {
                continue;
            }
            Trait probe = new Trait(c.key(), c.value(), 1.0, session.turn());
            long yes = candidates.stream().filter(s -> filter.matches(s, probe)).count();
            if (yes == 0 || yes == total) {
                continue;
            }
            double score = Math.abs(0.5 - (double) yes / total);
            if (score < bestScore) {
                bestScore = score;
                best = c;
            }
        }
        if (best != null) {
            Log.debugf("%s: entropy question '%s' (split score %.3f over %d)", session.id(), best.question(), bestScore,
                    total);
        }
        return best == null ? null : best.question();
    }

    Selection.MakeGuess directGuess(GameSession session, int candidateCount, List<Guess> ranked) {
        if (ranked.isEmpty()) {
            return null;
        }
        int turn = session.turn();
        double top = ranked.get(0).confidence();
        String reason = null;
        if (candidateCount <= 2) {
            reason = candidateCount + " candidates left";
        } else if (candidateCount <= 3 && turn >= 12) {
            reason = "3 candidates left at turn " + turn;
        } else if (candidateCount <= 5 && turn >= 18) {
            reason = candidateCount + " candidates left at turn " + turn;
        } else if (top >= STRONG_CONFIDENCE && candidateCount <= 5) {
            reason = "strong lead among " + candidateCount;
        } else if (top >= confidenceThreshold) {
            reason = "confidence above threshold";
        }
        if (reason == null) {
            return null;
        }
        List<Trait> traits = session.traits();
        for (Guess g : ranked) {
            if (validator.isCompatible(g.name(), traits, session)) {
                return new Selection.MakeGuess(clamp(g), reason);
            }
        }
        if (candidateCount == 1) {
            // exactly one survivor always gets named
            return new Selection.MakeGuess(clamp(ranked.get(0)), reason);
        }
        return null;
    }

    /**
     * An oracle question that names a character becomes a guess if that character is
     * still a ranked candidate; otherwise the question must pass every filter.
     *
     * @return a guess, an ask, or null if the question was dropped
     */
    Selection fromOracle(GameSession session, String question, List<Guess> ranked, int candidateCount) {
        String q = question.trim();
        String name = topics.extractName(q);
        if (name != null) {
            for (Guess g : ranked) {
                if (g.isNamed(name) && !session.isRejected(name)
                        && validator.isCompatible(g.name(), session.traits(), session)) {
                    return new Selection.MakeGuess(clamp(g), "oracle named a candidate");
                }
            }
            Log.debugf("%s: dropped name question '%s'", session.id(), q);
            return null;
        }
        if (!isAcceptable(session, q, candidateCount)) {
            return null;
        }
        return new Selection.Ask(q, List.of(), "oracle");
    }

    boolean isAcceptable(GameSession session, String question, int candidateCount) {
        if (question == null || question.isBlank()) {
            return false;
        }
        List<String> asked = session.askedQuestions();
        if (StringUtils.wordCount(question) > maxQuestionWords) {
            Log.debugf("%s: question too long: %s", session.id(), question);
            return false;
        }
        return !topics.isForbiddenPhrasing(question)
                && !topics.isDuplicate(question, asked)
                && !topics.isRedundant(question, asked, session.confirmedKeys())
                && !topics.conflictsWithTraits(question, session.traits(), session.turn(), candidateCount)
                && !topics.isNameQuestion(question);
    }

    /**
     * Never empty: the first unused emergency question that is not redundant, then the
     * first unused one, then rotation by turn number. The last two steps may return a
     * redundant question; a repeat is preferred over a stalled game.
     */
    String emergencyQuestion(GameSession session) {
        List<String> pool = rules.emergencyQuestions();
        if (pool.isEmpty()) {
            throw new IllegalStateException("No emergency questions configured in rules/questions.yaml");
        }
        List<String> asked = session.askedQuestions();
        for (String q : pool) {
            if (!topics.isDuplicate(q, asked) && !topics.isRedundant(q, asked, session.confirmedKeys())) {
                return q;
            }
        }
        for (String q : pool) {
            if (!topics.isDuplicate(q, asked)) {
                return q;
            }
        }
        Log.warnf("%s: every emergency question has been asked; rotating", session.id());
        return pool.get(session.turn() % pool.size());
    }

    /**
     * Ranked candidates merged with oracle guesses: rejected names removed, screened,
     * clamped and limited.
     */
    List<Guess> guesses(GameSession session, List<Guess> ranked, List<Guess> oracleGuesses) {
        Map<String, Guess> merged = new LinkedHashMap<>();
        List<Guess> all = new ArrayList<>(ranked);
        all.addAll(oracleGuesses);
        for (Guess g : all) {
            if (g.name() == null || session.isRejected(g.name()) || !CandidateStore.isValidName(g.name())) {
                continue;
            }
            merged.merge(StringUtils.normalize(g.name()), clamp(g),
                    (a, b) -> a.confidence() >= b.confidence() ? a : b);
        }
        List<Guess> candidates = merged.values().stream()
                .sorted(Comparator.comparingDouble(Guess::confidence).reversed())
                .limit((long) maxGuesses * 2)
                .toList();
        return validator.screen(candidates, session.traits(), session).stream()
                .limit(maxGuesses)
                .toList();
    }

    private static boolean inScope(CatalogueQuestion c, List<Trait> traits) {
        if (c.scope() == Scope.ANY) {
            return true;
        }
        boolean real = traits.stream().anyMatch(t -> t.is(TraitKey.FICTIONAL.key(), "false"));
        boolean fictional = traits.stream().anyMatch(t -> t.is(TraitKey.FICTIONAL.key(), "true"));
        return c.scope() == Scope.FICTIONAL ? !real : !fictional;
    }

    private static boolean ruledOut(CatalogueQuestion c, List<Trait> traits) {
        return traits.stream().anyMatch(t -> t.key().equals(c.key()) && t.baseValue().equalsIgnoreCase(c.value()));
    }

    private static Guess clamp(Guess g) {
        return g.withConfidence(StringUtils.clamp(g.confidence(), MIN_GUESS_CONFIDENCE, MAX_GUESS_CONFIDENCE));
    }
}
