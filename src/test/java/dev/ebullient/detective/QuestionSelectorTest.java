package dev.ebullient.detective;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import dev.ebullient.detective.KnowledgeFilter.FilterResult;
import dev.ebullient.detective.chat.ParsedOracleReply;
import dev.ebullient.detective.model.AnswerValue;
import dev.ebullient.detective.model.Guess;
import dev.ebullient.detective.model.Trait;

class QuestionSelectorTest {

    static final Supplier<ParsedOracleReply> NO_ORACLE = () -> {
        throw new AssertionError("oracle should not be consulted");
    };

    GuessValidator validator;

    @AfterEach
    void tearDown() {
        if (validator != null) {
            validator.shutdown();
        }
    }

    QuestionSelector selector(CandidateStore store) {
        validator = Fixtures.validator(store, null);
        return Fixtures.selector(store, validator);
    }

    static CandidateStore sixCandidates() {
        return Fixtures.store(
                Fixtures.entry("Alpha Hero", "superheroes", true, Map.of("gender", "male", "alignment", "hero")),
                Fixtures.entry("Beta Villain", "superheroes", true, Map.of("gender", "male", "alignment", "villain")),
                Fixtures.entry("Gamma Girl", "anime", true, Map.of("gender", "female", "origin_medium", "manga")),
                Fixtures.entry("Delta Actor", "actors", false, Map.of("gender", "male", "nationality", "american")),
                Fixtures.entry("Epsilon Spy", "tv-characters", true, Map.of("gender", "female")),
                Fixtures.entry("Zeta Pilot", "video-games", true, Map.of("gender", "male")));
    }

    @Test
    void manyCandidates_asksTheBestSplittingQuestion() {
        // 40 male comic-book characters; each attribute splits the pool differently
        List<CandidateStore.Entry> entries = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            entries.add(Fixtures.entry("Masked Hero " + (char) ('A' + i % 26) + i, "superheroes", true,
                    Map.of("gender", "male",
                            "origin_medium", "comic_book",
                            "species", i % 10 == 0 ? "alien" : "human",
                            "has_powers", String.valueOf(i % 20 < 9),
                            "publisher", i % 10 < 7 ? "marvel" : "dc",
                            "has_team", String.valueOf(i % 4 != 3),
                            "alignment", i % 4 == 0 ? "villain" : "hero")));
        }
        QuestionSelector selector = selector(Fixtures.store(entries));

        GameSession session = new GameSession("entropy");
        Fixtures.answered(session, "Is your character fictional?", AnswerValue.YES);
        session.putTrait(new Trait("fictional", "true", 0.9, 1));
        Fixtures.answered(session, "Is your character male?", AnswerValue.YES);
        session.putTrait(new Trait("gender", "male", 0.9, 2));
        Fixtures.answered(session, "Did your character originate in a comic book?", AnswerValue.YES);
        session.putTrait(new Trait("origin_medium", "comic_book", 0.9, 3));
        session.nextTurn();

        FilterResult result = selector.filter.filter(session.traits());
        assertEquals(40, result.size());

        Selection selection = selector.selectNext(session, result, NO_ORACLE);

        Selection.Ask ask = assertInstanceOf(Selection.Ask.class, selection);
        assertEquals("entropy", ask.source());
        assertEquals("Does your character have superpowers?", ask.question());
        assertFalse(ask.question().equalsIgnoreCase("Is your character fictional?"));
        assertFalse(ask.question().equalsIgnoreCase("Is your character male?"));
        assertFalse(ask.guesses().isEmpty());
        assertTrue(ask.guesses().size() <= 5);

        RuleTables.CatalogueQuestion asked = Fixtures.RULES.catalogue().stream()
                .filter(c -> c.question().equals(ask.question()))
                .findFirst().orElseThrow();
        Trait yesAnswer = new Trait(asked.key(), asked.value(), 1.0, 4);
        long yes = result.candidates().stream().filter(s -> selector.filter.matches(s, yesAnswer)).count();
        double split = (double) yes / result.size();
        assertTrue(Math.abs(split - 0.5) <= 0.1, "split was " + split);
    }

    @Test
    void oracleNationalityQuestion_isNotTreatedAsAName() {
        QuestionSelector selector = selector(sixCandidates());
        GameSession session = new GameSession("canadian");
        session.nextTurn();

        Selection selection = selector.selectNext(session, selector.filter.filter(List.of()),
                () -> new ParsedOracleReply.Valid("Is your character Canadian?", List.of()));

        Selection.Ask ask = assertInstanceOf(Selection.Ask.class, selection);
        assertEquals("Is your character Canadian?", ask.question());
        assertEquals("oracle", ask.source());
    }

    @Test
    void currentOfficeHolder_isGuessedDirectly() {
        QuestionSelector selector = selector(Fixtures.bundledStore());
        GameSession session = new GameSession("office");
        session.nextTurn();
        session.putTrait(new Trait("role", "us_president", 0.9, 1));
        session.putTrait(new Trait("in_office", "true", 0.9, 1));

        Selection selection = selector.selectNext(session, new FilterResult(List.of(), false, null), NO_ORACLE);

        Selection.MakeGuess guess = assertInstanceOf(Selection.MakeGuess.class, selection);
        assertEquals("Donald Trump", guess.guess().name());
        assertEquals(0.95, guess.guess().confidence(), 0.0001);
    }

    @Test
    void rejectedOfficeHolder_fallsThroughToQuestions() {
        QuestionSelector selector = selector(Fixtures.bundledStore());
        GameSession session = new GameSession("office");
        session.nextTurn();
        session.putTrait(new Trait("role", "us_president", 0.9, 1));
        session.putTrait(new Trait("in_office", "true", 0.9, 1));
        session.rejectGuess("Donald Trump");

        Selection selection = selector.selectNext(session, new FilterResult(List.of(), false, null),
                () -> ParsedOracleReply.EMPTY);

        assertInstanceOf(Selection.Ask.class, selection);
    }

    @Test
    void twoCandidates_guessTheBestRanked() {
        CandidateStore store = Fixtures.store(
                Fixtures.entry("Alpha Hero", "superheroes", true, Map.of("gender", "male")),
                Fixtures.entry("Beta Villain", "superheroes", true, Map.of("gender", "male")));
        QuestionSelector selector = selector(store);
        GameSession session = new GameSession("two");
        session.nextTurn();

        Selection selection = selector.selectNext(session, selector.filter.filter(List.of()), NO_ORACLE);

        Selection.MakeGuess guess = assertInstanceOf(Selection.MakeGuess.class, selection);
        assertTrue(List.of("Alpha Hero", "Beta Villain").contains(guess.guess().name()));

        session.rejectGuess(guess.guess().name());
        selection = selector.selectNext(session, selector.filter.filter(List.of()), NO_ORACLE);

        Selection.MakeGuess last = assertInstanceOf(Selection.MakeGuess.class, selection);
        assertNotEquals(guess.guess().name(), last.guess().name());
        assertEquals(0.99, last.guess().confidence(), 0.0001);
    }

    @Test
    void oracleNamingACandidate_becomesAGuess() {
        QuestionSelector selector = selector(sixCandidates());
        GameSession session = new GameSession("named");
        session.nextTurn();

        Selection selection = selector.selectNext(session, selector.filter.filter(List.of()),
                () -> new ParsedOracleReply.Valid("Is your character Gamma Girl?", List.of()));

        Selection.MakeGuess guess = assertInstanceOf(Selection.MakeGuess.class, selection);
        assertEquals("Gamma Girl", guess.guess().name());
    }

    @Test
    void oracleNamingAStranger_isDropped() {
        QuestionSelector selector = selector(sixCandidates());
        GameSession session = new GameSession("stranger");
        session.nextTurn();

        Selection selection = selector.selectNext(session, selector.filter.filter(List.of()),
                () -> new ParsedOracleReply.Valid("Is your character Sherlock Holmes?", List.of()));

        Selection.Ask ask = assertInstanceOf(Selection.Ask.class, selection);
        assertEquals("Is your character fictional?", ask.question());
        assertEquals("fallback", ask.source());
    }

    @Test
    void oracleQuestion_isUsedWhenAcceptable() {
        QuestionSelector selector = selector(sixCandidates());
        GameSession session = new GameSession("oracle");
        session.nextTurn();

        Selection selection = selector.selectNext(session, selector.filter.filter(List.of()),
                () -> new ParsedOracleReply.Valid("Does your character wear a cape?",
                        List.of(new Guess("Alpha Hero", 0.4))));

        Selection.Ask ask = assertInstanceOf(Selection.Ask.class, selection);
        assertEquals("Does your character wear a cape?", ask.question());
        assertEquals("oracle", ask.source());
    }

    @Test
    void unusableOracleReplies_useFallbacks() {
        QuestionSelector selector = selector(sixCandidates());
        GameSession session = new GameSession("fallback");
        session.nextTurn();
        FilterResult result = selector.filter.filter(List.of());

        String longQuestion = "Is your character someone who has at one point or another in their long life "
                + "travelled to many different places around the world?";
        Selection tooLong = selector.selectNext(session, result,
                () -> new ParsedOracleReply.Valid(longQuestion, List.of()));
        assertEquals("fallback", assertInstanceOf(Selection.Ask.class, tooLong).source());

        Selection malformed = selector.selectNext(session, result,
                () -> new ParsedOracleReply.Malformed("timeout"));
        assertEquals("Is your character fictional?", assertInstanceOf(Selection.Ask.class, malformed).question());
    }

    @Test
    void exhaustedFallbacks_useEmergencyQuestions() {
        CandidateStore store = Fixtures.store(
                Fixtures.entry("Alpha Hero", "superheroes", true, Map.of()),
                Fixtures.entry("Beta Villain", "superheroes", true, Map.of()),
                Fixtures.entry("Gamma Girl", "anime", true, Map.of()),
                Fixtures.entry("Delta Actor", "actors", false, Map.of()),
                Fixtures.entry("Epsilon Spy", "tv-characters", true, Map.of()),
                Fixtures.entry("Zeta Pilot", "video-games", true, Map.of()),
                Fixtures.entry("Eta Knight", "other", true, Map.of()),
                Fixtures.entry("Theta Queen", "historical", false, Map.of()));
        QuestionSelector selector = selector(store);
        GameSession session = new GameSession("emergency");
        for (String q : Fixtures.RULES.fallbackQuestions()) {
            Fixtures.answered(session, q, AnswerValue.DONT_KNOW);
        }
        session.nextTurn();

        Selection selection = selector.selectNext(session, selector.filter.filter(List.of()),
                () -> ParsedOracleReply.EMPTY);

        Selection.Ask ask = assertInstanceOf(Selection.Ask.class, selection);
        assertEquals("emergency", ask.source());
        assertTrue(Fixtures.RULES.emergencyQuestions().contains(ask.question()));
    }

    @Test
    void guesses_mergeRankedAndOracleGuesses() {
        QuestionSelector selector = selector(sixCandidates());
        GameSession session = new GameSession("merge");
        session.nextTurn();
        session.rejectGuess("Beta Villain");

        List<Guess> guesses = selector.guesses(session,
                List.of(new Guess("Alpha Hero", 0.5), new Guess("Gamma Girl", 0.2)),
                List.of(new Guess("Sherlock Holmes", 1.5), new Guess("Beta Villain", 0.3),
                        new Guess("gamma girl", 0.6), new Guess("42", 0.7)));

        assertEquals("Sherlock Holmes", guesses.get(0).name());
        assertEquals(0.99, guesses.get(0).confidence(), 0.0001);
        assertEquals(0.6, guesses.get(1).confidence(), 0.0001);
        assertTrue(guesses.stream().noneMatch(g -> g.isNamed("Beta Villain")));
        assertTrue(guesses.stream().noneMatch(g -> g.isNamed("42")));
        assertEquals(3, guesses.size());
    }
}
