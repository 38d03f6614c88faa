package dev.ebullient.detective;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import dev.ebullient.detective.chat.OracleService;
import dev.ebullient.detective.lookup.EncyclopediaLookup;
import dev.ebullient.detective.model.AnswerValue;

/**
 * Wires beans by hand, the way CDI would, for plain unit tests.
 */
final class Fixtures {

    static final RuleTables RULES = new RuleTables();

    private static CandidateStore bundled;

    private Fixtures() {
    }

    static synchronized CandidateStore bundledStore() {
        if (bundled == null) {
            bundled = new CandidateStore(RULES);
        }
        return bundled;
    }

    static CandidateStore store(CandidateStore.Entry... entries) {
        return new CandidateStore(RULES, Arrays.asList(entries));
    }

    static CandidateStore store(List<CandidateStore.Entry> entries) {
        return new CandidateStore(RULES, entries);
    }

    static CandidateStore.Entry entry(String name, String category, boolean fictional,
            Map<String, String> attributes, String... facts) {
        return new CandidateStore.Entry(name, category, fictional, List.of(facts), attributes, List.of());
    }

    static KnowledgeFilter filter(CandidateStore store) {
        KnowledgeFilter filter = new KnowledgeFilter();
        filter.store = store;
        filter.rules = RULES;
        return filter;
    }

    static TopicTracker topics(CandidateStore store) {
        TopicTracker topics = new TopicTracker();
        topics.rules = RULES;
        topics.store = store;
        return topics;
    }

    /**
     * @param lookup encyclopedia stand-in, or null to disable remote lookups
     */
    static GuessValidator validator(CandidateStore store, EncyclopediaLookup lookup) {
        GuessValidator validator = new GuessValidator();
        validator.rules = RULES;
        validator.store = store;
        validator.encyclopedia = lookup;
        validator.lookupEnabled = lookup != null;
        validator.threads = 2;
        validator.init();
        return validator;
    }

    static QuestionSelector selector(CandidateStore store, GuessValidator validator) {
        QuestionSelector selector = new QuestionSelector();
        selector.rules = RULES;
        selector.filter = filter(store);
        selector.topics = topics(store);
        selector.validator = validator;
        selector.confidenceThreshold = 0.95;
        selector.entropyMinCandidates = 10;
        selector.maxQuestionWords = 20;
        selector.maxGuesses = 5;
        return selector;
    }

    static TraitExtractor extractor(OracleService oracle) {
        TraitExtractor extractor = new TraitExtractor();
        extractor.rules = RULES;
        extractor.oracle = oracle;
        return extractor;
    }

    /** Record a question and its answer as one finished turn. */
    static void answered(GameSession session, String question, AnswerValue answer) {
        session.nextTurn();
        session.setCurrentQuestion(question);
        session.recordAnswer(answer);
    }
}
