package dev.ebullient.detective;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import dev.ebullient.detective.RuleTables.TopicRealm;
import dev.ebullient.detective.model.Subject;
import dev.ebullient.detective.model.Trait;
import dev.ebullient.detective.model.TraitKey;
import io.quarkus.logging.Log;

/**
 * Decides whether a candidate question adds information, given what was already asked
 * and what is already known.
 */
@Singleton
public class TopicTracker {

    static final int OBSCURE_AWARD_MIN_TURN = 15;
    static final int OBSCURE_AWARD_MAX_CANDIDATES = 10;

    private static final Pattern NAME_QUESTION = Pattern.compile(
            "^is (?:your character|it) (.+?)\\s*\\?*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROPER_NAME = Pattern.compile(
            "^\\p{Lu}[\\p{L}'.-]*(?:\\s+(?:\\p{Lu}[\\p{L}'.-]*|\\d+|of|the|de|da|van|von|le|la|al))*$");
    private static final Pattern PUNCTUATION = Pattern.compile("[^a-z0-9 ]+");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    @Inject
    RuleTables rules;

    @Inject
    CandidateStore store;

    /**
     * Content words of a question: stop words removed, synonyms folded to their canonical form.
     */
    public Set<String> contentWords(String question) {
        Set<String> words = new LinkedHashSet<>();
        for (String w : StringUtils.words(question)) {
            if (!rules.stopWords().contains(w)) {
                words.add(rules.canonical(w));
            }
        }
        return words;
    }

    public boolean isRedundant(String candidate, Collection<String> askedQuestions, Set<String> confirmedKeys) {
        String reason = redundancyReason(candidate, askedQuestions, confirmedKeys);
        if (reason != null) {
            Log.debugf("Redundant question '%s': %s", candidate, reason);
            return true;
        }
        return false;
    }

    /**
     * @return why the candidate repeats known ground, or null if it does not
     */
    public String redundancyReason(String candidate, Collection<String> askedQuestions, Set<String> confirmedKeys) {
        Set<String> words = contentWords(candidate);

        for (String asked : askedQuestions) {
            Set<String> askedWords = contentWords(asked);
            int shared = sharedCount(words, askedWords);
            if (shared >= 2) {
                return "shares " + shared + " words with '" + asked + "'";
            }
            if (shared > 0 && (shared >= 0.8 * words.size() || shared >= 0.8 * askedWords.size())) {
                return "mostly repeats '" + asked + "'";
            }
        }

        for (String key : confirmedKeys) {
            Set<String> vocabulary = rules.keyVocabulary().getOrDefault(key, Set.of());
            for (String w : words) {
                if (vocabulary.contains(w)) {
                    return "'" + w + "' belongs to confirmed key " + key;
                }
            }
        }

        List<String> rawWords = StringUtils.words(candidate);
        for (TopicRealm realm : rules.realms()) {
            int specificity = realm.specificity(rawWords);
            if (specificity == 0) {
                continue;
            }
            int asked = realmSpecificity(realm, askedQuestions);
            if (asked > 0 && specificity <= asked) {
                return "realm " + realm.name() + " already asked at specificity " + asked;
            }
        }

        if (isForbiddenPhrasing(candidate)) {
            return "forbidden phrasing";
        }
        return null;
    }

    /** Highest specificity any asked question reached in the realm; 0 if untouched. */
    public int realmSpecificity(TopicRealm realm, Collection<String> askedQuestions) {
        int max = 0;
        for (String asked : askedQuestions) {
            max = Math.max(max, realm.specificity(StringUtils.words(asked)));
        }
        return max;
    }

    public boolean isForbiddenPhrasing(String question) {
        return rules.forbiddenPhrases().stream().anyMatch(p -> p.matcher(question).find());
    }

    /**
     * Logical consistency against the ledger: questions whose answer is already implied
     * (or impossible) given the confirmed traits.
     */
    public boolean conflictsWithTraits(String question, List<Trait> traits, int turn, int candidateCount) {
        String reason = conflictReason(question, traits, turn, candidateCount);
        if (reason != null) {
            Log.debugf("Conflicting question '%s': %s", question, reason);
            return true;
        }
        return false;
    }

    public String conflictReason(String question, List<Trait> traits, int turn, int candidateCount) {
        String q = question.toLowerCase();

        if (has(traits, TraitKey.FICTIONAL, "false") && matchesVocabulary(q, "fantasy-vocabulary")) {
            return "fantasy question for a real person";
        }
        if (has(traits, TraitKey.FICTIONAL, "true") && matchesVocabulary(q, "real-world-terms")) {
            return "real-world honour for a fictional character";
        }
        if (has(traits, TraitKey.ALIVE, "true") && matchesVocabulary(q, "death-terms")) {
            return "death question for a living subject";
        }
        if (has(traits, TraitKey.ALIVE, "false") && matchesVocabulary(q, "alive-terms")) {
            return "alive question for a dead subject";
        }
        if (has(traits, TraitKey.HAS_POWERS, "false") && matchesVocabulary(q, "power-terms")) {
            return "power question without powers";
        }
        if (has(traits, TraitKey.SPECIES, "human") && matchesVocabulary(q, "nonhuman-terms")) {
            return "non-human anatomy for a human";
        }
        if (turn < OBSCURE_AWARD_MIN_TURN && candidateCount > OBSCURE_AWARD_MAX_CANDIDATES
                && matchesVocabulary(q, "obscure-award-terms")) {
            return "obscure award question too early";
        }
        for (Trait t : traits) {
            if (t.isNegated()) {
                String ruledOut = t.baseValue().toLowerCase().replace('_', ' ');
                if (ruledOut.length() > 2 && StringUtils.containsTerm(q, ruledOut)) {
                    return "asks about ruled-out " + t.key() + " " + ruledOut;
                }
            }
        }
        Trait nationality = find(traits, TraitKey.NATIONALITY);
        if (nationality != null && !nationality.isNegated() && matchesVocabulary(q, "nationality-terms")) {
            return "nationality already known";
        }
        return null;
    }

    /**
     * Canonical form for exact-duplicate detection.
     */
    public String normalize(String question) {
        String q = question.toLowerCase();
        for (Map.Entry<String, String> e : rules.normalizeReplacements().entrySet()) {
            q = q.replace(e.getKey(), e.getValue());
        }
        q = PUNCTUATION.matcher(q).replaceAll(" ");
        return SPACES.matcher(q).replaceAll(" ").trim();
    }

    public boolean isDuplicate(String candidate, Collection<String> askedQuestions) {
        String normalized = normalize(candidate);
        return askedQuestions.stream().anyMatch(q -> normalize(q).equals(normalized));
    }

    public boolean isNameQuestion(String question) {
        return extractName(question) != null;
    }

    /**
     * The character named by "Is your character X?", or null when X describes a trait
     * ("Is your character American?").
     */
    public String extractName(String question) {
        if (question == null) {
            return null;
        }
        Matcher m = NAME_QUESTION.matcher(question.trim());
        if (!m.matches()) {
            return null;
        }
        String subject = m.group(1).trim();
        String lower = subject.toLowerCase();
        for (String exclusion : rules.nameQuestionExclusions()) {
            if (StringUtils.containsTerm(lower, exclusion)) {
                return null;
            }
        }
        if (isNationality(lower)) {
            return null;
        }
        Subject known = store.byName(subject);
        if (known != null) {
            return known.name();
        }
        if (StringUtils.wordCount(subject) <= 6 && PROPER_NAME.matcher(subject).matches()) {
            return subject;
        }
        return null;
    }

    // --- Private helpers ---

    private static int sharedCount(Set<String> a, Set<String> b) {
        int shared = 0;
        for (String w : a) {
            if (b.contains(w)) {
                shared++;
            }
        }
        return shared;
    }

    private boolean isNationality(String text) {
        if (matchesVocabulary(text, "nationality-terms")) {
            return true;
        }
        return rules.nationalityGroups().values().stream()
                .anyMatch(terms -> StringUtils.containsAnyTerm(text, terms));
    }

    private boolean matchesVocabulary(String question, String vocabulary) {
        return StringUtils.containsAnyTerm(question, rules.vocabulary(vocabulary));
    }

    private static boolean has(List<Trait> traits, TraitKey key, String value) {
        return traits.stream().anyMatch(t -> t.is(key.key(), value));
    }

    private static Trait find(List<Trait> traits, TraitKey key) {
        return traits.stream().filter(t -> t.key().equals(key.key())).findFirst().orElse(null);
    }
}
