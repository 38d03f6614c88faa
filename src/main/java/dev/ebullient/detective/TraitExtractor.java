package dev.ebullient.detective;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import dev.ebullient.detective.RuleTables.PolarityRule;
import dev.ebullient.detective.chat.OracleService;
import dev.ebullient.detective.chat.TraitProposal;
import dev.ebullient.detective.model.AnswerValue;
import dev.ebullient.detective.model.Trait;
import dev.ebullient.detective.model.TraitKey;
import io.quarkus.logging.Log;

/**
 * Turns an answered question into at most one trait. The oracle proposes; rule tables
 * decide what is kept.
 */
@Singleton
public class TraitExtractor {

    static final double DEFAULT_CONFIDENCE = 0.7;
    static final double MIN_CONFIDENCE = 0.1;
    static final double MAX_CONFIDENCE = 0.99;
    static final double HEDGED_MAX_CONFIDENCE = 0.8;
    static final double RULE_CONFIDENCE = 0.75;
    static final double DEDUCED_CONFIDENCE = 0.95;

    @Inject
    RuleTables rules;

    @Inject
    OracleService oracle;

    /**
     * @return the trait the answer confirms, or null
     */
    public Trait extract(GameSession session, String question, AnswerValue answer) {
        if (answer == AnswerValue.DONT_KNOW || question == null) {
            return null;
        }
        int turn = session.turn();
        List<Trait> ledger = session.traits();

        TraitProposal proposal = oracle.proposeTrait(session, question, answer);
        Trait trait = proposal == null ? null : fromProposal(proposal, question, answer, turn, ledger);
        if (trait != null) {
            return trait;
        }

        trait = secondaryPass(question, answer, turn, ledger);
        if (trait != null) {
            Log.debugf("%s: rule-based trait %s=%s from '%s'", session.id(), trait.key(), trait.value(), question);
        }
        return trait;
    }

    /**
     * Validate and correct an oracle proposal.
     *
     * @return the accepted trait, or null if the proposal was rejected
     */
    public Trait fromProposal(TraitProposal proposal, String question, AnswerValue answer, int turn, List<Trait> ledger) {
        if (answer == AnswerValue.DONT_KNOW || proposal == null || proposal.isEmpty()) {
            return null;
        }
        TraitKey traitKey = TraitKey.fromKey(proposal.key());
        if (traitKey == null) {
            Log.debugf("Rejected unknown key %s", proposal.key());
            return null;
        }
        String key = traitKey.key();
        String raw = proposal.value().trim();
        if (isPlaceholder(raw)) {
            Log.debugf("Rejected placeholder value %s=%s", key, raw);
            return null;
        }
        if (!StringUtils.containsAnyTerm(question, rules.keyKeywords(key))) {
            Log.debugf("Rejected %s=%s: question '%s' is not about %s", key, raw, question, key);
            return null;
        }

        String value = normalizeValue(traitKey, raw);
        if (value == null) {
            Log.debugf("Rejected non-boolean value %s=%s", key, raw);
            return null;
        }
        value = applyPolarity(traitKey, value, question, answer);

        if (!isConsistent(key, value, ledger)) {
            return null;
        }

        double confidence = proposal.confidence() == null ? DEFAULT_CONFIDENCE : proposal.confidence();
        return new Trait(key, value, confidence(confidence, answer), turn);
    }

    /**
     * Correct the value for the polarity of the answer. The first rule whose key matches and
     * whose terms appear in the question decides; open-valued keys without a rule are
     * negated with {@code NOT_} on a negative answer.
     */
    public String applyPolarity(TraitKey key, String value, String question, AnswerValue answer) {
        boolean negative = answer.isNegative();
        for (PolarityRule rule : rules.polarityRules()) {
            if (!rule.key().equals(key.key()) || !StringUtils.containsAnyTerm(question, rule.terms())) {
                continue;
            }
            String expected = rule.valueFor(negative);
            if (rule.isPole(value) && !value.equalsIgnoreCase(expected)) {
                Log.debugf("Polarity corrected %s=%s to %s for '%s' / %s",
                        key.key(), value, expected, question, answer.value());
                return expected;
            }
            return value;
        }
        if (key.isBoolean()) {
            return value;
        }
        boolean negated = value.startsWith(Trait.NEGATION_PREFIX);
        if (negative && !negated) {
            return Trait.NEGATION_PREFIX + value;
        }
        if (!negative && negated) {
            return value.substring(Trait.NEGATION_PREFIX.length());
        }
        return value;
    }

    /**
     * Rule-based inference for strictly binary questions, used when the oracle
     * produced nothing usable.
     */
    public Trait secondaryPass(String question, AnswerValue answer, int turn, List<Trait> ledger) {
        if (answer == AnswerValue.DONT_KNOW || !isStrictlyBinary(question)) {
            return null;
        }
        for (PolarityRule rule : rules.polarityRules()) {
            if (!StringUtils.containsAnyTerm(question, rule.terms())) {
                continue;
            }
            String value = rule.valueFor(answer.isNegative());
            if (isConsistent(rule.key(), value, ledger)) {
                return new Trait(rule.key(), value, confidence(RULE_CONFIDENCE, answer), turn);
            }
            return null;
        }
        return null;
    }

    public boolean isStrictlyBinary(String question) {
        if (question == null) {
            return false;
        }
        String q = question.trim();
        return rules.binaryQuestionPrefix().matcher(q).find()
                && StringUtils.wordCount(q) <= rules.binaryQuestionMaxWords()
                && !StringUtils.containsTerm(q, "or");
    }

    /**
     * Traits implied by the ledger that it does not hold yet. At most one trait per key:
     * a deduction only fills an empty key, or rules out a fictional medium for a real person.
     */
    public List<Trait> deduce(List<Trait> ledger, int turn) {
        Map<String, Trait> byKey = new LinkedHashMap<>();
        ledger.forEach(t -> byKey.put(t.key(), t));

        List<Trait> added = new ArrayList<>();
        for (int pass = 0; pass < TraitKey.values().length; pass++) {
            List<Trait> implied = implied(byKey, turn);
            if (implied.isEmpty()) {
                break;
            }
            for (Trait t : implied) {
                byKey.put(t.key(), t);
                added.add(t);
            }
        }
        return added;
    }

    // --- Private helpers ---

    private List<Trait> implied(Map<String, Trait> byKey, int turn) {
        List<Trait> implied = new ArrayList<>();
        Trait fictional = byKey.get(TraitKey.FICTIONAL.key());
        Trait medium = byKey.get(TraitKey.ORIGIN_MEDIUM.key());
        Trait category = byKey.get(TraitKey.CATEGORY.key());

        if (fictional != null && fictional.value().equals("false")) {
            if (!byKey.containsKey(TraitKey.HAS_POWERS.key())) {
                implied.add(deduced(TraitKey.HAS_POWERS, "false", turn));
            }
            if (!byKey.containsKey(TraitKey.SPECIES.key())) {
                implied.add(deduced(TraitKey.SPECIES, "human", turn));
            }
            if (medium != null && !medium.isNegated() && rules.fictionalMedia().contains(medium.value())) {
                implied.add(deduced(TraitKey.ORIGIN_MEDIUM, Trait.NEGATION_PREFIX + medium.value(), turn));
            }
        } else if (fictional == null) {
            if (medium != null && !medium.isNegated() && rules.fictionalMedia().contains(medium.value())) {
                implied.add(deduced(TraitKey.FICTIONAL, "true", turn));
            } else if (category != null && !category.isNegated()) {
                if (rules.fictionalCategories().contains(category.value())) {
                    implied.add(deduced(TraitKey.FICTIONAL, "true", turn));
                } else if (rules.realCategories().contains(category.value())) {
                    implied.add(deduced(TraitKey.FICTIONAL, "false", turn));
                }
            }
        }
        return implied;
    }

    private static Trait deduced(TraitKey key, String value, int turn) {
        return new Trait(key.key(), value, DEDUCED_CONFIDENCE, turn);
    }

    /**
     * Reject a value that contradicts a live trait of the same key, or a fantasy value
     * for a real person.
     */
    boolean isConsistent(String key, String value, List<Trait> ledger) {
        for (Trait t : ledger) {
            if (!t.key().equals(key) || t.value().equalsIgnoreCase(value)) {
                continue;
            }
            boolean newNegated = value.startsWith(Trait.NEGATION_PREFIX);
            String newBase = newNegated ? value.substring(Trait.NEGATION_PREFIX.length()) : value;
            boolean contradicts = t.isNegated()
                    ? !newNegated && t.baseValue().equalsIgnoreCase(newBase)
                    : true;
            if (contradicts) {
                Log.debugf("Rejected %s=%s: contradicts %s=%s", key, value, t.key(), t.value());
                return false;
            }
        }
        boolean real = ledger.stream().anyMatch(t -> t.is(TraitKey.FICTIONAL.key(), "false"));
        if (real) {
            if (key.equals(TraitKey.HAS_POWERS.key()) && value.equals("true")) {
                Log.debugf("Rejected has_powers=true for a real person");
                return false;
            }
            String spoken = value.toLowerCase().replace('_', ' ');
            if (StringUtils.containsAnyTerm(spoken, rules.vocabulary("fantasy-vocabulary"))) {
                Log.debugf("Rejected fantasy value %s=%s for a real person", key, value);
                return false;
            }
        }
        return true;
    }

    /** Lower-case not_/non_ values and blacklisted words are placeholders, NOT_x is a negation. */
    boolean isPlaceholder(String raw) {
        if (raw.isEmpty()) {
            return true;
        }
        for (String prefix : rules.placeholderPrefixes()) {
            if (raw.startsWith(prefix)) {
                return true;
            }
        }
        String base = raw.startsWith(Trait.NEGATION_PREFIX) ? raw.substring(Trait.NEGATION_PREFIX.length()) : raw;
        return rules.valueBlacklist().contains(base.toLowerCase());
    }

    /**
     * Lower-case snake form, keeping an upper-case {@code NOT_} prefix.
     *
     * @return the value, or null for a boolean key whose value is not a boolean
     */
    static String normalizeValue(TraitKey key, String raw) {
        boolean negated = raw.startsWith(Trait.NEGATION_PREFIX);
        String base = (negated ? raw.substring(Trait.NEGATION_PREFIX.length()) : raw)
                .trim().toLowerCase().replaceAll("[\\s-]+", "_");
        if (key == TraitKey.CATEGORY) {
            base = base.replace('_', '-');
        }
        if (key.isBoolean()) {
            Boolean b = KnowledgeFilter.parseBoolean(base);
            if (b == null) {
                return null;
            }
            return String.valueOf(negated != b);
        }
        return negated ? Trait.NEGATION_PREFIX + base : base;
    }

    static double confidence(double proposed, AnswerValue answer) {
        double c = Double.isNaN(proposed) ? DEFAULT_CONFIDENCE : StringUtils.clamp(proposed, MIN_CONFIDENCE, MAX_CONFIDENCE);
        return answer.isHedged() ? Math.min(c, HEDGED_MAX_CONFIDENCE) : c;
    }
}
