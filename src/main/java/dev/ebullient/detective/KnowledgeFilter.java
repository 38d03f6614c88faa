package dev.ebullient.detective;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import dev.ebullient.detective.model.Guess;
import dev.ebullient.detective.model.Subject;
import dev.ebullient.detective.model.Trait;
import dev.ebullient.detective.model.TraitKey;
import io.quarkus.logging.Log;

/**
 * Projects the candidate store through the trait ledger. Nothing is cached between calls:
 * every call filters the full store again.
 */
@Singleton
public class KnowledgeFilter {

    public record FilterResult(List<Subject> candidates, boolean relaxed, Trait dropped) {

        public boolean isEmpty() {
            return candidates.isEmpty();
        }

        public int size() {
            return candidates.size();
        }
    }

    @Inject
    CandidateStore store;

    @Inject
    RuleTables rules;

    /**
     * Conjunctive filter: a subject survives only if it satisfies every trait.
     * An empty result with traits present is retried without the most recently added trait.
     */
    public FilterResult filter(List<Trait> traits) {
        List<Subject> exact = filter(store.all(), traits);
        if (!exact.isEmpty() || traits.isEmpty()) {
            return new FilterResult(exact, false, null);
        }

        Trait newest = mostRecent(traits);
        List<Trait> relaxedTraits = new ArrayList<>(traits);
        relaxedTraits.remove(newest);
        List<Subject> relaxed = filter(store.all(), relaxedTraits);
        Log.debugf("Exact filter empty; dropping %s=%s leaves %d candidates",
                newest.key(), newest.value(), relaxed.size());
        return new FilterResult(relaxed, true, newest);
    }

    public List<Subject> filter(Collection<Subject> pool, List<Trait> traits) {
        return pool.stream()
                .filter(s -> traits.stream().allMatch(t -> matches(s, t)))
                .toList();
    }

    /**
     * Key-specific predicate. NOT_x values match subjects that do not satisfy x.
     */
    public boolean matches(Subject subject, Trait trait) {
        String value = trait.baseValue().trim().toLowerCase();
        boolean positive = matchesValue(subject, trait.key(), value);
        return trait.isNegated() ? !positive : positive;
    }

    /** Share of the traits a subject satisfies; 1.0 when there are no traits. */
    public double scoreMatch(Subject subject, List<Trait> traits) {
        if (traits.isEmpty()) {
            return 1.0;
        }
        long matched = traits.stream().filter(t -> matches(subject, t)).count();
        return (double) matched / traits.size();
    }

    /**
     * Rank surviving candidates as guesses. Confidence grows with the number of traits
     * and shrinks with the size of the pool; results of a relaxed filter are halved.
     */
    public List<Guess> rankGuesses(List<Subject> candidates, List<Trait> traits, boolean relaxed, int limit) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        int n = candidates.size();
        double base = traits.size() >= 8 ? 0.55
                : traits.size() >= 6 ? 0.45
                        : traits.size() >= 4 ? 0.35
                                : 0.25;
        boolean positiveCategory = traits.stream()
                .anyMatch(t -> t.key().equals(TraitKey.CATEGORY.key()) && !t.isNegated());
        double specificityBonus = positiveCategory ? 0.1 : 0;
        double poolBonus = n <= 5 ? 0.1 : n <= 10 ? 0.05 : 0;

        List<Guess> guesses = new ArrayList<>();
        for (Subject s : candidates) {
            double confidence;
            if (n == 1) {
                confidence = 0.99;
            } else {
                double tiebreaker = Math.floorMod(s.name().hashCode(), 100) / 10_000.0;
                confidence = Math.min(0.90,
                        base + scoreMatch(s, traits) * 0.3 + specificityBonus + poolBonus + tiebreaker);
            }
            if (relaxed) {
                confidence /= 2;
            }
            guesses.add(new Guess(s.name(), confidence));
        }
        return guesses.stream()
                .sorted(Comparator.comparingDouble(Guess::confidence).reversed())
                .limit(limit)
                .toList();
    }

    /**
     * Short description of the top candidates, for oracle prompts.
     */
    public String candidateContext(List<Subject> candidates, int limit) {
        if (candidates.isEmpty()) {
            return "No known character matches every confirmed trait.";
        }
        StringBuilder sb = new StringBuilder()
                .append(candidates.size()).append(" known characters still match:");
        candidates.stream().limit(limit)
                .forEach(s -> sb.append("\n- ").append(s.summary()));
        if (candidates.size() > limit) {
            sb.append("\n- ... and ").append(candidates.size() - limit).append(" more");
        }
        return sb.toString();
    }

    // --- Private helpers ---

    static Trait mostRecent(List<Trait> traits) {
        Trait newest = traits.get(0);
        for (Trait t : traits) {
            // later entries win ties: the ledger is kept in recency order
            if (t.turnAdded() >= newest.turnAdded()) {
                newest = t;
            }
        }
        return newest;
    }

    private boolean matchesValue(Subject s, String key, String value) {
        TraitKey traitKey = TraitKey.fromKey(key);
        if (traitKey == null) {
            return containsText(s, value);
        }
        String attr = s.attribute(traitKey.key());
        return switch (traitKey) {
            case FICTIONAL -> {
                Boolean b = parseBoolean(value);
                yield b == null || b == s.fictional();
            }
            case CATEGORY -> {
                String v = value.replace('_', '-');
                String id = s.category().id();
                yield id.contains(v) || v.contains(id);
            }
            case GENDER -> value.equals(attr);
            case HAS_POWERS, HAS_TEAM, IN_OFFICE -> {
                Boolean b = parseBoolean(value);
                yield b == null || b == Boolean.parseBoolean(attr);
            }
            case ALIVE -> {
                Boolean b = parseBoolean(value);
                yield b == null || b == isAlive(s, attr);
            }
            case ORIGIN_MEDIUM -> matchesMedium(s, value, attr);
            case ALIGNMENT -> alignment(value).equals(attr);
            case NATIONALITY -> attr != null && group(rules.nationalityGroups(), value)
                    .equals(group(rules.nationalityGroups(), attr));
            case AGE_GROUP -> attr != null && (attr.equals(value)
                    || rules.ageGroups().getOrDefault(value, List.of()).contains(attr));
            case HAIR_COLOR -> attr != null
                    ? hairColor(attr).equals(hairColor(value))
                    : StringUtils.containsTerm(s.factText(), value + " hair");
            case ROLE -> attr != null
                    ? attr.equals(value) || rules.uniqueRoles().stream()
                            .anyMatch(r -> r.role().equals(attr) && r.matches(value))
                    : containsText(s, value.replace('_', ' '));
            case SPECIES -> value.equals(attr);
            case PUBLISHER -> attr != null ? attr.contains(value) : containsText(s, value);
        };
    }

    private boolean matchesMedium(Subject s, String value, String attr) {
        Set<String> media = media(value);
        if (media.isEmpty()) {
            return containsText(s, value.replace('_', ' '));
        }
        return attr != null && media.contains(attr);
    }

    /** Canonical media a trait value names: "anime" covers anime and manga. */
    Set<String> media(String value) {
        String v = value.replace('-', '_');
        String spaced = v.replace('_', ' ');
        Set<String> media = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> e : rules.originMediumAliases().entrySet()) {
            if (e.getKey().equals(v) || e.getValue().contains(v) || e.getValue().contains(spaced)) {
                media.add(e.getKey());
            }
        }
        return media;
    }

    private boolean isAlive(Subject s, String attr) {
        if (attr != null) {
            return Boolean.parseBoolean(attr);
        }
        return !StringUtils.containsAnyTerm(s.factText(), rules.vocabulary("death-terms"));
    }

    private static String alignment(String value) {
        return switch (value) {
            case "good", "good_guy", "protagonist", "heroic" -> "hero";
            case "evil", "bad", "bad_guy", "antagonist" -> "villain";
            default -> value;
        };
    }

    private static String hairColor(String value) {
        return value.equals("gray") ? "grey" : value;
    }

    private static String group(Map<String, List<String>> groups, String value) {
        for (Map.Entry<String, List<String>> e : groups.entrySet()) {
            if (e.getKey().equals(value) || e.getValue().contains(value)) {
                return e.getKey();
            }
        }
        return value;
    }

    private static boolean containsText(Subject s, String value) {
        if (s.factText().contains(value)) {
            return true;
        }
        return s.attributes().values().stream().anyMatch(v -> v.contains(value));
    }

    static Boolean parseBoolean(String value) {
        return switch (value) {
            case "true", "yes", "fictional" -> Boolean.TRUE;
            case "false", "no", "real" -> Boolean.FALSE;
            default -> null;
        };
    }
}
