package dev.ebullient.detective;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import jakarta.inject.Singleton;

import org.jboss.logging.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import dev.ebullient.detective.model.ReferenceTraits;
import dev.ebullient.detective.model.Trait;
import io.quarkus.runtime.Startup;

/**
 * Heuristic rule tables, loaded once from the versioned YAML files under {@code rules/}.
 * Keeping them as data lets them be tested and extended without touching control flow.
 */
@Startup
@Singleton
public class RuleTables {
    private static final Logger log = Logger.getLogger(RuleTables.class);

    public enum Scope {
        ANY,
        FICTIONAL,
        REAL
    }

    /** A catalogue question and the trait a "yes" would confirm. */
    public record CatalogueQuestion(String question, String key, String value, Scope scope) {
    }

    /**
     * A hierarchical topic realm. Terms and sub-categories classify a question,
     * values only refine how specific it is.
     */
    public record TopicRealm(String name, Set<String> terms, Set<String> subcategories, Set<String> values) {

        public boolean classifies(List<String> words) {
            return words.stream().anyMatch(w -> terms.contains(w) || subcategories.contains(w));
        }

        /** 3 for a named value, 2 for a sub-category, 1 for the bare realm, 0 if unrelated. */
        public int specificity(List<String> words) {
            if (!classifies(words)) {
                return 0;
            }
            if (words.stream().anyMatch(values::contains)) {
                return 3;
            }
            if (words.stream().anyMatch(subcategories::contains)) {
                return 2;
            }
            return 1;
        }
    }

    /**
     * What a yes and a no mean for a question about one pole of a key.
     * A null {@code whenNo} means a negative answer records {@code NOT_<whenYes>}.
     */
    public record PolarityRule(String key, List<String> terms, String whenYes, String whenNo) {

        public String valueFor(boolean negative) {
            if (!negative) {
                return whenYes;
            }
            return whenNo != null ? whenNo : Trait.NEGATION_PREFIX + whenYes;
        }

        public boolean isPole(String value) {
            return value.equalsIgnoreCase(whenYes)
                    || value.equalsIgnoreCase(valueFor(true));
        }
    }

    public record UniqueRole(String role, List<String> aliases, String holder) {

        public boolean matches(String value) {
            if (value == null) {
                return false;
            }
            String v = value.trim().toLowerCase().replace('_', ' ');
            return role.replace('_', ' ').equals(v) || aliases.contains(v);
        }
    }

    private final Yaml yaml;

    // topics.yaml
    private Set<String> stopWords = Set.of();
    private final Map<String, String> canonicalWords = new LinkedHashMap<>();
    private final Map<String, Set<String>> keyVocabulary = new LinkedHashMap<>();
    private final List<TopicRealm> realms = new ArrayList<>();
    private final List<Pattern> forbiddenPhrases = new ArrayList<>();
    private final Map<String, Set<String>> vocabularies = new LinkedHashMap<>();
    private final Map<String, String> normalizeReplacements = new LinkedHashMap<>();
    private Set<String> nameQuestionExclusions = Set.of();

    // traits.yaml
    private Set<String> valueBlacklist = Set.of();
    private List<String> placeholderPrefixes = List.of();
    private final Map<String, List<String>> keyKeywords = new LinkedHashMap<>();
    private final List<PolarityRule> polarityRules = new ArrayList<>();
    private Pattern binaryQuestionPrefix = Pattern.compile("^(is|does) your character\\b");
    private int binaryQuestionMaxWords = 9;
    private Set<String> fictionalMedia = Set.of();
    private Set<String> fictionalCategories = Set.of();
    private Set<String> realCategories = Set.of();

    // filter.yaml
    private final Map<String, List<String>> originMediumAliases = new LinkedHashMap<>();
    private final Map<String, List<String>> nationalityGroups = new LinkedHashMap<>();
    private final Map<String, List<String>> ageGroups = new LinkedHashMap<>();
    private final Map<String, List<String>> speciesKeywords = new LinkedHashMap<>();

    // questions.yaml
    private final List<CatalogueQuestion> catalogue = new ArrayList<>();
    private List<String> fallbackQuestions = List.of();
    private List<String> emergencyQuestions = List.of();

    // unique-roles.yaml, reference-traits.yaml
    private final List<UniqueRole> uniqueRoles = new ArrayList<>();
    private final Map<String, ReferenceTraits> referenceTraits = new LinkedHashMap<>();

    public RuleTables() {
        yaml = new Yaml(new LoaderOptions());

        loadTopics();
        loadTraitRules();
        loadFilterRules();
        loadQuestions();
        loadUniqueRoles();
        loadReferenceTraits();

        log.infof("Loaded %d catalogue questions, %d topic realms, %d polarity rules",
                catalogue.size(), realms.size(), polarityRules.size());
    }

    private void loadTopics() {
        Map<String, Object> data = read("rules/topics.yaml");
        stopWords = stringSet(data.get("stop-words"));
        for (Object group : list(data.get("synonym-groups"))) {
            List<String> words = stringList(group);
            if (!words.isEmpty()) {
                for (String w : words) {
                    canonicalWords.put(w, words.get(0));
                }
            }
        }
        map(data.get("key-vocabulary")).forEach((key, words) -> {
            Set<String> canonical = new LinkedHashSet<>();
            stringList(words).forEach(w -> canonical.add(canonical(w)));
            keyVocabulary.put(key, canonical);
        });
        map(data.get("realms")).forEach((name, value) -> {
            Map<String, Object> realm = map(value);
            realms.add(new TopicRealm(name,
                    stringSet(realm.get("terms")),
                    stringSet(realm.get("subcategories")),
                    stringSet(realm.get("values"))));
        });
        for (String phrase : textList(data.get("forbidden-phrases"))) {
            forbiddenPhrases.add(Pattern.compile(phrase, Pattern.CASE_INSENSITIVE));
        }
        for (String name : List.of("fantasy-vocabulary", "death-terms", "alive-terms", "power-terms",
                "nonhuman-terms", "real-world-terms", "obscure-award-terms", "nationality-terms")) {
            vocabularies.put(name, stringSet(data.get(name)));
        }
        map(data.get("normalize")).forEach((from, to) -> normalizeReplacements.put(from, String.valueOf(to)));
        nameQuestionExclusions = stringSet(data.get("name-question-exclusions"));
    }

    private void loadTraitRules() {
        Map<String, Object> data = read("rules/traits.yaml");
        valueBlacklist = stringSet(data.get("value-blacklist"));
        placeholderPrefixes = stringList(data.get("placeholder-prefixes"));
        map(data.get("key-keywords")).forEach((key, words) -> keyKeywords.put(key, stringList(words)));
        for (Object o : list(data.get("polarity"))) {
            Map<String, Object> rule = map(o);
            Object whenNo = rule.get("when-no");
            polarityRules.add(new PolarityRule(
                    String.valueOf(rule.get("key")),
                    stringList(rule.get("terms")),
                    String.valueOf(rule.get("when-yes")),
                    whenNo == null ? null : String.valueOf(whenNo)));
        }
        if (data.get("binary-question-prefix") != null) {
            binaryQuestionPrefix = Pattern.compile(String.valueOf(data.get("binary-question-prefix")),
                    Pattern.CASE_INSENSITIVE);
        }
        if (data.get("binary-question-max-words") instanceof Number n) {
            binaryQuestionMaxWords = n.intValue();
        }
        fictionalMedia = stringSet(data.get("fictional-media"));
        fictionalCategories = stringSet(data.get("fictional-categories"));
        realCategories = stringSet(data.get("real-categories"));
    }

    private void loadFilterRules() {
        Map<String, Object> data = read("rules/filter.yaml");
        map(data.get("origin-medium-aliases")).forEach((k, v) -> originMediumAliases.put(k, stringList(v)));
        map(data.get("nationality-groups")).forEach((k, v) -> nationalityGroups.put(k, stringList(v)));
        map(data.get("age-groups")).forEach((k, v) -> ageGroups.put(k, stringList(v)));
        map(data.get("species-keywords")).forEach((k, v) -> speciesKeywords.put(k, stringList(v)));
        for (String name : List.of("powers-keywords", "villain-keywords", "hero-keywords", "team-keywords",
                "male-words", "female-words")) {
            vocabularies.put(name, stringSet(data.get(name)));
        }
    }

    private void loadQuestions() {
        Map<String, Object> data = read("rules/questions.yaml");
        for (Object o : list(data.get("catalogue"))) {
            Map<String, Object> entry = map(o);
            Object scope = entry.get("scope");
            catalogue.add(new CatalogueQuestion(
                    String.valueOf(entry.get("q")),
                    String.valueOf(entry.get("key")),
                    String.valueOf(entry.get("value")),
                    scope == null ? Scope.ANY : Scope.valueOf(String.valueOf(scope).toUpperCase())));
        }
        fallbackQuestions = textList(data.get("fallback"));
        emergencyQuestions = textList(data.get("emergency"));
        if (emergencyQuestions.isEmpty()) {
            log.warn("rules/questions.yaml has no emergency questions; using the fallback list");
            emergencyQuestions = fallbackQuestions;
        }
    }

    private void loadUniqueRoles() {
        Map<String, Object> data = read("rules/unique-roles.yaml");
        for (Object o : list(data.get("roles"))) {
            Map<String, Object> entry = map(o);
            uniqueRoles.add(new UniqueRole(
                    String.valueOf(entry.get("role")),
                    stringList(entry.get("aliases")),
                    String.valueOf(entry.get("holder"))));
        }
    }

    private void loadReferenceTraits() {
        Map<String, Object> data = read("rules/reference-traits.yaml");
        map(data.get("characters")).forEach((name, value) -> {
            Map<String, String> attributes = new LinkedHashMap<>();
            map(value).forEach((k, v) -> attributes.put(k, String.valueOf(v)));
            referenceTraits.put(StringUtils.normalize(name), new ReferenceTraits(name, attributes, "reference"));
        });
    }

    // --- Accessors ---

    public Set<String> stopWords() {
        return stopWords;
    }

    /** Canonical form of a word through the synonym groups; the word itself if it has none. */
    public String canonical(String word) {
        return canonicalWords.getOrDefault(word, word);
    }

    public Map<String, Set<String>> keyVocabulary() {
        return keyVocabulary;
    }

    public List<TopicRealm> realms() {
        return realms;
    }

    public List<Pattern> forbiddenPhrases() {
        return forbiddenPhrases;
    }

    /**
     * Named word lists: fantasy-vocabulary, death-terms, alive-terms, power-terms, nonhuman-terms,
     * real-world-terms, obscure-award-terms, nationality-terms, powers-keywords, villain-keywords,
     * hero-keywords, team-keywords, male-words, female-words.
     */
    public Set<String> vocabulary(String name) {
        Set<String> words = vocabularies.get(name);
        if (words == null) {
            throw new IllegalArgumentException("Unknown vocabulary: " + name);
        }
        return words;
    }

    public Map<String, String> normalizeReplacements() {
        return normalizeReplacements;
    }

    public Set<String> nameQuestionExclusions() {
        return nameQuestionExclusions;
    }

    public Set<String> valueBlacklist() {
        return valueBlacklist;
    }

    public List<String> placeholderPrefixes() {
        return placeholderPrefixes;
    }

    public List<String> keyKeywords(String key) {
        return keyKeywords.getOrDefault(key, List.of());
    }

    public List<PolarityRule> polarityRules() {
        return polarityRules;
    }

    public Pattern binaryQuestionPrefix() {
        return binaryQuestionPrefix;
    }

    public int binaryQuestionMaxWords() {
        return binaryQuestionMaxWords;
    }

    public Set<String> fictionalMedia() {
        return fictionalMedia;
    }

    public Set<String> fictionalCategories() {
        return fictionalCategories;
    }

    public Set<String> realCategories() {
        return realCategories;
    }

    public Map<String, List<String>> originMediumAliases() {
        return originMediumAliases;
    }

    public Map<String, List<String>> nationalityGroups() {
        return nationalityGroups;
    }

    public Map<String, List<String>> ageGroups() {
        return ageGroups;
    }

    public Map<String, List<String>> speciesKeywords() {
        return speciesKeywords;
    }

    public List<CatalogueQuestion> catalogue() {
        return catalogue;
    }

    public List<String> fallbackQuestions() {
        return fallbackQuestions;
    }

    public List<String> emergencyQuestions() {
        return emergencyQuestions;
    }

    public List<UniqueRole> uniqueRoles() {
        return uniqueRoles;
    }

    public ReferenceTraits referenceTraits(String name) {
        return name == null ? null : referenceTraits.get(StringUtils.normalize(name));
    }

    // --- Private helpers ---

    private Map<String, Object> read(String resource) {
        try (InputStream is = Thread.currentThread().getContextClassLoader()
                .getResourceAsStream(resource)) {
            if (is == null) {
                log.warnf("%s not found on classpath", resource);
                return Map.of();
            }
            Map<String, Object> data = yaml.load(is);
            if (data == null) {
                return Map.of();
            }
            log.debugf("Loaded %s (version %s)", resource, data.get("version"));
            return data;
        } catch (Exception e) {
            log.errorf(e, "Failed to load %s: %s", resource, e.getMessage());
            return Map.of();
        }
    }

    private static Map<String, Object> map(Object value) {
        if (value instanceof Map<?, ?> m) {
            Map<String, Object> result = new LinkedHashMap<>();
            m.forEach((k, v) -> result.put(String.valueOf(k), v));
            return result;
        }
        return Map.of();
    }

    private static List<?> list(Object value) {
        return value instanceof List<?> l ? l : List.of();
    }

    private static List<String> stringList(Object value) {
        if (!(value instanceof Collection<?> c)) {
            return List.of();
        }
        return c.stream()
                .map(String::valueOf)
                .map(StringUtils::normalize)
                .filter(s -> !s.isBlank())
                .toList();
    }

    /** Trimmed but case-preserving, for question text and patterns. */
    private static List<String> textList(Object value) {
        if (!(value instanceof Collection<?> c)) {
            return List.of();
        }
        return c.stream()
                .map(String::valueOf)
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .toList();
    }

    private static Set<String> stringSet(Object value) {
        return new LinkedHashSet<>(stringList(value));
    }
}
