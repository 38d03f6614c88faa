package dev.ebullient.detective;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.detective.model.Category;
import dev.ebullient.detective.model.Subject;
import dev.ebullient.detective.model.TraitKey;
import io.quarkus.runtime.Startup;

/**
 * The static table of known subjects. Loaded once; read-only afterwards.
 */
@Startup
@Singleton
public class CandidateStore {
    private static final Logger log = Logger.getLogger(CandidateStore.class);

    static final String DATASET = "data/characters.json";

    private static final Pattern LIFESPAN = Pattern.compile("\\d{4}\\s*[–-]\\s*\\d{4}");
    private static final Pattern NUMERIC = Pattern.compile("^[0-9\\s.,-]+$");

    /** Dataset entry as it appears in the JSON file. */
    public record Entry(
            String name,
            String category,
            Boolean fictional,
            List<String> facts,
            Map<String, String> attributes,
            List<String> aliases) {
    }

    record Dataset(String version, List<Entry> characters) {
    }

    private final RuleTables rules;
    private final List<Subject> subjects = new ArrayList<>();
    private final Map<String, Subject> byName = new LinkedHashMap<>();

    @Inject
    public CandidateStore(RuleTables rules) {
        this.rules = rules;
        ObjectMapper jsonMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        try (InputStream is = Thread.currentThread().getContextClassLoader()
                .getResourceAsStream(DATASET)) {
            if (is == null) {
                log.warnf("%s not found on classpath", DATASET);
            } else {
                Dataset dataset = jsonMapper.readValue(is, Dataset.class);
                addAll(dataset.characters());
                log.infof("Loaded %d subjects from %s (version %s)", subjects.size(), DATASET, dataset.version());
            }
        } catch (Exception e) {
            log.errorf(e, "Failed to load %s: %s", DATASET, e.getMessage());
        }
    }

    /** Build a store from explicit entries instead of the bundled dataset. */
    public CandidateStore(RuleTables rules, List<Entry> entries) {
        this.rules = rules;
        addAll(entries);
    }

    public List<Subject> all() {
        return Collections.unmodifiableList(subjects);
    }

    public int size() {
        return subjects.size();
    }

    /**
     * Find a subject by name or alias, ignoring case.
     *
     * @return the subject or null
     */
    public Subject byName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return byName.get(StringUtils.normalize(name));
    }

    public boolean contains(String name) {
        return byName(name) != null;
    }

    /**
     * Reject names that cannot be a character: disambiguation pages, lists,
     * bare numbers and very short strings.
     */
    public static boolean isValidName(String name) {
        if (name == null) {
            return false;
        }
        String n = StringUtils.normalize(name);
        return n.length() > 2
                && !n.contains("disambiguation")
                && !n.startsWith("list of")
                && !NUMERIC.matcher(n).matches();
    }

    // --- Private helpers ---

    private void addAll(List<Entry> entries) {
        if (entries == null) {
            return;
        }
        for (Entry entry : entries) {
            if (!isValidName(entry.name())) {
                log.debugf("Skipping invalid subject name: %s", entry.name());
                continue;
            }
            Subject subject = toSubject(entry);
            subjects.add(subject);
            byName.putIfAbsent(StringUtils.normalize(subject.name()), subject);
            for (String alias : subject.aliases()) {
                byName.putIfAbsent(StringUtils.normalize(alias), subject);
            }
        }
    }

    /**
     * Fill in attributes the dataset leaves out, derived from the category and the facts.
     */
    Subject toSubject(Entry entry) {
        Category category = Category.fromId(entry.category());
        boolean fictional = entry.fictional() == null ? category.fictionalByDefault() : entry.fictional();
        List<String> facts = entry.facts() == null ? List.of() : entry.facts();
        String text = String.join(" ", facts).toLowerCase();

        Map<String, String> attributes = new LinkedHashMap<>();
        if (entry.attributes() != null) {
            entry.attributes().forEach((k, v) -> {
                if (k != null && v != null) {
                    attributes.put(k.trim().toLowerCase(), v.trim().toLowerCase());
                }
            });
        }
        attributes.put(TraitKey.FICTIONAL.key(), String.valueOf(fictional));
        attributes.put(TraitKey.CATEGORY.key(), category.id());
        if (category.poweredByDefault()) {
            attributes.putIfAbsent(TraitKey.HAS_POWERS.key(), "true");
        }

        inferAttributes(text, fictional).forEach(attributes::putIfAbsent);
        attributes.computeIfAbsent(TraitKey.ORIGIN_MEDIUM.key(), k -> defaultMedium(category));

        return new Subject(entry.name().trim(), category, fictional, facts, attributes, entry.aliases());
    }

    /**
     * Attributes that can be read from free text about a subject: gender, species, powers,
     * alignment, team membership and, for real people, whether they are alive.
     */
    public Map<String, String> inferAttributes(String text, boolean fictional) {
        String lower = text == null ? "" : text.toLowerCase();
        Map<String, String> attributes = new LinkedHashMap<>();
        putIfKnown(attributes, TraitKey.GENDER, inferGender(lower));
        putIfKnown(attributes, TraitKey.SPECIES, inferSpecies(fictional, lower));
        putIfKnown(attributes, TraitKey.HAS_POWERS,
                String.valueOf(fictional && countTerms(lower, rules.vocabulary("powers-keywords")) > 0));
        putIfKnown(attributes, TraitKey.ALIGNMENT, inferAlignment(lower));
        if (countTerms(lower, rules.vocabulary("team-keywords")) > 0) {
            attributes.put(TraitKey.HAS_TEAM.key(), "true");
        }
        if (!fictional) {
            attributes.put(TraitKey.ALIVE.key(), String.valueOf(!LIFESPAN.matcher(lower).find()));
        }
        return attributes;
    }

    String inferGender(String text) {
        int male = countTerms(text, rules.vocabulary("male-words"));
        int female = countTerms(text, rules.vocabulary("female-words"));
        if (male > female) {
            return "male";
        }
        if (female > male) {
            return "female";
        }
        return null;
    }

    private String inferSpecies(boolean fictional, String text) {
        if (!fictional) {
            return "human";
        }
        for (Map.Entry<String, List<String>> e : rules.speciesKeywords().entrySet()) {
            if (StringUtils.containsAnyTerm(text, e.getValue())) {
                return e.getKey();
            }
        }
        return "human";
    }

    private String inferAlignment(String text) {
        if (countTerms(text, rules.vocabulary("villain-keywords")) > 0) {
            return "villain";
        }
        if (countTerms(text, rules.vocabulary("hero-keywords")) > 0) {
            return "hero";
        }
        return null;
    }

    private static String defaultMedium(Category category) {
        return switch (category) {
            case ANIME -> "anime";
            case SUPERHEROES -> "comic_book";
            case VIDEO_GAMES -> "video_game";
            case TV_CHARACTERS -> "live_action_tv";
            default -> null;
        };
    }

    private static void putIfKnown(Map<String, String> attributes, TraitKey key, String value) {
        if (value != null) {
            attributes.put(key.key(), value);
        }
    }

    private static int countTerms(String text, Set<String> terms) {
        int count = 0;
        for (String word : StringUtils.words(text)) {
            if (terms.contains(word)) {
                count++;
            }
        }
        // multi-word terms
        for (String term : terms) {
            if (term.indexOf(' ') > 0 && StringUtils.containsTerm(text, term)) {
                count++;
            }
        }
        return count;
    }
}
