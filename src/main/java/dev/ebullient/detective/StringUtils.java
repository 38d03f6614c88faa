package dev.ebullient.detective;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

public class StringUtils {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Map<String, Pattern> TERM_PATTERNS = new ConcurrentHashMap<>();

    public static String normalize(String value) {
        return value.trim().toLowerCase();
    }

    /**
     * Lower-cased alphanumeric words of a question, in order.
     */
    public static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        if (text == null) {
            return words;
        }
        for (String w : NON_ALPHANUMERIC.split(text.toLowerCase())) {
            if (!w.isBlank()) {
                words.add(w);
            }
        }
        return words;
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    /**
     * True if the term (a word or phrase) occurs in the text on word boundaries,
     * ignoring case. "male" does not match "female".
     */
    public static boolean containsTerm(String text, String term) {
        if (text == null || term == null || term.isBlank()) {
            return false;
        }
        Pattern p = TERM_PATTERNS.computeIfAbsent(term.toLowerCase(),
                t -> Pattern.compile("(?<![a-z0-9])" + Pattern.quote(t) + "(?![a-z0-9])"));
        return p.matcher(text.toLowerCase()).find();
    }

    public static boolean containsAnyTerm(String text, Collection<String> terms) {
        return firstTerm(text, terms) != null;
    }

    /** @return the first term found in the text, or null */
    public static String firstTerm(String text, Collection<String> terms) {
        if (text == null || terms == null) {
            return null;
        }
        for (String term : terms) {
            if (containsTerm(text, term)) {
                return term;
            }
        }
        return null;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
