package dev.ebullient.detective.model;

import java.util.List;
import java.util.Map;

/**
 * One entry of the candidate dataset. Attributes include values derived from the facts at load time.
 */
public record Subject(
        String name,
        Category category,
        boolean fictional,
        List<String> facts,
        Map<String, String> attributes,
        List<String> aliases) {

    public Subject {
        facts = List.copyOf(facts);
        attributes = Map.copyOf(attributes);
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    /** Lower-cased facts joined into one searchable string. */
    public String factText() {
        return String.join(" ", facts).toLowerCase();
    }

    public String summary() {
        StringBuilder sb = new StringBuilder(name)
                .append(" [").append(category.id()).append(fictional ? ", fictional" : ", real").append("]");
        if (!facts.isEmpty()) {
            sb.append(": ").append(facts.get(0));
        }
        return sb.toString();
    }
}
