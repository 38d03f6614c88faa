package dev.ebullient.detective.model;

import java.util.Map;

/**
 * Known attributes of a named character, used to screen guesses.
 */
public record ReferenceTraits(
        String name,
        Map<String, String> attributes,
        String source) {

    /** Cached marker for "looked up, nothing found". */
    public static final ReferenceTraits UNKNOWN = new ReferenceTraits("", Map.of(), "none");

    public ReferenceTraits {
        attributes = Map.copyOf(attributes);
    }

    public boolean isUnknown() {
        return attributes.isEmpty();
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
