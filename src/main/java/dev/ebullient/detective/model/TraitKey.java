package dev.ebullient.detective.model;

/**
 * Closed vocabulary of trait keys the engine will accept.
 */
public enum TraitKey {
    FICTIONAL("fictional", true),
    GENDER("gender", false),
    SPECIES("species", false),
    CATEGORY("category", false),
    ORIGIN_MEDIUM("origin_medium", false),
    PUBLISHER("publisher", false),
    HAS_POWERS("has_powers", true),
    ALIGNMENT("alignment", false),
    AGE_GROUP("age_group", false),
    NATIONALITY("nationality", false),
    ALIVE("alive", true),
    HAIR_COLOR("hair_color", false),
    HAS_TEAM("has_team", true),
    ROLE("role", false),
    IN_OFFICE("in_office", true);

    private final String key;
    private final boolean bool;

    TraitKey(String key, boolean bool) {
        this.key = key;
        this.bool = bool;
    }

    public String key() {
        return key;
    }

    /** Values are "true" or "false". */
    public boolean isBoolean() {
        return bool;
    }

    /**
     * @return the matching key, or null if the name is not part of the vocabulary
     */
    public static TraitKey fromKey(String key) {
        if (key == null) {
            return null;
        }
        String normalized = key.trim().toLowerCase();
        // older prompts used media_origin
        if (normalized.equals("media_origin")) {
            return ORIGIN_MEDIUM;
        }
        for (TraitKey k : values()) {
            if (k.key.equals(normalized)) {
                return k;
            }
        }
        return null;
    }
}
