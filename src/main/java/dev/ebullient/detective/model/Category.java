package dev.ebullient.detective.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Category {
    ACTORS("actors", false, false),
    ATHLETES("athletes", false, false),
    MUSICIANS("musicians", false, false),
    POLITICIANS("politicians", false, false),
    HISTORICAL("historical", false, false),
    ANIME("anime", true, true),
    SUPERHEROES("superheroes", true, true),
    TV_CHARACTERS("tv-characters", true, false),
    VIDEO_GAMES("video-games", true, false),
    OTHER("other", false, false);

    private final String id;
    private final boolean fictionalByDefault;
    private final boolean poweredByDefault;

    Category(String id, boolean fictionalByDefault, boolean poweredByDefault) {
        this.id = id;
        this.fictionalByDefault = fictionalByDefault;
        this.poweredByDefault = poweredByDefault;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public boolean fictionalByDefault() {
        return fictionalByDefault;
    }

    /** Subjects of this category have powers unless the dataset says otherwise. */
    public boolean poweredByDefault() {
        return poweredByDefault;
    }

    @JsonCreator
    public static Category fromId(String id) {
        if (id == null) {
            return OTHER;
        }
        String normalized = id.trim().toLowerCase().replace('_', '-');
        for (Category c : values()) {
            if (c.id.equals(normalized)) {
                return c;
            }
        }
        return OTHER;
    }
}
