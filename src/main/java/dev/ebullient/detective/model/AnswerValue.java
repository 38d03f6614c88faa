package dev.ebullient.detective.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AnswerValue {
    YES("yes", "Yes"),
    NO("no", "No"),
    PROBABLY("probably", "Probably"),
    PROBABLY_NOT("probably_not", "Probably not"),
    DONT_KNOW("dont_know", "Don't know");

    private final String value;
    private final String display;

    AnswerValue(String value, String display) {
        this.value = value;
        this.display = display;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String display() {
        return display;
    }

    public boolean isNegative() {
        return this == NO || this == PROBABLY_NOT;
    }

    public boolean isPositive() {
        return this == YES || this == PROBABLY;
    }

    /** Probably / probably not: the player is not sure. */
    public boolean isHedged() {
        return this == PROBABLY || this == PROBABLY_NOT;
    }

    @JsonCreator
    public static AnswerValue fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Answer is required");
        }
        String normalized = value.trim().toLowerCase().replace(' ', '_').replace("'", "");
        for (AnswerValue answer : values()) {
            if (answer.value.equals(normalized)) {
                return answer;
            }
        }
        throw new IllegalArgumentException("Unknown answer: " + value);
    }
}
