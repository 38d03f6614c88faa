package dev.ebullient.detective.model;

public record Trait(
        String key,
        String value,
        double confidence,
        int turnAdded) {

    public static final String NEGATION_PREFIX = "NOT_";

    public static Trait negated(String key, String value, double confidence, int turnAdded) {
        return new Trait(key, NEGATION_PREFIX + value, confidence, turnAdded);
    }

    /** NOT_x values rule a value out instead of confirming one. */
    public boolean isNegated() {
        return value != null && value.startsWith(NEGATION_PREFIX);
    }

    /** The value without any negation prefix. */
    public String baseValue() {
        return isNegated() ? value.substring(NEGATION_PREFIX.length()) : value;
    }

    public boolean is(String key, String value) {
        return this.key.equals(key) && this.value.equalsIgnoreCase(value);
    }

    public Trait withConfidence(double confidence) {
        return new Trait(key, value, confidence, turnAdded);
    }

    public String toPromptLine() {
        return "%s=%s (%d%%)".formatted(key, value, Math.round(confidence * 100));
    }
}
