package dev.ebullient.detective.model;

public record Guess(
        String name,
        double confidence) {

    public Guess withConfidence(double confidence) {
        return new Guess(name, confidence);
    }

    public boolean isNamed(String other) {
        return other != null && name.trim().equalsIgnoreCase(other.trim());
    }
}
