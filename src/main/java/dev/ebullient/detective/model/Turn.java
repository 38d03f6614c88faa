package dev.ebullient.detective.model;

public record Turn(
        int turnNumber,
        String question,
        AnswerValue answer) {

    public String toPromptLine() {
        return "%d. Q: \"%s\" A: %s".formatted(turnNumber, question, answer.display());
    }
}
