package dev.ebullient.detective.chat;

import java.util.List;

import dev.ebullient.detective.model.Guess;
import dev.langchain4j.model.output.structured.Description;

public record BeyondDatabaseGuesses(
        @Description("Up to 5 well-known characters consistent with every confirmed trait, best first") List<Guess> guesses) {
}
