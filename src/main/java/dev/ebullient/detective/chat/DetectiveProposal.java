package dev.ebullient.detective.chat;

import java.util.List;

import dev.ebullient.detective.model.Guess;
import dev.langchain4j.model.output.structured.Description;

public record DetectiveProposal(
        @Description("The next yes/no question to ask, at most 20 words") String question,
        @Description("Up to 5 likely characters with a confidence between 0 and 1") List<Guess> topGuesses) {
}
