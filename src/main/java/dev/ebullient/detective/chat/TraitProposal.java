package dev.ebullient.detective.chat;

import dev.langchain4j.model.output.structured.Description;

public record TraitProposal(
        @Description("Trait key, one of the keys listed in the system instructions, or null if the answer confirms nothing") String key,
        @Description("Trait value in lower_snake_case, for example female, comic_book, true") String value,
        @Description("Confidence between 0.1 and 0.99") Double confidence) {

    public boolean isEmpty() {
        return key == null || key.isBlank() || value == null || value.isBlank();
    }
}
