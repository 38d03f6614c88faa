package dev.ebullient.detective.chat;

import dev.langchain4j.service.MemoryId;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.guardrail.OutputGuardrails;
import io.quarkiverse.langchain4j.RegisterAiService;

/**
 * Asked only once every known character has been ruled out.
 */
@RegisterAiService(chatMemoryProviderSupplier = RegisterAiService.NoChatMemoryProviderSupplier.class)
@OutputGuardrails(BeyondDatabaseGuardrail.class)
public interface BeyondDatabaseAssistant {

    @SystemMessage(fromResource = "prompts/beyond-database-system.txt")
    @UserMessage(fromResource = "prompts/beyond-database-user.txt")
    BeyondDatabaseGuesses guess(
            @MemoryId String sessionId,
            String traits,
            String history,
            String rejected);
}
