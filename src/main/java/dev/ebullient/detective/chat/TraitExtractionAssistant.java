package dev.ebullient.detective.chat;

import dev.langchain4j.service.MemoryId;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.guardrail.OutputGuardrails;
import io.quarkiverse.langchain4j.RegisterAiService;

@RegisterAiService(chatMemoryProviderSupplier = RegisterAiService.NoChatMemoryProviderSupplier.class)
@OutputGuardrails(TraitProposalGuardrail.class)
public interface TraitExtractionAssistant {

    @SystemMessage(fromResource = "prompts/extract-trait-system.txt")
    @UserMessage(fromResource = "prompts/extract-trait-user.txt")
    TraitProposal extract(
            @MemoryId String sessionId,
            String question,
            String answer,
            String traits);
}
