package dev.ebullient.detective.chat;

import dev.langchain4j.service.MemoryId;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.guardrail.OutputGuardrails;
import io.quarkiverse.langchain4j.RegisterAiService;

@RegisterAiService(chatMemoryProviderSupplier = RegisterAiService.NoChatMemoryProviderSupplier.class)
@OutputGuardrails(DetectiveProposalGuardrail.class)
public interface DetectiveAssistant {

    @SystemMessage(fromResource = "prompts/detective-system.txt")
    @UserMessage(fromResource = "prompts/detective-user.txt")
    DetectiveProposal propose(
            @MemoryId String sessionId,
            int turn,
            String traits,
            String history,
            String rejected,
            String ambiguous,
            String candidates);
}
