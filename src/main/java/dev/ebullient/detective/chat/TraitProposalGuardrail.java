package dev.ebullient.detective.chat;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.guardrail.OutputGuardrail;
import dev.langchain4j.guardrail.OutputGuardrailResult;
import io.quarkus.logging.Log;

@ApplicationScoped
public class TraitProposalGuardrail implements OutputGuardrail {

    static final String FORMAT = "Return a valid JSON object with fields: key (string or null), value (string or null), confidence (number).";

    @Inject
    ObjectMapper objectMapper;

    @Override
    public OutputGuardrailResult validate(AiMessage responseFromLLM) {
        String json = ParsedOracleReply.jsonObject(responseFromLLM.text());
        if (json == null) {
            return reprompt("No JSON object", new IllegalArgumentException("reply holds no JSON object"), FORMAT);
        }
        try {
            TraitProposal proposal = objectMapper.readValue(json, TraitProposal.class);
            if (proposal.key() != null && !proposal.key().isBlank()
                    && (proposal.value() == null || proposal.value().isBlank())) {
                return reprompt("Missing value", new IllegalArgumentException("value is blank for key " + proposal.key()),
                        FORMAT + " When key is set, value MUST be set too.");
            }
            Log.debugf("Trait proposal: %s", proposal);
            return OutputGuardrailResult.successWith(json, proposal);
        } catch (JsonProcessingException e) {
            return reprompt("Invalid JSON", e, FORMAT);
        }
    }
}
